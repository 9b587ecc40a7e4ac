package com.cardregistry.governance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Grants every capability to the configured bootstrap admins on startup,
 * so a fresh registry always has someone able to administer it.
 */
@Component
@Slf4j
public class RoleBootstrap implements ApplicationRunner {

    private final RoleRegistry roleRegistry;
    private final List<String> bootstrapAdmins;

    public RoleBootstrap(RoleRegistry roleRegistry,
                         @Value("${card-registry.bootstrap.admins:}") List<String> bootstrapAdmins) {
        this.roleRegistry = roleRegistry;
        this.bootstrapAdmins = bootstrapAdmins;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (String admin : bootstrapAdmins) {
            if (admin == null || admin.isBlank()) {
                continue;
            }
            for (Capability capability : Capability.values()) {
                roleRegistry.grant(admin.trim(), capability, null);
            }
        }
        if (bootstrapAdmins.stream().allMatch(a -> a == null || a.isBlank())) {
            log.warn("No bootstrap admins configured, registry cannot be administered until one is granted");
        }
    }
}
