package com.cardregistry.governance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process halt switch toggled by {@link RegistryAdminService}.
 */
@Component
@Slf4j
public class MaintenanceMode implements HaltSwitch {

    private final AtomicBoolean halted;

    public MaintenanceMode(@Value("${card-registry.start-halted:false}") boolean startHalted) {
        this.halted = new AtomicBoolean(startHalted);
        if (startHalted) {
            log.warn("Card registry starting in maintenance mode");
        }
    }

    @Override
    public boolean isHalted() {
        return halted.get();
    }

    void halt() {
        if (halted.compareAndSet(false, true)) {
            log.warn("Card registry halted");
        }
    }

    void resume() {
        if (halted.compareAndSet(true, false)) {
            log.info("Card registry resumed");
        }
    }
}
