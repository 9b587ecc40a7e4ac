package com.cardregistry.governance;

import com.cardregistry.common.SerialTransactionRunner;
import com.cardregistry.common.UInt128;
import com.cardregistry.common.exception.CapabilityDeniedException;
import com.cardregistry.metadata.LevelUriCatalog;
import com.cardregistry.metadata.MetadataResolver;
import com.cardregistry.state.CardLimits;
import com.cardregistry.state.CardStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Administrative configuration of the registry: limits, level URIs, base URI,
 * maintenance mode and capability grants.
 *
 * Every operation requires {@link Capability#ADMIN}. None is blocked by the halt
 * switch, otherwise a halted registry could never be resumed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistryAdminService {

    private final CapabilityChecker capabilityChecker;
    private final RoleRegistry roleRegistry;
    private final MaintenanceMode maintenanceMode;
    private final CardLimits cardLimits;
    private final CardStateStore cardStateStore;
    private final LevelUriCatalog levelUriCatalog;
    private final MetadataResolver metadataResolver;
    private final SerialTransactionRunner runner;

    /**
     * @throws IllegalArgumentException if a card already holds more uses than the new maximum
     */
    public void setMaxUses(String actorId, BigInteger maxUses) {
        runner.run(() -> {
            requireAdmin(actorId);
            UInt128.require(maxUses, "maxUses");
            BigInteger highest = cardStateStore.highestRecordedUses();
            if (maxUses.compareTo(highest) < 0) {
                throw new IllegalArgumentException(String.format(
                    "maxUses %s is below uses already recorded on a card (%s)", maxUses, highest));
            }
            cardLimits.setMaxUses(maxUses);
            log.info("maxUses set to {} by {}", maxUses, actorId);
        });
    }

    public void setMaxOwns(String actorId, BigInteger maxOwns) {
        runner.run(() -> {
            requireAdmin(actorId);
            cardLimits.setMaxOwns(maxOwns);
            log.info("maxOwns set to {} by {}", maxOwns, actorId);
        });
    }

    public void setLevelUri(String actorId, BigInteger level, String uri) {
        runner.run(() -> {
            requireAdmin(actorId);
            levelUriCatalog.put(level, uri);
        });
    }

    public void setLevelUris(String actorId, List<BigInteger> levels, List<String> uris) {
        runner.run(() -> {
            requireAdmin(actorId);
            levelUriCatalog.putAll(levels, uris);
        });
    }

    public void setBaseUri(String actorId, String baseUri) {
        runner.run(() -> {
            requireAdmin(actorId);
            metadataResolver.setBaseUri(baseUri);
        });
    }

    public void pause(String actorId) {
        runner.run(() -> {
            requireAdmin(actorId);
            maintenanceMode.halt();
        });
    }

    public void unpause(String actorId) {
        runner.run(() -> {
            requireAdmin(actorId);
            maintenanceMode.resume();
        });
    }

    public boolean grantCapability(String actorId, String granteeId, Capability capability) {
        return runner.call(() -> {
            requireAdmin(actorId);
            return roleRegistry.grant(granteeId, capability, actorId);
        });
    }

    public boolean revokeCapability(String actorId, String granteeId, Capability capability) {
        return runner.call(() -> {
            requireAdmin(actorId);
            return roleRegistry.revoke(granteeId, capability);
        });
    }

    private void requireAdmin(String actorId) {
        if (!capabilityChecker.hasCapability(actorId, Capability.ADMIN)) {
            throw new CapabilityDeniedException(actorId, Capability.ADMIN.name());
        }
    }
}
