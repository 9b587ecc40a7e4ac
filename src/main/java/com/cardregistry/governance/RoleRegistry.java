package com.cardregistry.governance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Table-backed capability policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoleRegistry implements CapabilityChecker {

    private final RoleGrantRepository roleGrantRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean hasCapability(String actorId, Capability capability) {
        if (actorId == null || capability == null) {
            return false;
        }
        return roleGrantRepository.existsByActorIdAndCapability(actorId, capability);
    }

    /**
     * @return true if the grant was new
     */
    @Transactional
    public boolean grant(String actorId, Capability capability, String grantedBy) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("Actor cannot be blank");
        }
        if (roleGrantRepository.existsByActorIdAndCapability(actorId, capability)) {
            return false;
        }
        roleGrantRepository.save(new RoleGrant(actorId, capability, grantedBy));
        log.info("Granted {} to {}", capability, actorId);
        return true;
    }

    /**
     * @return true if a grant was removed
     */
    @Transactional
    public boolean revoke(String actorId, Capability capability) {
        boolean removed = roleGrantRepository.deleteByActorIdAndCapability(actorId, capability) > 0;
        if (removed) {
            log.info("Revoked {} from {}", capability, actorId);
        }
        return removed;
    }
}
