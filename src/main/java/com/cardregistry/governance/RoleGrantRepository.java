package com.cardregistry.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for capability grants.
 */
@Repository
public interface RoleGrantRepository extends JpaRepository<RoleGrant, Long> {

    boolean existsByActorIdAndCapability(String actorId, Capability capability);

    long deleteByActorIdAndCapability(String actorId, Capability capability);
}
