package com.cardregistry.governance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One capability held by one actor.
 */
@Entity
@Table(name = "role_grants", indexes = {
    @Index(name = "idx_role_grants_actor", columnList = "actor_id, capability", unique = true)
})
@Data
@NoArgsConstructor
public class RoleGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long grantId;

    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Capability capability;

    /**
     * Admin that issued the grant, null for grants made at bootstrap.
     */
    private String grantedBy;

    @Column(name = "created_at")
    private Instant createdAt;

    public RoleGrant(String actorId, Capability capability, String grantedBy) {
        this.actorId = actorId;
        this.capability = capability;
        this.grantedBy = grantedBy;
        this.createdAt = Instant.now();
    }
}
