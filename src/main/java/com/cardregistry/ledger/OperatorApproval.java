package com.cardregistry.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Standing approval letting an operator act on every card of an owner.
 */
@Entity
@Table(name = "operator_approvals", indexes = {
    @Index(name = "idx_operator_approval", columnList = "owner_id, operator_id", unique = true)
})
@Data
@NoArgsConstructor
public class OperatorApproval {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long approvalId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "operator_id", nullable = false)
    private String operatorId;

    @Column(name = "created_at")
    private Instant createdAt;

    public OperatorApproval(String ownerId, String operatorId) {
        this.ownerId = ownerId;
        this.operatorId = operatorId;
        this.createdAt = Instant.now();
    }
}
