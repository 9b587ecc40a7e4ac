package com.cardregistry.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for operator approvals.
 */
@Repository
public interface OperatorApprovalRepository extends JpaRepository<OperatorApproval, Long> {

    boolean existsByOwnerIdAndOperatorId(String ownerId, String operatorId);

    long deleteByOwnerIdAndOperatorId(String ownerId, String operatorId);
}
