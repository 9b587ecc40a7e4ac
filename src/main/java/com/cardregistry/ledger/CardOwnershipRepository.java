package com.cardregistry.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for card ownership records.
 */
@Repository
public interface CardOwnershipRepository extends JpaRepository<CardOwnership, Long> {

    Optional<CardOwnership> findByCardId(Long cardId);

    Optional<CardOwnership> findByOwnerIdAndOwnerIndex(String ownerId, long ownerIndex);

    long countByOwnerId(String ownerId);
}
