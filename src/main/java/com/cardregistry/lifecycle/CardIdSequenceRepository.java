package com.cardregistry.lifecycle;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the card identifier sequence.
 */
@Repository
public interface CardIdSequenceRepository extends JpaRepository<CardIdSequence, Long> {
}
