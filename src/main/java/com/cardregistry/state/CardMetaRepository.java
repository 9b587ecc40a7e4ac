package com.cardregistry.state;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Repository for card meta records.
 */
@Repository
public interface CardMetaRepository extends JpaRepository<CardMeta, Long> {

    Optional<CardMeta> findByCardId(Long cardId);

    @Query("select max(m.uses) from CardMeta m")
    Optional<BigInteger> findHighestUses();
}
