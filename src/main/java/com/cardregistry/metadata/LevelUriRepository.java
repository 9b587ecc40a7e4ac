package com.cardregistry.metadata;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;

/**
 * Repository for level URIs.
 */
@Repository
public interface LevelUriRepository extends JpaRepository<LevelUri, BigInteger> {
}
