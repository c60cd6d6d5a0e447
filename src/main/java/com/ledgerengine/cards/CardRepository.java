package com.ledgerengine.cards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for card persistence.
 */
@Repository
public interface CardRepository extends JpaRepository<Card, String> {

    Optional<Card> findByAccountId(String accountId);

    boolean existsByAccountId(String accountId);
}
