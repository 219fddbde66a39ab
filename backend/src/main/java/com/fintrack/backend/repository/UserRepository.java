package com.fintrack.backend.repository;

import com.fintrack.backend.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for UserAccount entity operations
 */
@Repository
public interface UserRepository extends JpaRepository<UserAccount, UUID> {

    /**
     * Find user by email, exact match
     * @param email the email
     * @return Optional containing user if found
     */
    Optional<UserAccount> findByEmail(String email);

    /**
     * Check if email exists
     * @param email the email
     * @return true if exists
     */
    boolean existsByEmail(String email);
}
