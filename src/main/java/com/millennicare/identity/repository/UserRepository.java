package com.millennicare.identity.repository;

import com.millennicare.identity.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    /** Callers pass the normalized (trimmed, lower-cased) email. */
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
