package com.millennicare.identity.repository;

import com.millennicare.identity.entity.Session;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

public interface SessionRepository extends JpaRepository<Session, UUID> {

    /** Returns the number of rows removed (0 when the session was already gone). */
    @Modifying
    @Query("delete from Session s where s.id = :id")
    int deleteSessionById(@Param("id") UUID id);

    @Modifying
    @Query("delete from Session s where s.expiresAt <= :now")
    int deleteAllExpired(@Param("now") Instant now);
}
