package com.millennicare.identity.repository;

import com.millennicare.identity.entity.VerificationCode;
import com.millennicare.identity.entity.VerificationPurpose;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface VerificationCodeRepository extends JpaRepository<VerificationCode, UUID> {

    Optional<VerificationCode> findByTokenHash(String tokenHash);

    Optional<VerificationCode> findByUserIdAndPurpose(UUID userId, VerificationPurpose purpose);

    /** Bulk delete runs immediately, ahead of the insert of a superseding code. */
    @Modifying
    @Query("delete from VerificationCode v where v.user.id = :userId and v.purpose = :purpose")
    int deleteByUserAndPurpose(@Param("userId") UUID userId, @Param("purpose") VerificationPurpose purpose);

    /**
     * Claims a code by deleting it. Of two concurrent consumers exactly one sees 1;
     * the other sees 0.
     */
    @Modifying
    @Query("delete from VerificationCode v where v.id = :id")
    int consume(@Param("id") UUID id);

    @Modifying
    @Query("delete from VerificationCode v where v.expiresAt < :now")
    int deleteAllExpired(@Param("now") Instant now);
}
