package com.millennicare.identity.repository;

import com.millennicare.identity.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    List<Account> findAllByUserId(UUID userId);

    Optional<Account> findByUserIdAndProviderId(UUID userId, String providerId);

    Optional<Account> findByProviderIdAndProviderAccountId(String providerId, String providerAccountId);
}
