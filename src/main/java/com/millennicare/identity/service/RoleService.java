package com.millennicare.identity.service;

import com.millennicare.identity.entity.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RoleService {

    /** Immutable view of a seeded role, safe to cache across transactions. */
    record RoleRef(UUID id, String name) {}

    Optional<RoleRef> findByName(String name);

    /**
     * Adds the membership unless the user already has it.
     *
     * @return false when no role has that name
     */
    boolean assign(User user, String roleName);

    List<String> roleNamesOf(UUID userId);
}
