package com.millennicare.identity.repository;

import com.millennicare.identity.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface UserRoleRepository extends JpaRepository<UserRole, UUID> {

    boolean existsByUserIdAndRoleId(UUID userId, UUID roleId);

    @Query("select ur.role.name from UserRole ur where ur.user.id = :userId order by ur.role.name")
    List<String> findRoleNamesByUserId(@Param("userId") UUID userId);
}
