package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.config.CacheConfig;
import com.millennicare.identity.entity.Role;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.entity.UserRole;
import com.millennicare.identity.repository.RoleRepository;
import com.millennicare.identity.repository.UserRoleRepository;
import com.millennicare.identity.service.RoleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoleServiceImpl implements RoleService {

    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.ROLE_BY_NAME,
            keyGenerator = "lowerCaseStringKeyGenerator",
            unless = "#result == null")
    public Optional<RoleRef> findByName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return roleRepository.findByName(normalize(name))
                .map(r -> new RoleRef(r.getId(), r.getName()));
    }

    @Override
    @Transactional
    public boolean assign(User user, String roleName) {
        Optional<Role> role = roleName == null
                ? Optional.empty()
                : roleRepository.findByName(normalize(roleName));
        if (role.isEmpty()) {
            return false;
        }
        if (!userRoleRepository.existsByUserIdAndRoleId(user.getId(), role.get().getId())) {
            userRoleRepository.save(UserRole.builder().user(user).role(role.get()).build());
            log.debug("Assigned role {} to user {}", role.get().getName(), user.getId());
        }
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> roleNamesOf(UUID userId) {
        return userRoleRepository.findRoleNamesByUserId(userId);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
