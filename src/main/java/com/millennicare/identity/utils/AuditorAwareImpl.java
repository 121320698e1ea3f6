package com.millennicare.identity.utils;

import com.millennicare.identity.SecurityConfig.AuthenticatedSession;
import com.millennicare.identity.entity.Role;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Auditor for {@code created_by}/{@code modified_by}: {@code SYSTEM} for anonymous
 * flows (sign-up, sign-in, OAuth, startup seeding), otherwise {@code USER:<id>} or {@code ADMIN:<id>}.
 */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()
                || !(auth.getPrincipal() instanceof AuthenticatedSession principal)) {
            return Optional.of(SYSTEM);
        }
        String prefix = principal.hasRole(Role.ADMIN) ? "ADMIN" : "USER";
        return Optional.of(prefix + ":" + principal.userId());
    }
}
