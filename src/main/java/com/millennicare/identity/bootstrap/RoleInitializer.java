package com.millennicare.identity.bootstrap;

import com.millennicare.identity.entity.Account;
import com.millennicare.identity.entity.AuthProvider;
import com.millennicare.identity.entity.Role;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.repository.AccountRepository;
import com.millennicare.identity.repository.RoleRepository;
import com.millennicare.identity.repository.UserRepository;
import com.millennicare.identity.service.PasswordHasher;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.utils.Emails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Seeds the fixed role set and, when {@code app.init.admin.*} is configured, one verified admin.
 * Safe to run on every start.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class RoleInitializer implements CommandLineRunner {

    static final List<String> SEED_ROLES = List.of(Role.ADMIN, Role.CARESEEKER, Role.CAREGIVER);

    private final RoleRepository roleRepository;
    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final RoleService roleService;
    private final PasswordHasher passwordHasher;

    @Value("${app.init.admin.email:}")
    private String adminEmail;

    @Value("${app.init.admin.password:}")
    private String adminPlainPassword;

    @Override
    @Transactional
    public void run(String... args) {
        SEED_ROLES.forEach(this::createRoleIfNotExists);

        if (StringUtils.hasText(adminEmail) && StringUtils.hasText(adminPlainPassword)) {
            createAdminIfNotExists(Emails.normalize(adminEmail), adminPlainPassword);
        } else {
            log.debug("No bootstrap admin configured");
        }
    }

    private void createRoleIfNotExists(String name) {
        if (roleRepository.existsByName(name)) {
            return;
        }
        roleRepository.save(Role.builder().name(name).build());
        log.info("Role '{}' added", name);
    }

    private void createAdminIfNotExists(String email, String rawPassword) {
        User admin = userRepository.findByEmail(email).orElseGet(() -> {
            User user = userRepository.save(User.builder()
                    .email(email)
                    .name("Administrator")
                    .emailVerified(true)
                    .build());
            accountRepository.save(Account.builder()
                    .user(user)
                    .providerId(AuthProvider.CREDENTIALS.id())
                    .providerAccountId(user.getId().toString())
                    .passwordHash(passwordHasher.hash(rawPassword))
                    .build());
            log.info("Admin '{}' added", email);
            return user;
        });
        roleService.assign(admin, Role.ADMIN);
    }
}
