package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.Validators.PasswordPolicy;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.dto.SignUpRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.entity.Account;
import com.millennicare.identity.entity.AuthProvider;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.entity.VerificationCode;
import com.millennicare.identity.entity.VerificationPurpose;
import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.model.FieldPatch;
import com.millennicare.identity.model.UserUpdate;
import com.millennicare.identity.repository.AccountRepository;
import com.millennicare.identity.repository.UserRepository;
import com.millennicare.identity.service.EmailSender;
import com.millennicare.identity.service.PasswordHasher;
import com.millennicare.identity.service.RegistrationService;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.service.VerificationCodeService;
import com.millennicare.identity.utils.Emails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationServiceImpl implements RegistrationService {

    static final String EMAIL_TAKEN = "A user already exists with this email address";
    static final String CODE_NOT_FOUND = "Verification code not found";
    static final String CODE_INVALID = "Invalid verification code";
    static final String CODE_EXPIRED = "Verification code expired";

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final RoleService roleService;
    private final VerificationCodeService codeService;
    private final PasswordHasher passwordHasher;
    private final EmailSender emailSender;
    private final AuthProperties authProperties;
    private final Clock clock;

    /**
     * Creates an unverified user with a credentials account and the requested roles,
     * then emails a verification code. No session is started.
     * Role names are checked by the caller; names without a role row are skipped.
     */
    @Override
    @Transactional
    public AuthResult<UserSummary> signUp(SignUpRequest request) {
        final String email = Emails.normalize(request.getEmail());
        if (!StringUtils.hasText(email)) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, "Email must be provided.");
        }
        if (!PasswordPolicy.isSatisfiedBy(request.getPassword())) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, PasswordPolicy.MESSAGE);
        }
        if (userRepository.existsByEmail(email)) {
            return AuthFailures.fail(AuthErrorKind.CONFLICT, EMAIL_TAKEN);
        }

        String passwordHash = passwordHasher.hash(request.getPassword());

        User user = userRepository.save(User.builder()
                .email(email)
                .name(request.getName().trim())
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .emailVerified(false)
                .build());

        accountRepository.save(Account.builder()
                .user(user)
                .providerId(AuthProvider.CREDENTIALS.id())
                .providerAccountId(user.getId().toString())
                .passwordHash(passwordHash)
                .build());

        if (request.getRoles() != null) {
            for (String roleName : request.getRoles()) {
                if (!roleService.assign(user, roleName)) {
                    log.warn("Sign-up skipped unknown role '{}'", roleName);
                }
            }
        }

        try {
            userRepository.flush();
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent sign-up lost the race for an email address");
            return AuthFailures.fail(AuthErrorKind.CONFLICT, EMAIL_TAKEN);
        }

        sendVerification(user);
        log.info("Registered user {}", user.getId());
        return AuthResult.success(UserSummary.of(user, roleService.roleNamesOf(user.getId())));
    }

    @Override
    @Transactional
    public AuthResult<Void> verifyEmail(String token, String code) {
        Optional<VerificationCode> found = codeService.findByToken(token);
        if (found.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.NOT_FOUND, CODE_NOT_FOUND);
        }
        VerificationCode stored = found.get();
        if (stored.getPurpose() != VerificationPurpose.VERIFY_EMAIL) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, CODE_INVALID);
        }
        if (StringUtils.hasText(code) && !codeService.matchesCode(stored, code)) {
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, CODE_INVALID);
        }
        if (stored.isExpired(clock.instant())) {
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, CODE_EXPIRED);
        }

        User user = stored.getUser();
        UserUpdate.builder().emailVerified(FieldPatch.of(true)).build().applyTo(user);

        if (!codeService.consume(stored)) {
            return AuthFailures.fail(AuthErrorKind.NOT_FOUND, CODE_NOT_FOUND);
        }
        log.info("Verified email for user {}", user.getId());
        return AuthResult.ok();
    }

    @Override
    @Transactional
    public void resendVerification(String email) {
        Optional<User> user = userRepository.findByEmail(Emails.normalize(email));
        if (user.isEmpty() || user.get().isEmailVerified()) {
            log.debug("Resend verification ignored");
            return;
        }
        sendVerification(user.get());
    }

    private void sendVerification(User user) {
        VerificationCodeService.IssuedCode issued = codeService.issue(user, VerificationPurpose.VERIFY_EMAIL);
        String link = authProperties.links().verifyEmailUrl(issued.token());
        String to = user.getEmail();
        AfterCommit.run(() -> emailSender.sendVerificationEmail(to, issued.code(), link));
    }
}
