package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.Validators.PasswordPolicy;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.entity.Account;
import com.millennicare.identity.entity.AuthProvider;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.entity.VerificationCode;
import com.millennicare.identity.entity.VerificationPurpose;
import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.repository.AccountRepository;
import com.millennicare.identity.repository.UserRepository;
import com.millennicare.identity.service.EmailSender;
import com.millennicare.identity.service.PasswordHasher;
import com.millennicare.identity.service.PasswordResetService;
import com.millennicare.identity.service.VerificationCodeService;
import com.millennicare.identity.utils.Emails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetServiceImpl implements PasswordResetService {

    static final String RESET_NOT_FOUND = "Reset link not found";
    static final String RESET_INVALID = "Invalid reset link";
    static final String RESET_EXPIRED = "Reset link expired";

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final VerificationCodeService codeService;
    private final PasswordHasher passwordHasher;
    private final EmailSender emailSender;
    private final AuthProperties authProperties;
    private final Clock clock;

    @Override
    @Transactional
    public void forgotPassword(String email) {
        Optional<User> user = userRepository.findByEmail(Emails.normalize(email));
        if (user.isEmpty()) {
            log.debug("Forgot-password for unknown email ignored");
            return;
        }
        if (accountRepository.findByUserIdAndProviderId(user.get().getId(), AuthProvider.CREDENTIALS.id()).isEmpty()) {
            log.debug("Forgot-password for user {} without credentials ignored", user.get().getId());
            return;
        }
        VerificationCodeService.IssuedCode issued = codeService.issue(user.get(), VerificationPurpose.FORGOT_PASSWORD);
        String link = authProperties.links().resetPasswordUrl(issued.token());
        String to = user.get().getEmail();
        AfterCommit.run(() -> emailSender.sendPasswordResetEmail(to, link));
        log.info("Issued password reset for user {}", user.get().getId());
    }

    @Override
    @Transactional
    public AuthResult<Void> resetPassword(String token, String newPassword) {
        if (!PasswordPolicy.isSatisfiedBy(newPassword)) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, PasswordPolicy.MESSAGE);
        }
        Optional<VerificationCode> found = codeService.findByToken(token);
        if (found.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.NOT_FOUND, RESET_NOT_FOUND);
        }
        VerificationCode stored = found.get();
        if (stored.getPurpose() != VerificationPurpose.FORGOT_PASSWORD) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, RESET_INVALID);
        }
        if (stored.isExpired(clock.instant())) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, RESET_EXPIRED);
        }

        User user = stored.getUser();
        Optional<Account> account = accountRepository.findByUserIdAndProviderId(user.getId(), AuthProvider.CREDENTIALS.id());
        if (account.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.NOT_FOUND, "Credentials account not found");
        }
        account.get().setPasswordHash(passwordHasher.hash(newPassword));

        if (!codeService.consume(stored)) {
            return AuthFailures.fail(AuthErrorKind.NOT_FOUND, RESET_NOT_FOUND);
        }
        log.info("Password reset for user {}", user.getId());
        return AuthResult.ok();
    }
}
