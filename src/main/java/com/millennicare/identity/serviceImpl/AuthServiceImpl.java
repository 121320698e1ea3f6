package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.SecurityConfig.JwtTokenProviderConfig;
import com.millennicare.identity.SecurityConfig.TokenClaims;
import com.millennicare.identity.SecurityConfig.TokenType;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.dto.SignInRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.entity.Account;
import com.millennicare.identity.entity.AuthProvider;
import com.millennicare.identity.entity.Session;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.repository.AccountRepository;
import com.millennicare.identity.repository.UserRepository;
import com.millennicare.identity.service.AuthService;
import com.millennicare.identity.service.PasswordHasher;
import com.millennicare.identity.service.RegistrationService;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.service.SessionService;
import com.millennicare.identity.utils.Emails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    static final String INVALID_REFRESH = "Invalid or expired refresh token";
    static final String SESSION_NOT_FOUND = "Session not found";

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final PasswordHasher passwordHasher;
    private final SessionService sessionService;
    private final RoleService roleService;
    private final RegistrationService registrationService;
    private final JwtTokenProviderConfig tokenProvider;
    private final SessionTokenIssuer tokenIssuer;
    private final AuthProperties authProperties;

    /**
     * Every credential failure yields the same error, and a dummy verification runs when
     * there is no hash to check, so neither message nor timing tells whether the email exists.
     */
    @Override
    @Transactional
    public AuthResult<AuthTokens> signIn(SignInRequest request) {
        Optional<User> user = userRepository.findByEmail(Emails.normalize(request.getEmail()));
        Optional<Account> account = user
                .flatMap(u -> accountRepository.findByUserIdAndProviderId(u.getId(), AuthProvider.CREDENTIALS.id()))
                .filter(a -> StringUtils.hasText(a.getPasswordHash()));

        if (account.isEmpty()) {
            passwordHasher.verifyDummy(request.getPassword());
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, AuthFailures.INVALID_CREDENTIALS);
        }
        if (!passwordHasher.verify(request.getPassword(), account.get().getPasswordHash())) {
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, AuthFailures.INVALID_CREDENTIALS);
        }

        User signedIn = user.get();
        if (!signedIn.isEmailVerified() && authProperties.resendVerificationOnSignIn()) {
            registrationService.resendVerification(signedIn.getEmail());
        }

        Session session = sessionService.create(signedIn);
        log.info("User {} signed in (session {})", signedIn.getId(), session.getId());
        return AuthResult.success(tokenIssuer.issue(signedIn.getId(), session));
    }

    @Override
    @Transactional
    public AuthResult<AuthTokens> refresh(String refreshToken) {
        Optional<TokenClaims> claims = tokenProvider.decode(refreshToken, TokenType.REFRESH);
        if (claims.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, INVALID_REFRESH);
        }
        Optional<Session> session = sessionService.extend(claims.get().sessionId());
        if (session.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.NOT_FOUND, SESSION_NOT_FOUND);
        }
        UUID userId = claims.get().userId();
        if (!session.get().getUser().getId().equals(userId)) {
            log.warn("Refresh token subject does not own session {}", session.get().getId());
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, INVALID_REFRESH);
        }
        return AuthResult.success(tokenIssuer.issue(userId, session.get()));
    }

    @Override
    @Transactional
    public void signOut(UUID sessionId) {
        sessionService.delete(sessionId);
        log.info("Session {} signed out", sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public AuthResult<UserSummary> currentUser(UUID userId) {
        return userRepository.findById(userId)
                .map(u -> AuthResult.success(UserSummary.of(u, roleService.roleNamesOf(u.getId()))))
                .orElseGet(() -> AuthFailures.fail(AuthErrorKind.NOT_FOUND, "User not found"));
    }
}
