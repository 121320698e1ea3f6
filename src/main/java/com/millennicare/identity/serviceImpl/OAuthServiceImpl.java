package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.dto.OAuthAuthorization;
import com.millennicare.identity.entity.Account;
import com.millennicare.identity.entity.Session;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.model.AccountTokenUpdate;
import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.model.FieldPatch;
import com.millennicare.identity.model.UserUpdate;
import com.millennicare.identity.oauth.OAuthGatewayException;
import com.millennicare.identity.oauth.OAuthProviderClient;
import com.millennicare.identity.oauth.OAuthProviderRegistry;
import com.millennicare.identity.oauth.ProviderProfile;
import com.millennicare.identity.oauth.ProviderTokens;
import com.millennicare.identity.repository.AccountRepository;
import com.millennicare.identity.repository.UserRepository;
import com.millennicare.identity.service.OAuthService;
import com.millennicare.identity.service.OAuthStateStore;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.service.SessionService;
import com.millennicare.identity.utils.Emails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * OAuth federation: state creation at initiate, then code exchange, profile fetch and
 * identity resolution at callback. The callback ends with a session like a password sign-in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OAuthServiceImpl implements OAuthService {

    static final String UNSUPPORTED_PROVIDER = "Unsupported OAuth provider";
    static final String INVALID_ROLE = "Invalid role";
    static final String INVALID_STATE = "Invalid or expired OAuth state";
    static final String PROVIDER_UNAVAILABLE = "OAuth provider is unavailable";

    private final OAuthProviderRegistry providerRegistry;
    private final OAuthStateStore stateStore;
    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final RoleService roleService;
    private final SessionService sessionService;
    private final SessionTokenIssuer tokenIssuer;
    private final AuthProperties authProperties;
    private final Clock clock;

    @Override
    public AuthResult<OAuthAuthorization> initiate(String provider, String roleName) {
        Optional<OAuthProviderClient> client = providerRegistry.find(provider);
        if (client.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, UNSUPPORTED_PROVIDER);
        }
        String role = roleName == null ? "" : roleName.trim().toLowerCase(Locale.ROOT);
        if (!authProperties.isSelfAssignable(role) || roleService.findByName(role).isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, INVALID_ROLE);
        }
        String state = stateStore.create(role);
        return AuthResult.success(new OAuthAuthorization(
                client.get().provider().id(),
                client.get().authorizationUrl(state)));
    }

    @Override
    @Transactional
    public AuthResult<AuthTokens> callback(String provider, String code, String state) {
        // State is single use: redeem it before anything else can reject the request.
        Optional<String> roleName = stateStore.redeem(state);
        if (roleName.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, INVALID_STATE);
        }
        Optional<OAuthProviderClient> client = providerRegistry.find(provider);
        if (client.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, UNSUPPORTED_PROVIDER);
        }
        if (!StringUtils.hasText(code)) {
            return AuthFailures.fail(AuthErrorKind.BAD_REQUEST, "Authorization code is required");
        }

        final ProviderTokens tokens;
        final ProviderProfile profile;
        try {
            tokens = client.get().exchangeCode(code);
            profile = client.get().fetchProfile(tokens);
        } catch (OAuthGatewayException e) {
            log.warn("OAuth {} failed: {}", client.get().provider().id(), e.getMessage());
            return e.getKind() == OAuthGatewayException.Kind.UNREACHABLE
                    ? AuthFailures.fail(AuthErrorKind.SERVICE_UNAVAILABLE, PROVIDER_UNAVAILABLE)
                    : AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, AuthFailures.PROVIDER_AUTH_FAILED);
        }
        if (!StringUtils.hasText(profile.email())) {
            log.warn("OAuth {} profile has no email", client.get().provider().id());
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, AuthFailures.PROVIDER_AUTH_FAILED);
        }

        String providerId = client.get().provider().id();
        Optional<User> resolved = resolveUser(providerId, profile, tokens, roleName.get());
        if (resolved.isEmpty()) {
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, AuthFailures.PROVIDER_AUTH_FAILED);
        }
        User user = resolved.get();
        try {
            userRepository.flush();
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent OAuth sign-in lost the race for a {} account", providerId);
            return AuthFailures.fail(AuthErrorKind.UNAUTHORIZED, AuthFailures.PROVIDER_AUTH_FAILED);
        }

        Session session = sessionService.create(user);
        log.info("User {} signed in with {} (session {})", user.getId(), providerId, session.getId());
        return AuthResult.success(tokenIssuer.issue(user.getId(), session));
    }

    /**
     * Existing provider account, else link to the user with that email, else a new verified user.
     * Empty when the email belongs to a user already linked to a different account at this provider.
     */
    private Optional<User> resolveUser(String providerId, ProviderProfile profile, ProviderTokens tokens, String roleName) {
        Optional<Account> linked = accountRepository.findByProviderIdAndProviderAccountId(providerId, profile.providerAccountId());
        if (linked.isPresent()) {
            tokenUpdate(tokens).applyTo(linked.get());
            User user = linked.get().getUser();
            profileUpdate(profile).applyTo(user);
            return Optional.of(user);
        }

        String email = Emails.normalize(profile.email());
        Optional<User> byEmail = userRepository.findByEmail(email);
        if (byEmail.isPresent()) {
            User user = byEmail.get();
            if (accountRepository.findByUserIdAndProviderId(user.getId(), providerId).isPresent()) {
                log.warn("User {} already has a different {} account linked", user.getId(), providerId);
                return Optional.empty();
            }
            UserUpdate.builder().emailVerified(FieldPatch.of(true)).build().applyTo(user);
            linkAccount(user, providerId, profile, tokens);
            log.info("Linked {} account to existing user {}", providerId, user.getId());
            return Optional.of(user);
        }

        User user = User.builder().email(email).name(profile.displayName()).emailVerified(true).build();
        profileUpdate(profile).applyTo(user);
        user = userRepository.save(user);
        linkAccount(user, providerId, profile, tokens);
        if (!roleService.assign(user, roleName)) {
            log.warn("OAuth sign-up skipped unknown role '{}'", roleName);
        }
        log.info("Registered user {} via {}", user.getId(), providerId);
        return Optional.of(user);
    }

    private void linkAccount(User user, String providerId, ProviderProfile profile, ProviderTokens tokens) {
        Account account = Account.builder()
                .user(user)
                .providerId(providerId)
                .providerAccountId(profile.providerAccountId())
                .build();
        tokenUpdate(tokens).applyTo(account);
        accountRepository.save(account);
    }

    private AccountTokenUpdate tokenUpdate(ProviderTokens tokens) {
        return AccountTokenUpdate.builder()
                .accessToken(FieldPatch.of(tokens.accessToken()))
                .refreshToken(FieldPatch.ofNonNull(tokens.refreshToken()))
                .idToken(FieldPatch.ofNonNull(tokens.idToken()))
                .accessTokenExpiresAt(tokens.expiresInSeconds() == null
                        ? FieldPatch.unset()
                        : FieldPatch.of(clock.instant().plusSeconds(tokens.expiresInSeconds())))
                .scope(FieldPatch.ofNonNull(tokens.scope()))
                .build();
    }

    /** Provider-reported names replace local ones; absent values leave the local ones alone. */
    private UserUpdate profileUpdate(ProviderProfile profile) {
        return UserUpdate.builder()
                .name(FieldPatch.ofNonNull(StringUtils.hasText(profile.name()) ? profile.name().trim() : null))
                .firstName(FieldPatch.ofNonNull(profile.givenName()))
                .lastName(FieldPatch.ofNonNull(profile.familyName()))
                .build();
    }
}
