package com.millennicare.identity.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.millennicare.identity.SecurityConfig.AuthenticatedSession;
import com.millennicare.identity.SecurityConfig.JwtTokenProviderConfig;
import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.dto.OAuthAuthorization;
import com.millennicare.identity.dto.SignInRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.exception.GlobalExceptionHandler;
import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.service.AuthService;
import com.millennicare.identity.service.OAuthService;
import com.millennicare.identity.service.PasswordResetService;
import com.millennicare.identity.service.RegistrationService;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.service.RoleService.RoleRef;
import com.millennicare.identity.support.TestFixtures;
import com.millennicare.identity.utils.ErrorResponseWriter;
import com.millennicare.identity.utils.SuccessEnvelopeAdvice;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.cookie;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    private static final String SIGN_UP_BODY = """
            {"email":"ada@example.com","password":"Password1!","name":"Ada Lovelace","roles":["%s"]}
            """;

    @Mock
    private RegistrationService registrationService;
    @Mock
    private AuthService authService;
    @Mock
    private PasswordResetService passwordResetService;
    @Mock
    private OAuthService oAuthService;
    @Mock
    private RoleService roleService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        JwtTokenProviderConfig tokenProvider = new JwtTokenProviderConfig(TestFixtures.authProperties(), TestFixtures.fixedClock());
        AuthController controller = new AuthController(registrationService, authService, passwordResetService,
                oAuthService, roleService, tokenProvider, TestFixtures.authProperties());
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(new ErrorResponseWriter(objectMapper)),
                        new SuccessEnvelopeAdvice())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void signUpReturnsCreatedUserInEnvelope() throws Exception {
        when(roleService.findByName("careseeker")).thenReturn(Optional.of(new RoleRef(UUID.randomUUID(), "careseeker")));
        when(registrationService.signUp(any())).thenReturn(AuthResult.success(UserSummary.builder()
                .id(UUID.randomUUID().toString()).email("ada@example.com").name("Ada Lovelace")
                .emailVerified(false).roles(List.of("careseeker")).build()));

        mockMvc.perform(post("/api/auth/sign-up")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SIGN_UP_BODY.formatted("careseeker")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("User created"))
                .andExpect(jsonPath("$.data.email").value("ada@example.com"))
                .andExpect(jsonPath("$.data.emailVerified").value(false));
    }

    @Test
    void signUpWithUnknownRoleIsNotFound() throws Exception {
        when(roleService.findByName("caregiver")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/auth/sign-up")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SIGN_UP_BODY.formatted("caregiver")))
                .andExpect(status().isNotFound())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.detail").value("Role not found: caregiver"));
        verifyNoInteractions(registrationService);
    }

    @Test
    void signUpCannotClaimAdmin() throws Exception {
        mockMvc.perform(post("/api/auth/sign-up")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SIGN_UP_BODY.formatted("admin")))
                .andExpect(status().isNotFound());
        verifyNoInteractions(roleService, registrationService);
    }

    @Test
    void signUpWithWeakPasswordIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/auth/sign-up")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"ada@example.com","password":"weak","name":"Ada","roles":["careseeker"]}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("Validation Error"));
    }

    @Test
    void duplicateSignUpIsConflict() throws Exception {
        when(roleService.findByName("careseeker")).thenReturn(Optional.of(new RoleRef(UUID.randomUUID(), "careseeker")));
        when(registrationService.signUp(any())).thenReturn(AuthResult.failure(AuthErrorKind.CONFLICT, "taken"));

        mockMvc.perform(post("/api/auth/sign-up")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SIGN_UP_BODY.formatted("careseeker")))
                .andExpect(status().isConflict());
    }

    @Test
    void signInReturnsTokensAndSetsRefreshCookie() throws Exception {
        when(authService.signIn(any(SignInRequest.class))).thenReturn(AuthResult.success(tokens("rt-1")));

        mockMvc.perform(post("/api/auth/sign-in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ada@example.com\",\"password\":\"Password1!\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.accessToken").value("at-1"))
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"))
                .andExpect(cookie().value("refreshToken", "rt-1"))
                .andExpect(cookie().httpOnly("refreshToken", true))
                .andExpect(cookie().secure("refreshToken", true))
                .andExpect(cookie().path("refreshToken", "/api/auth"))
                .andExpect(cookie().sameSite("refreshToken", "Strict"));
    }

    @Test
    void failedSignInIsUnauthorizedProblem() throws Exception {
        when(authService.signIn(any(SignInRequest.class)))
                .thenReturn(AuthResult.failure(AuthErrorKind.UNAUTHORIZED, "Incorrect email or password"));

        mockMvc.perform(post("/api/auth/sign-in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ada@example.com\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Incorrect email or password"));
    }

    @Test
    void refreshFallsBackToCookie() throws Exception {
        when(authService.refresh("cookie-rt")).thenReturn(AuthResult.success(tokens("rt-2")));

        mockMvc.perform(post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .cookie(new Cookie("refreshToken", "cookie-rt")))
                .andExpect(status().isOk())
                .andExpect(cookie().value("refreshToken", "rt-2"));
    }

    @Test
    void refreshPrefersBodyToken() throws Exception {
        when(authService.refresh("body-rt")).thenReturn(AuthResult.success(tokens("rt-3")));

        mockMvc.perform(post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"body-rt\"}")
                        .cookie(new Cookie("refreshToken", "cookie-rt")))
                .andExpect(status().isOk());
        verify(authService).refresh("body-rt");
    }

    @Test
    void refreshWithoutAnyTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/refresh").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(authService);
    }

    @Test
    void refreshOfDeletedSessionIsNotFound() throws Exception {
        when(authService.refresh("stale")).thenReturn(AuthResult.failure(AuthErrorKind.NOT_FOUND, "Session not found"));

        mockMvc.perform(post("/api/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"stale\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void signOutDeletesCallersSessionAndClearsCookie() throws Exception {
        AuthenticatedSession principal = authenticate();

        mockMvc.perform(post("/api/auth/sign-out"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.signedOut").value(true))
                .andExpect(cookie().maxAge("refreshToken", 0));
        verify(authService).signOut(principal.sessionId());
    }

    @Test
    void meReturnsCurrentUser() throws Exception {
        AuthenticatedSession principal = authenticate();
        when(authService.currentUser(principal.userId())).thenReturn(AuthResult.success(UserSummary.builder()
                .id(principal.userId().toString()).email("ada@example.com").name("Ada")
                .emailVerified(true).roles(List.of("careseeker")).build()));

        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(principal.userId().toString()))
                .andExpect(jsonPath("$.data.roles[0]").value("careseeker"));
    }

    @Test
    void verifyEmailRequiresToken() throws Exception {
        mockMvc.perform(post("/api/auth/verify-email")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"123456\"}"))
                .andExpect(status().isUnprocessableEntity());
        verifyNoInteractions(registrationService);
    }

    @Test
    void forgotPasswordAlwaysAccepts() throws Exception {
        mockMvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ghost@example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.accepted").value(true));
        verify(passwordResetService).forgotPassword("ghost@example.com");
    }

    @Test
    void oauthInitiateWithBadRoleIsBadRequest() throws Exception {
        when(oAuthService.initiate("google", "admin")).thenReturn(AuthResult.failure(AuthErrorKind.BAD_REQUEST, "Invalid role"));

        mockMvc.perform(get("/api/auth/oauth/google").param("role", "admin"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void oauthInitiateReturnsAuthorizationUrl() throws Exception {
        when(oAuthService.initiate("google", "caregiver"))
                .thenReturn(AuthResult.success(new OAuthAuthorization("google", "https://accounts.google.com/o/oauth2/v2/auth?state=s")));

        mockMvc.perform(get("/api/auth/oauth/google").param("role", "caregiver"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authorizationUrl").value("https://accounts.google.com/o/oauth2/v2/auth?state=s"));
    }

    @Test
    void oauthCallbackSetsRefreshCookie() throws Exception {
        when(oAuthService.callback("google", "code", "state")).thenReturn(AuthResult.success(tokens("rt-g")));

        mockMvc.perform(get("/api/auth/oauth/google/callback").param("code", "code").param("state", "state"))
                .andExpect(status().isOk())
                .andExpect(cookie().value("refreshToken", "rt-g"));
    }

    @Test
    void oauthCallbackWithUnreachableProviderIsServiceUnavailable() throws Exception {
        when(oAuthService.callback("google", "code", "state"))
                .thenReturn(AuthResult.failure(AuthErrorKind.SERVICE_UNAVAILABLE, "OAuth provider is unavailable"));

        mockMvc.perform(get("/api/auth/oauth/google/callback").param("code", "code").param("state", "state"))
                .andExpect(status().isServiceUnavailable());
    }

    private static AuthenticatedSession authenticate() {
        AuthenticatedSession principal = new AuthenticatedSession(UUID.randomUUID(), UUID.randomUUID(), List.of("careseeker"));
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority("ROLE_CARESEEKER"))));
        return principal;
    }

    private static AuthTokens tokens(String refreshToken) {
        return AuthTokens.builder()
                .accessToken("at-1")
                .expiresIn(1800)
                .refreshToken(refreshToken)
                .refreshExpiresIn(2_592_000)
                .sessionId(UUID.randomUUID())
                .sessionExpiresAt(Instant.parse("2025-03-31T10:00:00Z"))
                .build();
    }
}
