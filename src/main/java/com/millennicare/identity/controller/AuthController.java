package com.millennicare.identity.controller;

import com.millennicare.identity.SecurityConfig.AuthenticatedSession;
import com.millennicare.identity.SecurityConfig.JwtTokenProviderConfig;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.config.OpenApiConfig;
import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.dto.EmailRequest;
import com.millennicare.identity.dto.OAuthAuthorization;
import com.millennicare.identity.dto.RefreshTokenRequest;
import com.millennicare.identity.dto.ResetPasswordRequest;
import com.millennicare.identity.dto.SignInRequest;
import com.millennicare.identity.dto.SignUpRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.dto.VerifyEmailRequest;
import com.millennicare.identity.exception.AuthExceptions;
import com.millennicare.identity.exception.ResourceExceptions;
import com.millennicare.identity.service.AuthService;
import com.millennicare.identity.service.OAuthService;
import com.millennicare.identity.service.PasswordResetService;
import com.millennicare.identity.service.RegistrationService;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "auth")
public class AuthController {

    private static final String COOKIE_PATH = "/api/auth";

    private final RegistrationService registrationService;
    private final AuthService authService;
    private final PasswordResetService passwordResetService;
    private final OAuthService oAuthService;
    private final RoleService roleService;
    private final JwtTokenProviderConfig tokenProvider;
    private final AuthProperties authProperties;

    @Operation(summary = "Register with email and password; a verification code is emailed")
    @PostMapping("/sign-up")
    @ResponseMessage("User created")
    public ResponseEntity<UserSummary> signUp(@Valid @RequestBody SignUpRequest request) {
        for (String role : request.getRoles()) {
            if (!authProperties.isSelfAssignable(role) || roleService.findByName(role).isEmpty()) {
                throw new ResourceExceptions.NotFound("Role not found: " + role);
            }
        }
        UserSummary created = registrationService.signUp(request).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Sign in with email and password")
    @PostMapping("/sign-in")
    @ResponseMessage("Signed in")
    public ResponseEntity<AuthTokens> signIn(@Valid @RequestBody SignInRequest request) {
        return withRefreshCookie(authService.signIn(request).orElseThrow());
    }

    @Operation(summary = "Confirm an email address with the emailed token (and optionally the code)")
    @PostMapping("/verify-email")
    @ResponseMessage("Email verified")
    public Map<String, Boolean> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        registrationService.verifyEmail(request.getToken(), request.getCode()).orElseThrow();
        return Map.of("verified", true);
    }

    @Operation(summary = "Send a fresh verification email")
    @PostMapping("/resend-verification")
    @ResponseMessage("If the account exists and is unverified, a verification email has been sent")
    public Map<String, Boolean> resendVerification(@Valid @RequestBody EmailRequest request) {
        registrationService.resendVerification(request.getEmail());
        return Map.of("accepted", true);
    }

    @Operation(summary = "Email a password reset link")
    @PostMapping("/forgot-password")
    @ResponseMessage("If the account exists, a reset link has been sent")
    public Map<String, Boolean> forgotPassword(@Valid @RequestBody EmailRequest request) {
        passwordResetService.forgotPassword(request.getEmail());
        return Map.of("accepted", true);
    }

    @Operation(summary = "Set a new password with a reset token")
    @PostMapping("/reset-password")
    @ResponseMessage("Password updated")
    public Map<String, Boolean> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetPassword(request.getToken(), request.getPassword()).orElseThrow();
        return Map.of("reset", true);
    }

    @Operation(summary = "Exchange a refresh token (body or refreshToken cookie) for a new token pair")
    @PostMapping("/refresh")
    @ResponseMessage("Token refreshed")
    public ResponseEntity<AuthTokens> refresh(@RequestBody(required = false) RefreshTokenRequest body,
                                              HttpServletRequest request) {
        String refreshToken = body != null && StringUtils.hasText(body.getRefreshToken())
                ? body.getRefreshToken()
                : tokenProvider.resolveRefreshTokenCookie(request)
                        .orElseThrow(() -> new AuthExceptions.Unauthorized("Refresh token is required"));
        return withRefreshCookie(authService.refresh(refreshToken).orElseThrow());
    }

    @Operation(summary = "End the current session", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    @PostMapping("/sign-out")
    @ResponseMessage("Signed out")
    public ResponseEntity<Map<String, Boolean>> signOut(@AuthenticationPrincipal AuthenticatedSession principal) {
        authService.signOut(principal.sessionId());
        ResponseCookie clear = refreshCookie("", Duration.ZERO);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, clear.toString())
                .body(Map.of("signedOut", true));
    }

    @Operation(summary = "Current user", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    @GetMapping("/me")
    public UserSummary me(@AuthenticationPrincipal AuthenticatedSession principal) {
        return authService.currentUser(principal.userId()).orElseThrow();
    }

    @Operation(summary = "Start an OAuth login; returns the provider authorization URL")
    @GetMapping("/oauth/{provider}")
    public OAuthAuthorization oauthInitiate(@PathVariable String provider,
                                            @RequestParam(name = "role", required = false) String role) {
        return oAuthService.initiate(provider, role).orElseThrow();
    }

    @Operation(summary = "OAuth redirect target; completes the login")
    @GetMapping("/oauth/{provider}/callback")
    @ResponseMessage("Signed in")
    public ResponseEntity<AuthTokens> oauthCallback(@PathVariable String provider,
                                                    @RequestParam(name = "code", required = false) String code,
                                                    @RequestParam(name = "state", required = false) String state) {
        return withRefreshCookie(oAuthService.callback(provider, code, state).orElseThrow());
    }

    private ResponseEntity<AuthTokens> withRefreshCookie(AuthTokens tokens) {
        ResponseCookie cookie = refreshCookie(tokens.getRefreshToken(), Duration.ofSeconds(tokens.getRefreshExpiresIn()));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(tokens);
    }

    private ResponseCookie refreshCookie(String value, Duration maxAge) {
        return ResponseCookie.from(JwtTokenProviderConfig.REFRESH_TOKEN_COOKIE, value)
                .httpOnly(true)
                .secure(authProperties.refreshCookieSecure())
                .sameSite("Strict")
                .path(COOKIE_PATH)
                .maxAge(maxAge)
                .build();
    }
}
