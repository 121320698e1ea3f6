package com.millennicare.identity.controller;

import com.millennicare.identity.SecurityConfig.AuthenticatedSession;
import com.millennicare.identity.SecurityConfig.JwtAccessDeniedHandler;
import com.millennicare.identity.SecurityConfig.JwtAuthenticationEntryPoint;
import com.millennicare.identity.SecurityConfig.JwtTokenProviderConfig;
import com.millennicare.identity.SecurityConfig.SecurityConfig;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.config.TimeConfig;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.service.AuthService;
import com.millennicare.identity.service.OAuthService;
import com.millennicare.identity.service.PasswordResetService;
import com.millennicare.identity.service.RegistrationService;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.service.SessionService;
import com.millennicare.identity.utils.ErrorResponseWriter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/** Runs the controller behind the real security chain and Bearer filter. */
@WebMvcTest(AuthController.class)
@Import({
        SecurityConfig.class, JwtAuthenticationEntryPoint.class, JwtAccessDeniedHandler.class,
        ErrorResponseWriter.class, JwtTokenProviderConfig.class, TimeConfig.class
})
class AuthEndpointSecurityTest {

    @TestConfiguration
    @EnableConfigurationProperties(AuthProperties.class)
    static class Properties {
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private JwtTokenProviderConfig tokenProvider;

    @MockBean private SessionService sessionService;
    @MockBean private RegistrationService registrationService;
    @MockBean private AuthService authService;
    @MockBean private PasswordResetService passwordResetService;
    @MockBean private OAuthService oAuthService;
    @MockBean private RoleService roleService;

    private final UUID userId = UUID.randomUUID();
    private final UUID sessionId = UUID.randomUUID();

    @Test
    void signOutWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/sign-out"))
                .andExpect(status().isUnauthorized());

        verify(authService, never()).signOut(any());
    }

    @Test
    void signOutWithTokenOfDeletedSessionIsUnauthorized() throws Exception {
        when(sessionService.isActive(sessionId, userId)).thenReturn(false);

        mockMvc.perform(post("/api/auth/sign-out")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken()))
                .andExpect(status().isUnauthorized());

        verify(authService, never()).signOut(any());
    }

    @Test
    void signOutWithLiveSessionDeletesIt() throws Exception {
        when(sessionService.isActive(sessionId, userId)).thenReturn(true);

        mockMvc.perform(post("/api/auth/sign-out")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.signedOut").value(true));

        verify(authService).signOut(sessionId);
    }

    @Test
    void refreshTokenCannotBeUsedAsBearer() throws Exception {
        mockMvc.perform(get("/api/auth/me")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenProvider.issueRefreshToken(userId, sessionId)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void meReturnsAuthenticatedUser() throws Exception {
        AuthenticatedSession principal = new AuthenticatedSession(userId, sessionId, List.of("caregiver"));
        when(authService.currentUser(userId)).thenReturn(AuthResult.success(UserSummary.builder()
                .id(userId.toString())
                .email("ada@example.com")
                .roles(List.of("caregiver"))
                .build()));

        mockMvc.perform(get("/api/auth/me")
                        .with(authentication(new UsernamePasswordAuthenticationToken(principal, null, List.of()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.email").value("ada@example.com"));
    }

    @Test
    void credentialEndpointsArePublic() throws Exception {
        mockMvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ghost@example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.accepted").value(true));

        verify(passwordResetService).forgotPassword("ghost@example.com");
    }

    private String accessToken() {
        return tokenProvider.issueAccessToken(userId, sessionId, List.of("careseeker"));
    }
}
