package com.millennicare.identity.oauth;

import com.millennicare.identity.config.OAuthProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleOAuthClientTest {

    private static final String TOKEN_URI = "https://oauth2.googleapis.com/token";
    private static final String USER_INFO_URI = "https://openidconnect.googleapis.com/v1/userinfo";

    private MockRestServiceServer server;
    private GoogleOAuthClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GoogleOAuthClient(builder.build(), properties("client-1", "secret-1"));
    }

    @Test
    void authorizationUrlCarriesClientRedirectScopesAndState() {
        String url = client.authorizationUrl("state-xyz");

        assertThat(url).startsWith("https://accounts.google.com/o/oauth2/v2/auth?");
        assertThat(url).contains("response_type=code", "client_id=client-1", "state=state-xyz",
                "scope=openid%20email%20profile",
                "redirect_uri=http://localhost:8080/api/auth/oauth/google/callback");
    }

    @Test
    void exchangeCodePostsFormAndMapsTokens() {
        server.expect(requestTo(TOKEN_URI))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().formDataContains(Map.of(
                        "grant_type", "authorization_code",
                        "code", "auth-code",
                        "client_id", "client-1")))
                .andRespond(withSuccess("""
                        {"access_token":"ya29.a","refresh_token":"1//r","id_token":"eyJ.x.y",
                         "expires_in":3599,"scope":"openid email","token_type":"Bearer"}
                        """, MediaType.APPLICATION_JSON));

        ProviderTokens tokens = client.exchangeCode("auth-code");

        assertThat(tokens.accessToken()).isEqualTo("ya29.a");
        assertThat(tokens.refreshToken()).isEqualTo("1//r");
        assertThat(tokens.expiresInSeconds()).isEqualTo(3599L);
        server.verify();
    }

    @Test
    void fetchProfileSendsBearerToken() {
        server.expect(requestTo(USER_INFO_URI))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer ya29.a"))
                .andRespond(withSuccess("""
                        {"sub":"1077","email":"grace@example.com","email_verified":true,
                         "name":"Grace Hopper","given_name":"Grace","family_name":"Hopper"}
                        """, MediaType.APPLICATION_JSON));

        ProviderProfile profile = client.fetchProfile(new ProviderTokens("ya29.a", null, null, null, null));

        assertThat(profile.providerAccountId()).isEqualTo("1077");
        assertThat(profile.email()).isEqualTo("grace@example.com");
        assertThat(profile.givenName()).isEqualTo("Grace");
        assertThat(profile.familyName()).isEqualTo("Hopper");
        assertThat(profile.displayName()).isEqualTo("Grace Hopper");
    }

    @Test
    void providerErrorIsRejection() {
        server.expect(requestTo(TOKEN_URI))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\"}"));

        assertThatThrownBy(() -> client.exchangeCode("stale"))
                .isInstanceOf(OAuthGatewayException.class)
                .extracting("kind")
                .isEqualTo(OAuthGatewayException.Kind.PROVIDER_REJECTED);
    }

    @Test
    void tokenResponseWithoutAccessTokenIsRejection() {
        server.expect(requestTo(TOKEN_URI))
                .andRespond(withSuccess("{\"token_type\":\"Bearer\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.exchangeCode("code"))
                .isInstanceOf(OAuthGatewayException.class)
                .extracting("kind")
                .isEqualTo(OAuthGatewayException.Kind.PROVIDER_REJECTED);
    }

    @Test
    void transportFailureIsUnreachable() {
        server.expect(requestTo(USER_INFO_URI))
                .andRespond(request -> {
                    throw new IOException("connection reset");
                });

        assertThatThrownBy(() -> client.fetchProfile(new ProviderTokens("ya29.a", null, null, null, null)))
                .isInstanceOf(OAuthGatewayException.class)
                .extracting("kind")
                .isEqualTo(OAuthGatewayException.Kind.UNREACHABLE);
    }

    @Test
    void missingCredentialsMeansNotConfigured() {
        GoogleOAuthClient unconfigured = new GoogleOAuthClient(RestClient.create(), properties("", "secret-1"));
        GoogleOAuthClient absent = new GoogleOAuthClient(RestClient.create(),
                new OAuthProperties(Duration.ofSeconds(5), Duration.ofSeconds(10), Map.of()));

        assertThat(client.isConfigured()).isTrue();
        assertThat(unconfigured.isConfigured()).isFalse();
        assertThat(absent.isConfigured()).isFalse();
    }

    private static OAuthProperties properties(String clientId, String clientSecret) {
        OAuthProperties.Provider google = new OAuthProperties.Provider(
                clientId, clientSecret,
                "http://localhost:8080/api/auth/oauth/google/callback",
                null, null, null,
                List.of("openid", "email", "profile"));
        return new OAuthProperties(Duration.ofSeconds(5), Duration.ofSeconds(10), Map.of("google", google));
    }
}
