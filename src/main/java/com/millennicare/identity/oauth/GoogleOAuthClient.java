package com.millennicare.identity.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.millennicare.identity.config.OAuthProperties;
import com.millennicare.identity.entity.AuthProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.function.Supplier;

/**
 * Google OpenID Connect: authorization-code exchange and the userinfo endpoint.
 */
@Slf4j
@Component
public class GoogleOAuthClient implements OAuthProviderClient {

    static final String DEFAULT_AUTHORIZATION_URI = "https://accounts.google.com/o/oauth2/v2/auth";
    static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";
    static final String DEFAULT_USER_INFO_URI = "https://openidconnect.googleapis.com/v1/userinfo";
    static final List<String> DEFAULT_SCOPES = List.of("openid", "email", "profile");

    private final RestClient restClient;
    private final OAuthProperties.Provider settings;

    public GoogleOAuthClient(@Qualifier("oauthRestClient") RestClient restClient, OAuthProperties oauthProperties) {
        this.restClient = restClient;
        this.settings = oauthProperties.providers().get(AuthProvider.GOOGLE.id());
    }

    @Override
    public AuthProvider provider() {
        return AuthProvider.GOOGLE;
    }

    @Override
    public boolean isConfigured() {
        return settings != null
                && StringUtils.hasText(settings.clientId())
                && StringUtils.hasText(settings.clientSecret())
                && StringUtils.hasText(settings.redirectUri());
    }

    @Override
    public String authorizationUrl(String state) {
        List<String> scopes = settings.scopes() == null || settings.scopes().isEmpty()
                ? DEFAULT_SCOPES
                : settings.scopes();
        return UriComponentsBuilder.fromHttpUrl(orDefault(settings.authorizationUri(), DEFAULT_AUTHORIZATION_URI))
                .queryParam("response_type", "code")
                .queryParam("client_id", settings.clientId())
                .queryParam("redirect_uri", settings.redirectUri())
                .queryParam("scope", String.join(" ", scopes))
                .queryParam("state", state)
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .encode()
                .toUriString();
    }

    @Override
    public ProviderTokens exchangeCode(String code) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", settings.redirectUri());
        form.add("client_id", settings.clientId());
        form.add("client_secret", settings.clientSecret());

        TokenResponse body = call("token exchange", () -> restClient.post()
                .uri(orDefault(settings.tokenUri(), DEFAULT_TOKEN_URI))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(TokenResponse.class));

        if (body == null || !StringUtils.hasText(body.accessToken())) {
            throw new OAuthGatewayException(OAuthGatewayException.Kind.PROVIDER_REJECTED,
                    "Google token response had no access_token");
        }
        return new ProviderTokens(body.accessToken(), body.refreshToken(), body.idToken(), body.expiresIn(), body.scope());
    }

    @Override
    public ProviderProfile fetchProfile(ProviderTokens tokens) {
        UserInfo info = call("userinfo", () -> restClient.get()
                .uri(orDefault(settings.userInfoUri(), DEFAULT_USER_INFO_URI))
                .headers(h -> h.setBearerAuth(tokens.accessToken()))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(UserInfo.class));

        if (info == null || !StringUtils.hasText(info.sub())) {
            throw new OAuthGatewayException(OAuthGatewayException.Kind.PROVIDER_REJECTED,
                    "Google userinfo response had no subject");
        }
        return new ProviderProfile(info.sub(), info.email(), info.givenName(), info.familyName(), info.name());
    }

    private <T> T call(String what, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            log.warn("Google {} failed with HTTP {}", what, e.getStatusCode().value());
            throw new OAuthGatewayException(OAuthGatewayException.Kind.PROVIDER_REJECTED,
                    "Google " + what + " returned " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Google {} unreachable: {}", what, e.getMessage());
            throw new OAuthGatewayException(OAuthGatewayException.Kind.UNREACHABLE,
                    "Google " + what + " unreachable", e);
        } catch (RestClientException e) {
            log.warn("Google {} returned an unreadable response: {}", what, e.getMessage());
            throw new OAuthGatewayException(OAuthGatewayException.Kind.PROVIDER_REJECTED,
                    "Google " + what + " returned an unreadable response", e);
        }
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value : fallback;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("refresh_token") String refreshToken,
            @JsonProperty("id_token") String idToken,
            @JsonProperty("expires_in") Long expiresIn,
            @JsonProperty("scope") String scope
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserInfo(
            String sub,
            String email,
            String name,
            @JsonProperty("given_name") String givenName,
            @JsonProperty("family_name") String familyName
    ) {}
}
