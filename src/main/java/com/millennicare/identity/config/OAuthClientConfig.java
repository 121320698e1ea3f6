package com.millennicare.identity.config;

import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class OAuthClientConfig {

    /** Client for provider token and profile endpoints, with bounded connect/read timeouts. */
    @Bean
    public RestClient oauthRestClient(RestClient.Builder builder, OAuthProperties oauthProperties) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(oauthProperties.connectTimeout())
                .withReadTimeout(oauthProperties.readTimeout());
        return builder
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .build();
    }
}
