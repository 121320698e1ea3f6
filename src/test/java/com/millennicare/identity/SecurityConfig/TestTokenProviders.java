package com.millennicare.identity.SecurityConfig;

import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.support.TestFixtures;

import java.time.Clock;

/** Initialised token providers for tests outside this package. */
public final class TestTokenProviders {

    private TestTokenProviders() {}

    public static JwtTokenProviderConfig fixedClock() {
        return create(TestFixtures.authProperties(), TestFixtures.fixedClock());
    }

    public static JwtTokenProviderConfig create(AuthProperties props, Clock clock) {
        JwtTokenProviderConfig provider = new JwtTokenProviderConfig(props, clock);
        provider.init();
        return provider;
    }
}
