package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.service.OAuthStateStore;
import com.millennicare.identity.utils.SecureTokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * OAuth state in Redis under {@code oauth_state:<state>} with a TTL.
 * Redemption uses GETDEL so a state is consumed by exactly one caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisOAuthStateStore implements OAuthStateStore {

    static final String KEY_PREFIX = "oauth_state:";

    private final StringRedisTemplate redisTemplate;
    private final SecureTokenGenerator tokenGenerator;
    private final AuthProperties authProperties;

    @Override
    public String create(String roleName) {
        String state = tokenGenerator.newUrlToken();
        redisTemplate.opsForValue().set(KEY_PREFIX + state, roleName, authProperties.oauthStateTtl());
        return state;
    }

    @Override
    public Optional<String> redeem(String state) {
        if (!StringUtils.hasText(state)) return Optional.empty();
        String value = redisTemplate.opsForValue().getAndDelete(KEY_PREFIX + state);
        if (value == null) {
            log.debug("OAuth state not found or already used");
        }
        return Optional.ofNullable(value);
    }
}
