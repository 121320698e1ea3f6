package com.millennicare.identity.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.DefaultClientResources;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Pooled Lettuce connection for OAuth state. Keys and values are plain strings, so only a
 * {@link StringRedisTemplate} is exposed. Commands fail fast while disconnected; a lost state
 * means the user restarts the OAuth flow.
 */
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(2);

    @Bean(destroyMethod = "shutdown")
    DefaultClientResources lettuceClientResources() {
        return DefaultClientResources.create();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties props, DefaultClientResources resources) {
        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(props.getHost(), props.getPort());
        server.setDatabase(props.getDatabase());
        if (StringUtils.hasText(props.getUsername())) {
            server.setUsername(props.getUsername());
        }
        if (StringUtils.hasText(props.getPassword())) {
            server.setPassword(RedisPassword.of(props.getPassword()));
        }

        var client = LettucePoolingClientConfiguration.builder()
                .clientResources(resources)
                .commandTimeout(props.getTimeout() != null ? props.getTimeout() : DEFAULT_COMMAND_TIMEOUT)
                .clientOptions(ClientOptions.builder()
                        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                        .timeoutOptions(TimeoutOptions.enabled())
                        .build())
                .poolConfig(poolConfig(props.getLettuce().getPool()));
        if (props.getSsl().isEnabled()) {
            client.useSsl();
        }
        return new LettuceConnectionFactory(server, client.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    private static GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig(RedisProperties.Pool pool) {
        GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
        config.setMaxTotal(pool.getMaxActive());
        config.setMaxIdle(pool.getMaxIdle());
        config.setMinIdle(pool.getMinIdle());
        config.setTestWhileIdle(true);
        return config;
    }
}
