package com.millennicare.identity.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors kept apart from the servlet pool: password hashing and outbound mail.
 */
@Configuration
@EnableAsync
@EnableScheduling
@RequiredArgsConstructor
public class AsyncConfig {

    public static final String PASSWORD_HASHING_EXECUTOR = "passwordHashingExecutor";
    public static final String MAIL_EXECUTOR = "mailExecutor";

    private final AuthProperties authProperties;

    /** Bounded pool for Argon2 work. Overflow is rejected (AbortPolicy), never queued without limit. */
    @Bean(name = PASSWORD_HASHING_EXECUTOR)
    public ThreadPoolTaskExecutor passwordHashingExecutor() {
        AuthProperties.PasswordHashing cfg = authProperties.passwordHashing();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, cfg.poolSize()));
        executor.setMaxPoolSize(Math.max(1, cfg.poolSize()));
        executor.setQueueCapacity(Math.max(0, cfg.queueCapacity()));
        executor.setThreadNamePrefix("pwd-hash-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = MAIL_EXECUTOR)
    public ThreadPoolTaskExecutor mailExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("mail-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
