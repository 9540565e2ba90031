package com.nemweb.config;

import com.nemweb.model.ProductKind;
import com.nemweb.scheduler.PollerSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Application-wide Spring configuration.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Timer threads. They only dispatch poll cycles, so a small pool serves every region.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${nemweb.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("nemweb-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Worker threads for fetch/parse/update cycles. Single-flight bounds the load at one
     * running cycle per (region, product), so the pool is sized for all keys at once.
     */
    @Bean
    public ThreadPoolTaskExecutor pollExecutor(
            @Value("${nemweb.worker.pool-size:15}") int poolSize,
            @Value("${nemweb.shutdown.grace-ms:5000}") long graceMs) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("nemweb-poll-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(graceMs);
        return executor;
    }

    @Bean
    public RestTemplate nemwebRestTemplate(
            RestTemplateBuilder builder,
            @Value("${nemweb.http.connect-timeout-ms:10000}") long connectTimeoutMs,
            @Value("${nemweb.http.read-timeout-ms:60000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    /**
     * Retries transient NEMWEB failures (I/O errors and 5xx) with exponential backoff.
     * Client errors are not retried.
     */
    @Bean
    public RetryTemplate nemwebRetryTemplate(
            @Value("${nemweb.retry.max-attempts:4}") int maxAttempts,
            @Value("${nemweb.retry.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${nemweb.retry.max-backoff-ms:8000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(List.of(ResourceAccessException.class, HttpServerErrorException.class))
                .build();
    }

    @Bean
    public PollerSettings pollerSettings(
            @Value("${nemweb.poll.realtime-ms:5000}") long realtimeMs,
            @Value("${nemweb.poll.five-minute-ms:30000}") long fiveMinuteMs,
            @Value("${nemweb.poll.predispatch-ms:300000}") long predispatchMs,
            @Value("${nemweb.staleness.failure-threshold:3}") int failureThreshold,
            @Value("${nemweb.scheduler.max-jitter-ms:2000}") long maxJitterMs,
            @Value("${nemweb.shutdown.grace-ms:5000}") long graceMs) {
        return new PollerSettings(
                Map.of(ProductKind.REALTIME, Duration.ofMillis(realtimeMs),
                        ProductKind.FIVE_MINUTE, Duration.ofMillis(fiveMinuteMs),
                        ProductKind.PREDISPATCH, Duration.ofMillis(predispatchMs)),
                failureThreshold,
                Duration.ofMillis(maxJitterMs),
                Duration.ofMillis(graceMs));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
