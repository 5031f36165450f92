package com.venueops.payment.config;

import com.venueops.common.config.VenueOpsProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Payment processor calls run on their own pool so a hung processor cannot tie up
 * request threads beyond the configured confirm timeout.
 *
 * <p>A timed-out call is abandoned, not interrupted: {@code CompletableFuture} tasks ignore
 * cancellation, so a hung call keeps its pool thread until the processor answers. The queue
 * is bounded so calls piling up behind hung threads are rejected, and callers see a
 * retryable timeout instead of waiting in an unbounded backlog.
 */
@Configuration
public class PaymentConfig {

    static final int POOL_SIZE = 4;
    static final int QUEUE_CAPACITY = 32;

    @Bean
    public TimeLimiter paymentTimeLimiter(VenueOpsProperties properties) {
        return TimeLimiter.of("paymentGateway", TimeLimiterConfig.custom()
                .timeoutDuration(properties.payment().confirmTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService paymentExecutor() {
        return new ThreadPoolExecutor(POOL_SIZE, POOL_SIZE, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY), new ThreadPoolExecutor.AbortPolicy());
    }
}
