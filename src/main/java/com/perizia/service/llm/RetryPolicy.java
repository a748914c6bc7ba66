package com.perizia.service.llm;

import com.perizia.Exception.LlmProviderException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 远程调用重试策略：最大尝试次数、指数退避曲线、可重试判定
 * 不可变，由调用方显式传入每个远程调用点
 *
 * @author perizia
 * @since 2025-03-06
 */
@Slf4j
public final class RetryPolicy {

    /**
     * 等待方式，测试中替换为不真正休眠的实现
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    @Getter
    private final int maxAttempts;

    private final Duration initialInterval;

    private final Duration maxInterval;

    private final Predicate<RuntimeException> retryable;

    private final Sleeper sleeper;

    private RetryPolicy(int maxAttempts, Duration initialInterval, Duration maxInterval,
                        Predicate<RuntimeException> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public static RetryPolicy of(int maxAttempts, Duration initialInterval, Duration maxInterval,
                                 Predicate<RuntimeException> retryable) {
        return new RetryPolicy(maxAttempts, initialInterval, maxInterval, retryable, Thread::sleep);
    }

    /**
     * 只重试提供方的瞬时错误
     */
    public static RetryPolicy transientProviderErrors(int maxAttempts, Duration initialInterval, Duration maxInterval) {
        return of(maxAttempts, initialInterval, maxInterval,
            e -> e instanceof LlmProviderException ex && ex.getCode().isTransient());
    }

    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, initialInterval, maxInterval, retryable, sleeper);
    }

    public boolean isRetryable(RuntimeException e) {
        return retryable.test(e);
    }

    /**
     * 执行调用，可重试错误按退避曲线重试，其余错误或次数用尽时抛出最后一次的异常
     */
    public <T> T execute(String operation, Supplier<T> call) {
        BackOffExecution backOff = newBackOff().start();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                long waitMillis = backOff.nextBackOff();
                if (waitMillis == BackOffExecution.STOP) {
                    throw e;
                }
                log.warn("{} 第{}次尝试失败，{}ms 后重试: {}", operation, attempt, waitMillis, e.getMessage());
                try {
                    sleeper.sleep(waitMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private ExponentialBackOff newBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(initialInterval.toMillis(), 2.0);
        backOff.setMaxInterval(maxInterval.toMillis());
        return backOff;
    }
}
