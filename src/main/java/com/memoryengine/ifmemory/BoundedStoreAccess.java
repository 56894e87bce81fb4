package com.memoryengine.ifmemory;

import com.memoryengine.exception.LiveStoreTimeoutException;
import com.memoryengine.exception.LiveStoreUnavailableException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs live store calls under a Resilience4j {@link TimeLimiter} so that no resolution
 * or commit can hang an evaluation cycle.
 *
 * <p>Reads use the {@code liveStoreRead} limiter, writes {@code liveStoreWrite}; both are
 * configured under {@code resilience4j.timelimiter.instances}. A call that exceeds its
 * limit is cancelled and surfaces as {@link LiveStoreTimeoutException}. A call the
 * executor rejects, or a caller interrupted while waiting, surfaces as
 * {@link LiveStoreUnavailableException}; the interrupt flag is restored. Runtime
 * exceptions thrown by the store propagate unchanged.
 */
@Component
public class BoundedStoreAccess {

    static final String READ_LIMITER = "liveStoreRead";
    static final String WRITE_LIMITER = "liveStoreWrite";

    private final TimeLimiter readLimiter;
    private final TimeLimiter writeLimiter;
    private final Executor executor;

    public BoundedStoreAccess(
            TimeLimiterRegistry timeLimiterRegistry, @Qualifier("liveStoreExecutor") Executor executor) {
        this.readLimiter = timeLimiterRegistry.timeLimiter(READ_LIMITER);
        this.writeLimiter = timeLimiterRegistry.timeLimiter(WRITE_LIMITER);
        this.executor = executor;
    }

    public <T> T read(String operation, Supplier<T> call) {
        return execute(readLimiter, operation, call);
    }

    public <T> T write(String operation, Supplier<T> call) {
        return execute(writeLimiter, operation, call);
    }

    private <T> T execute(TimeLimiter timeLimiter, String operation, Supplier<T> call) {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
        } catch (TimeoutException e) {
            throw new LiveStoreTimeoutException(operation, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LiveStoreUnavailableException("Live store " + operation + " interrupted", e);
        } catch (RejectedExecutionException e) {
            throw new LiveStoreUnavailableException("Live store " + operation + " rejected, executor saturated", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Live store " + operation + " failed", e);
        }
    }

    private static RuntimeException unwrap(String operation, Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException("Live store " + operation + " failed", cause);
    }
}
