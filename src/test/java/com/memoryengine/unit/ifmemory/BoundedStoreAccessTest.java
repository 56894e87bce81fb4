package com.memoryengine.unit.ifmemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.memoryengine.exception.LiveStoreTimeoutException;
import com.memoryengine.exception.LiveStoreUnavailableException;
import com.memoryengine.ifmemory.BoundedStoreAccess;
import com.memoryengine.unit.support.StoreAccessFixtures;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BoundedStoreAccessTest {

    /** Accepts tasks and never runs them. */
    private static final Executor NEVER_RUNS = command -> {};

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Store result is returned through the limiter")
    void returnsResult() {
        BoundedStoreAccess access = StoreAccessFixtures.direct();

        assertThat(access.read("read P:p1", () -> 42.0)).isEqualTo(42.0);
    }

    @Test
    @DisplayName("Store runtime exceptions propagate unchanged")
    void storeExceptionPropagates() {
        BoundedStoreAccess access = StoreAccessFixtures.direct();

        assertThatThrownBy(() -> access.write("write P:relay", () -> {
                    throw new IllegalStateException("connection refused");
                }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("connection refused");
    }

    @Test
    @DisplayName("Call that never completes times out")
    void timesOut() {
        BoundedStoreAccess access = StoreAccessFixtures.limitedTo(Duration.ofMillis(30), NEVER_RUNS);

        assertThatThrownBy(() -> access.read("read P:p1", () -> 1.0))
                .isInstanceOf(LiveStoreTimeoutException.class)
                .hasMessage("Live store read P:p1 timed out");
    }

    @Test
    @DisplayName("Interrupted caller gets an unavailable error and keeps its interrupt flag")
    void interruptRestored() {
        BoundedStoreAccess access = StoreAccessFixtures.limitedTo(Duration.ofSeconds(5), NEVER_RUNS);
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> access.read("read P:p1", () -> 1.0))
                .isInstanceOf(LiveStoreUnavailableException.class)
                .hasMessage("Live store read P:p1 interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("Saturated executor rejects the call instead of running it on the caller")
    void rejectedByExecutor() {
        Executor saturated = command -> {
            throw new RejectedExecutionException("queue full");
        };
        BoundedStoreAccess access = StoreAccessFixtures.limitedTo(Duration.ofSeconds(1), saturated);

        assertThatThrownBy(() -> access.write("write GV:speed", () -> null))
                .isInstanceOf(LiveStoreUnavailableException.class)
                .hasMessageContaining("executor saturated")
                .hasCauseInstanceOf(RejectedExecutionException.class);
    }
}
