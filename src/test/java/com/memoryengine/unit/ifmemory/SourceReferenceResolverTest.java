package com.memoryengine.unit.ifmemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.memoryengine.domain.enums.GlobalVariableType;
import com.memoryengine.domain.enums.PointItemType;
import com.memoryengine.domain.enums.ResolutionFailure;
import com.memoryengine.domain.model.GlobalVariableValue;
import com.memoryengine.domain.model.PointSample;
import com.memoryengine.domain.model.Scalar;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.exception.SourceResolutionException;
import com.memoryengine.ifmemory.SourceReferenceResolver;
import com.memoryengine.unit.support.InMemoryLiveValueStore;
import com.memoryengine.unit.support.StoreAccessFixtures;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SourceReferenceResolverTest {

    private InMemoryLiveValueStore liveValueStore;
    private SourceReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        liveValueStore = new InMemoryLiveValueStore();
        resolver = new SourceReferenceResolver(liveValueStore, StoreAccessFixtures.direct());
    }

    private static ResolutionFailure failureOf(Runnable call) {
        try {
            call.run();
        } catch (SourceResolutionException e) {
            return e.getFailure();
        }
        throw new AssertionError("Expected a SourceResolutionException");
    }

    @Nested
    @DisplayName("Points")
    class Points {

        @Test
        @DisplayName("Sampled point resolves to its number")
        void sampledPoint() {
            liveValueStore.putPoint("temp", PointItemType.ANALOG_INPUT, 21.5);

            assertThat(resolver.resolve(SourceReference.point("temp"))).isEqualTo(Scalar.number(21.5));
        }

        @Test
        @DisplayName("Digital point resolves as a number too")
        void digitalPointIsNumber() {
            liveValueStore.putPoint("door", PointItemType.DIGITAL_INPUT, 1.0);

            Scalar value = resolver.resolve(SourceReference.point("door"));

            assertThat(value.isNumber()).isTrue();
            assertThat(value.asBoolean()).isTrue();
        }

        @Test
        @DisplayName("Unknown point is NOT_FOUND")
        void unknownPoint() {
            assertThat(failureOf(() -> resolver.resolve(SourceReference.point("nope"))))
                    .isEqualTo(ResolutionFailure.NOT_FOUND);
        }

        @Test
        @DisplayName("Point without a sample is STALE_OR_UNAVAILABLE")
        void unsampledPoint() {
            liveValueStore.putPoint("fresh", PointItemType.ANALOG_INPUT, null);

            assertThat(failureOf(() -> resolver.resolve(SourceReference.point("fresh"))))
                    .isEqualTo(ResolutionFailure.STALE_OR_UNAVAILABLE);
        }

        @Test
        @DisplayName("NaN sample is STALE_OR_UNAVAILABLE")
        void nanSample() {
            liveValueStore.putPoint("broken", PointItemType.ANALOG_INPUT, Double.NaN);

            assertThat(failureOf(() -> resolver.resolve(SourceReference.point("broken"))))
                    .isEqualTo(ResolutionFailure.STALE_OR_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("Global variables")
    class GlobalVariables {

        @Test
        @DisplayName("BOOLEAN variable resolves case-insensitively to a bool")
        void booleanVariable() {
            liveValueStore.putGlobalVariable("armed", GlobalVariableType.BOOLEAN, "TRUE");

            assertThat(resolver.resolve(SourceReference.globalVariable("armed"))).isEqualTo(Scalar.bool(true));
        }

        @Test
        @DisplayName("FLOAT variable resolves to a number")
        void floatVariable() {
            liveValueStore.putGlobalVariable("setpoint", GlobalVariableType.FLOAT, " 42.25 ");

            assertThat(resolver.resolve(SourceReference.globalVariable("setpoint"))).isEqualTo(Scalar.number(42.25));
        }

        @Test
        @DisplayName("BOOLEAN variable holding a number is TYPE_MISMATCH")
        void booleanMismatch() {
            liveValueStore.putGlobalVariable("armed", GlobalVariableType.BOOLEAN, "1");

            assertThat(failureOf(() -> resolver.resolve(SourceReference.globalVariable("armed"))))
                    .isEqualTo(ResolutionFailure.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("FLOAT variable holding text is TYPE_MISMATCH")
        void floatMismatch() {
            liveValueStore.putGlobalVariable("setpoint", GlobalVariableType.FLOAT, "warm");

            assertThat(failureOf(() -> resolver.resolve(SourceReference.globalVariable("setpoint"))))
                    .isEqualTo(ResolutionFailure.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("FLOAT variable holding Infinity is TYPE_MISMATCH")
        void floatInfinity() {
            liveValueStore.putGlobalVariable("setpoint", GlobalVariableType.FLOAT, "Infinity");

            assertThat(failureOf(() -> resolver.resolve(SourceReference.globalVariable("setpoint"))))
                    .isEqualTo(ResolutionFailure.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("Missing or disabled variable is NOT_FOUND")
        void missingVariable() {
            assertThat(failureOf(() -> resolver.resolve(SourceReference.globalVariable("ghost"))))
                    .isEqualTo(ResolutionFailure.NOT_FOUND);
        }

        @Test
        @DisplayName("Variable record without a value is STALE_OR_UNAVAILABLE")
        void nullValue() {
            liveValueStore.putGlobalVariable("empty", GlobalVariableType.FLOAT, null);

            assertThat(failureOf(() -> resolver.resolve(SourceReference.globalVariable("empty"))))
                    .isEqualTo(ResolutionFailure.STALE_OR_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        @DisplayName("Store errors become STALE_OR_UNAVAILABLE with the reference attached")
        void storeDown() {
            liveValueStore.setUnavailable(true);

            assertThatThrownBy(() -> resolver.resolve(SourceReference.point("temp")))
                    .isInstanceOfSatisfying(SourceResolutionException.class, e -> {
                        assertThat(e.getFailure()).isEqualTo(ResolutionFailure.STALE_OR_UNAVAILABLE);
                        assertThat(e.getReference()).isEqualTo(SourceReference.point("temp"));
                        assertThat(e.getMessage()).contains("connection refused");
                    });
        }

        @Test
        @DisplayName("Slow store read becomes TIMEOUT")
        void slowStore() {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                InMemoryLiveValueStore slowStore = new InMemoryLiveValueStore() {
                    @Override
                    public Optional<PointSample> findPoint(String pointId) {
                        try {
                            Thread.sleep(2_000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return Optional.empty();
                    }

                    @Override
                    public Optional<GlobalVariableValue> findGlobalVariable(String name) {
                        return Optional.empty();
                    }
                };
                SourceReferenceResolver slowResolver = new SourceReferenceResolver(
                        slowStore, StoreAccessFixtures.limitedTo(Duration.ofMillis(50), executor));

                assertThat(failureOf(() -> slowResolver.resolve(SourceReference.point("temp"))))
                        .isEqualTo(ResolutionFailure.TIMEOUT);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Read rejected by a saturated executor is STALE_OR_UNAVAILABLE")
        void saturatedExecutor() {
            liveValueStore.putPoint("temp", PointItemType.ANALOG_INPUT, 21.0);
            SourceReferenceResolver saturatedResolver = new SourceReferenceResolver(
                    liveValueStore,
                    StoreAccessFixtures.limitedTo(Duration.ofSeconds(1), command -> {
                        throw new RejectedExecutionException("queue full");
                    }));

            assertThat(failureOf(() -> saturatedResolver.resolve(SourceReference.point("temp"))))
                    .isEqualTo(ResolutionFailure.STALE_OR_UNAVAILABLE);
        }
    }
}
