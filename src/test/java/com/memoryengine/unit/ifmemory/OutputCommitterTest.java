package com.memoryengine.unit.ifmemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.memoryengine.domain.enums.GlobalVariableType;
import com.memoryengine.domain.enums.OutputType;
import com.memoryengine.domain.enums.PointItemType;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.exception.OutputCommitException;
import com.memoryengine.ifmemory.OutputCommitter;
import com.memoryengine.unit.support.InMemoryLiveValueStore;
import com.memoryengine.unit.support.StoreAccessFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OutputCommitterTest {

    private InMemoryLiveValueStore liveValueStore;
    private OutputCommitter outputCommitter;

    @BeforeEach
    void setUp() {
        liveValueStore = new InMemoryLiveValueStore()
                .putPoint("relay", PointItemType.DIGITAL_OUTPUT, 0.0)
                .putPoint("valve", PointItemType.ANALOG_OUTPUT, 0.0)
                .putPoint("sensor", PointItemType.ANALOG_INPUT, 12.0)
                .putGlobalVariable("alarm", GlobalVariableType.BOOLEAN, "false")
                .putGlobalVariable("level", GlobalVariableType.FLOAT, "0");
        outputCommitter = new OutputCommitter(liveValueStore, StoreAccessFixtures.direct());
    }

    @Nested
    @DisplayName("Digital outputs")
    class Digital {

        @Test
        @DisplayName("Non-zero value switches a digital output point on")
        void pointOn() {
            double written = outputCommitter.commit(SourceReference.point("relay"), OutputType.DIGITAL, 5.0);

            assertThat(written).isEqualTo(1.0);
            assertThat(liveValueStore.pointValue("relay")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Zero switches a digital output point off")
        void pointOff() {
            liveValueStore.putPoint("relay", PointItemType.DIGITAL_OUTPUT, 1.0);

            outputCommitter.commit(SourceReference.point("relay"), OutputType.DIGITAL, 0.0);

            assertThat(liveValueStore.pointValue("relay")).isEqualTo(0.0);
        }

        @Test
        @DisplayName("BOOLEAN global variable receives true/false")
        void booleanVariable() {
            outputCommitter.commit(SourceReference.globalVariable("alarm"), OutputType.DIGITAL, 1.0);

            assertThat(liveValueStore.globalVariableValue("alarm")).isEqualTo("true");
        }

        @Test
        @DisplayName("FLOAT global variable receives 1/0")
        void floatVariable() {
            outputCommitter.commit(SourceReference.globalVariable("level"), OutputType.DIGITAL, -3.0);

            assertThat(liveValueStore.globalVariableValue("level")).isEqualTo("1.0");
        }

        @Test
        @DisplayName("Analog output point cannot take a digital value")
        void wrongPointType() {
            assertThatThrownBy(() -> outputCommitter.commit(SourceReference.point("valve"), OutputType.DIGITAL, 1.0))
                    .isInstanceOf(OutputCommitException.class)
                    .hasMessageContaining("DIGITAL_OUTPUT");
            assertThat(liveValueStore.pointValue("valve")).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("Analog outputs")
    class Analog {

        @Test
        @DisplayName("Raw value goes to an analog output point")
        void point() {
            double written = outputCommitter.commit(SourceReference.point("valve"), OutputType.ANALOG, 42.5);

            assertThat(written).isEqualTo(42.5);
            assertThat(liveValueStore.pointValue("valve")).isEqualTo(42.5);
        }

        @Test
        @DisplayName("Raw value goes to a FLOAT variable")
        void floatVariable() {
            outputCommitter.commit(SourceReference.globalVariable("level"), OutputType.ANALOG, 42.5);

            assertThat(liveValueStore.globalVariableValue("level")).isEqualTo("42.5");
        }

        @Test
        @DisplayName("BOOLEAN variable cannot take an analog value")
        void booleanVariableRejected() {
            assertThatThrownBy(() ->
                            outputCommitter.commit(SourceReference.globalVariable("alarm"), OutputType.ANALOG, 2.0))
                    .isInstanceOf(OutputCommitException.class)
                    .hasMessageContaining("BOOLEAN");
            assertThat(liveValueStore.globalVariableValue("alarm")).isEqualTo("false");
        }

        @Test
        @DisplayName("Input points are never written")
        void inputPointRejected() {
            assertThatThrownBy(() -> outputCommitter.commit(SourceReference.point("sensor"), OutputType.ANALOG, 1.0))
                    .isInstanceOf(OutputCommitException.class);
            assertThat(liveValueStore.pointValue("sensor")).isEqualTo(12.0);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Missing point")
        void missingPoint() {
            assertThatThrownBy(() -> outputCommitter.commit(SourceReference.point("gone"), OutputType.DIGITAL, 1.0))
                    .isInstanceOfSatisfying(OutputCommitException.class, e ->
                            assertThat(e.getDestination()).isEqualTo(SourceReference.point("gone")));
        }

        @Test
        @DisplayName("Missing or disabled global variable")
        void missingVariable() {
            assertThatThrownBy(() ->
                            outputCommitter.commit(SourceReference.globalVariable("gone"), OutputType.DIGITAL, 1.0))
                    .isInstanceOf(OutputCommitException.class)
                    .hasMessageContaining("not found or disabled");
        }

        @Test
        @DisplayName("No destination configured")
        void noDestination() {
            assertThatThrownBy(() -> outputCommitter.commit(null, OutputType.DIGITAL, 1.0))
                    .isInstanceOf(OutputCommitException.class);
        }

        @Test
        @DisplayName("Non-finite value is never written")
        void nonFinite() {
            assertThatThrownBy(() ->
                            outputCommitter.commit(SourceReference.point("valve"), OutputType.ANALOG, Double.NaN))
                    .isInstanceOf(OutputCommitException.class);
        }

        @Test
        @DisplayName("Store error becomes a commit failure")
        void storeDown() {
            liveValueStore.setUnavailable(true);

            assertThatThrownBy(() -> outputCommitter.commit(SourceReference.point("relay"), OutputType.DIGITAL, 1.0))
                    .isInstanceOf(OutputCommitException.class)
                    .hasMessageContaining("Live store unavailable");
        }
    }
}
