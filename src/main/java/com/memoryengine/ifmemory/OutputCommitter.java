package com.memoryengine.ifmemory;

import com.memoryengine.domain.enums.GlobalVariableType;
import com.memoryengine.domain.enums.OutputType;
import com.memoryengine.domain.enums.PointItemType;
import com.memoryengine.domain.model.GlobalVariableValue;
import com.memoryengine.domain.model.PointSample;
import com.memoryengine.domain.model.Scalar;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.exception.LiveStoreTimeoutException;
import com.memoryengine.exception.OutputCommitException;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Writes a selected value to an IF memory's destination.
 *
 * <p>Digital outputs are written with boolean semantics: any value whose magnitude
 * exceeds {@link Scalar#ZERO_TOLERANCE} is on. A BOOLEAN global variable receives
 * {@code true}/{@code false}; a FLOAT variable or a point receives 1/0. Analog outputs
 * are written as raw numbers and only to FLOAT variables or analog output points.
 */
@Component
public class OutputCommitter {

    private final LiveValueStore liveValueStore;
    private final BoundedStoreAccess boundedStoreAccess;

    public OutputCommitter(LiveValueStore liveValueStore, BoundedStoreAccess boundedStoreAccess) {
        this.liveValueStore = liveValueStore;
        this.boundedStoreAccess = boundedStoreAccess;
    }

    /**
     * @return the value actually written (after digital normalization)
     * @throws OutputCommitException if the destination is missing, has an incompatible
     *     type, or the store did not answer in time
     */
    public double commit(SourceReference destination, OutputType outputType, double value) {
        if (destination == null) {
            throw new OutputCommitException(null, "No output destination configured");
        }
        if (!Double.isFinite(value)) {
            throw new OutputCommitException(destination, "Refusing to write non-finite value " + value);
        }

        double written = outputType == OutputType.DIGITAL ? (Scalar.isNonZero(value) ? 1.0 : 0.0) : value;
        if (destination.isPoint()) {
            commitToPoint(destination, outputType, written);
        } else {
            commitToGlobalVariable(destination, outputType, written);
        }
        return written;
    }

    private void commitToPoint(SourceReference destination, OutputType outputType, double value) {
        String pointId = destination.getLocator();
        PointSample sample = call(destination, true, () -> liveValueStore.findPoint(pointId))
                .orElseThrow(() -> new OutputCommitException(destination, "Point " + pointId + " not found"));

        PointItemType required =
                outputType == OutputType.DIGITAL ? PointItemType.DIGITAL_OUTPUT : PointItemType.ANALOG_OUTPUT;
        if (sample.getItemType() != required) {
            throw new OutputCommitException(
                    destination,
                    "Point " + pointId + " is " + sample.getItemType() + ", " + outputType + " output needs "
                            + required);
        }

        boolean written = call(destination, false, () -> liveValueStore.writePoint(pointId, value));
        if (!written) {
            throw new OutputCommitException(destination, "Point " + pointId + " not found");
        }
    }

    private void commitToGlobalVariable(SourceReference destination, OutputType outputType, double value) {
        String name = destination.getLocator();
        GlobalVariableValue current = call(destination, true, () -> liveValueStore.findGlobalVariable(name))
                .orElseThrow(() -> new OutputCommitException(
                        destination, "Global variable " + name + " not found or disabled"));

        GlobalVariableType variableType = current.getVariableType();
        String text;
        if (variableType == GlobalVariableType.BOOLEAN) {
            if (outputType == OutputType.ANALOG) {
                throw new OutputCommitException(
                        destination, "Global variable " + name + " is BOOLEAN and cannot take an analog value");
            }
            text = String.valueOf(Scalar.isNonZero(value));
        } else {
            text = String.valueOf(value);
        }

        GlobalVariableValue updated = GlobalVariableValue.builder()
                .name(name)
                .variableType(variableType)
                .value(text)
                .updatedAtEpochMs(System.currentTimeMillis())
                .build();
        call(destination, false, () -> {
            liveValueStore.saveGlobalVariable(updated);
            return null;
        });
    }

    private <T> T call(SourceReference destination, boolean read, Supplier<T> call) {
        String operation = (read ? "read " : "write ") + destination;
        try {
            return read ? boundedStoreAccess.read(operation, call) : boundedStoreAccess.write(operation, call);
        } catch (LiveStoreTimeoutException e) {
            throw new OutputCommitException(destination, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new OutputCommitException(destination, "Live store unavailable: " + e.getMessage(), e);
        }
    }
}
