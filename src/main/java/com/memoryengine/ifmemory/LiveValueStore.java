package com.memoryengine.ifmemory;

import com.memoryengine.domain.model.GlobalVariableValue;
import com.memoryengine.domain.model.PointSample;
import java.util.Optional;

/**
 * Process-wide store of live point samples and global-variable values.
 *
 * <p>Shared by every IF memory instance; implementations must tolerate concurrent
 * readers and writers and give read-your-writes consistency per key. Calls may block
 * on I/O, so the engine wraps them in {@link BoundedStoreAccess}.
 */
public interface LiveValueStore {

    Optional<PointSample> findPoint(String pointId);

    /** Writes a new sample value for an existing point; returns false if the point is unknown. */
    boolean writePoint(String pointId, double value);

    Optional<GlobalVariableValue> findGlobalVariable(String name);

    /** Creates or replaces a global variable's live record. */
    void saveGlobalVariable(GlobalVariableValue value);

    void deleteGlobalVariable(String name);
}
