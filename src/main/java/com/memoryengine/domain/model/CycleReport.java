package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.CycleOutcome;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** What happened in one evaluation cycle of one IF memory. */
@Getter
@AllArgsConstructor
@Builder
@ToString
public class CycleReport {

    private final UUID memoryId;
    private final CycleOutcome outcome;

    /** Null when the cycle was skipped or bindings failed to resolve. */
    private final BranchSelection selection;

    private final String error;
    private final long durationNanos;

    public static CycleReport skipped(UUID memoryId) {
        return new CycleReport(memoryId, CycleOutcome.SKIPPED, null, null, 0L);
    }
}
