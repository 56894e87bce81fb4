package com.memoryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One prioritized condition/output pair of an IF memory.
 *
 * <p>Branches are evaluated in ascending {@code order}; the first whose condition is
 * true supplies {@code outputValue}. {@code hysteresis} (same time unit as the memory's
 * interval) keeps an active branch selected for a while after its condition drops
 * to false. Stored as JSON inside the owning IF memory row.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
public class Branch {

    private String id;

    /** Zero-based evaluation priority; lower is checked first. */
    private int order;

    private String condition;

    @Builder.Default
    private double outputValue = 1.0;

    @Builder.Default
    private double hysteresis = 0.0;

    /** Display label only. */
    private String name;
}
