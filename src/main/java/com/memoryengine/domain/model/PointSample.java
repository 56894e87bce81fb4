package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.PointItemType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Latest sample of a point as held in Redis. {@code value} is null until the point
 * has been sampled at least once.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PointSample {

    private String pointId;
    private PointItemType itemType;
    private Double value;
    private long sampledAtEpochMs;
}
