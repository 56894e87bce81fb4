package com.memoryengine.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One branch inside an {@link IfMemoryRequest}, or the body of "add branch".
 * A missing {@code order} keeps the branch's position in the submitted list;
 * a missing {@code id} gets a fresh one.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BranchRequest {

    private String id;
    private Integer order;
    private String condition;
    private Double outputValue;
    private Double hysteresis;
    private String name;
}
