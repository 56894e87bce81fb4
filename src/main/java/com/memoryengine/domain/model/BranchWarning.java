package com.memoryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A branch whose condition could not be evaluated this cycle; it was treated as false. */
@Getter
@AllArgsConstructor
@Builder
@ToString
public class BranchWarning {

    private final int branchOrder;
    private final String branchId;
    private final String branchName;
    private final String message;
}
