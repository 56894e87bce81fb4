package com.memoryengine.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BranchWarningResponse {

    private int branchOrder;
    private String branchId;
    private String branchName;
    private String message;
}
