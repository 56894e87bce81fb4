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
public class BranchResponse {

    private String id;
    private int order;
    private String condition;
    private double outputValue;
    private double hysteresis;
    private String name;
}
