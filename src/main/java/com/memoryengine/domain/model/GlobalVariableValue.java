package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.GlobalVariableType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Live value of a global variable as held in Redis.
 *
 * <p>{@code value} is text: {@code "true"}/{@code "false"} for BOOLEAN variables,
 * a decimal number for FLOAT variables. Only enabled variables have a record.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GlobalVariableValue {

    private String name;
    private GlobalVariableType variableType;
    private String value;
    private long updatedAtEpochMs;

    public static String defaultValueFor(GlobalVariableType variableType) {
        return variableType == GlobalVariableType.BOOLEAN ? "false" : "0";
    }
}
