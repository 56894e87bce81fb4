package com.memoryengine.domain.enums;

/** Data type of a global variable. */
public enum GlobalVariableType {
    BOOLEAN,
    FLOAT
}
