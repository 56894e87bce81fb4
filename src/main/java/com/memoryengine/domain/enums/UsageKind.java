package com.memoryengine.domain.enums;

/** How an IF memory refers to a global variable. */
public enum UsageKind {
    INPUT,
    OUTPUT
}
