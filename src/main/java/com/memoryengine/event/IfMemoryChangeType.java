package com.memoryengine.event;

public enum IfMemoryChangeType {
    CREATED,
    UPDATED,
    DELETED
}
