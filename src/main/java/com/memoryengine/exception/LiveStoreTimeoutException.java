package com.memoryengine.exception;

/** A live store read or write exceeded its time limit. */
public class LiveStoreTimeoutException extends RuntimeException {

    public LiveStoreTimeoutException(String operation, Throwable cause) {
        super("Live store " + operation + " timed out", cause);
    }
}
