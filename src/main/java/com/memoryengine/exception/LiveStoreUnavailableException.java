package com.memoryengine.exception;

/** A live store call could not run: the store executor is saturated or the caller was interrupted. */
public class LiveStoreUnavailableException extends RuntimeException {

    public LiveStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
