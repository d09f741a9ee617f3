package com.plantops.qms.lifecycle.core.exception;

public class QmsLifecycleRuntimeException extends RuntimeException {
    public QmsLifecycleRuntimeException(String message) {
        super(message);
    }
    public QmsLifecycleRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public QmsLifecycleRuntimeException(Throwable cause) {
        super(cause);
    }
}
