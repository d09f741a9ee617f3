package com.plantops.qms.lifecycle.core.exception;

public class QmsLifecycleException extends Exception {
    public QmsLifecycleException(String message) {
        super(message);
    }
    public QmsLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
    public QmsLifecycleException(Throwable cause) {
        super(cause);
    }
}
