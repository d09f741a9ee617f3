package com.plantops.qms.lifecycle.core.exception;

import com.plantops.qms.lifecycle.core.exception.codes.QmsLifecycleErrorCodes;
import lombok.Getter;

import java.util.List;

/**
 * Raised when a lifecycle definition or engine configuration is malformed.
 * Carries every violation found, not only the first one.
 */
@Getter
public class QmsLifecycleConfigurationException extends QmsLifecycleRuntimeException {

    private final QmsLifecycleErrorCodes errorCode;
    private final List<String> violations;

    public QmsLifecycleConfigurationException(QmsLifecycleErrorCodes errorCode, List<String> violations) {
        super(errorCode.getErrorCode() + ": " + String.join("; ", violations));
        this.errorCode = errorCode;
        this.violations = List.copyOf(violations);
    }
}
