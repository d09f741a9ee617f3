package com.plantops.qms.lifecycle.core.exception;

import com.plantops.qms.lifecycle.core.exception.codes.QmsLifecycleErrorCodes;
import lombok.Getter;

/**
 * A stored document could not be turned into a quality record.
 */
@Getter
public class QmsSnapshotMappingException extends QmsLifecycleException {

    private final QmsLifecycleErrorCodes errorCode = QmsLifecycleErrorCodes.SNAPSHOT_MAPPING_FAILED;

    public QmsSnapshotMappingException(String message) {
        super(message);
    }

    public QmsSnapshotMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
