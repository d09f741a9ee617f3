package com.plantops.qms.lifecycle.core.exception.codes;

import com.plantops.qms.lifecycle.integration.contract.IQmsErrorInfo;
import com.plantops.qms.lifecycle.integration.enumerations.QmsHttpStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum QmsLifecycleErrorCodes implements IQmsErrorInfo {

    INVALID_REQUEST(
            "QMS_ERR_0001",
            QmsHttpStatus.BAD_REQUEST,
            "status.update.request.invalid",
            "status.update.request.invalid.resolution"
    ),

    RECORD_NOT_FOUND(
            "QMS_ERR_0002",
            QmsHttpStatus.NOT_FOUND,
            "record.not.found",
            "record.not.found.resolution"
    ),

    INVALID_TRANSITION(
            "QMS_ERR_0003",
            QmsHttpStatus.UNPROCESSABLE_ENTITY,
            "status.transition.invalid",
            "status.transition.invalid.resolution"
    ),

    MISSING_REQUIRED_COMMENT(
            "QMS_ERR_0004",
            QmsHttpStatus.BAD_REQUEST,
            "status.transition.comment.required",
            "status.transition.comment.required.resolution"
    ),

    UNAUTHORIZED(
            "QMS_ERR_0005",
            QmsHttpStatus.FORBIDDEN,
            "status.transition.approval.denied",
            "status.transition.approval.denied.resolution"
    ),

    CONCURRENT_MODIFICATION(
            "QMS_ERR_0006",
            QmsHttpStatus.CONFLICT,
            "record.concurrent.modification",
            "record.concurrent.modification.resolution"
    ),

    PERSISTENCE_ERROR(
            "QMS_ERR_0007",
            QmsHttpStatus.SERVICE_UNAVAILABLE,
            "record.persistence.failed",
            "record.persistence.failed.resolution"
    ),

    LIFECYCLE_DEFINITION_INVALID(
            "QMS_ERR_0008",
            QmsHttpStatus.INTERNAL_SERVER_ERROR,
            "lifecycle.definition.invalid",
            "lifecycle.definition.invalid.resolution"
    ),

    CONFIGURATION_INVALID(
            "QMS_ERR_0009",
            QmsHttpStatus.INTERNAL_SERVER_ERROR,
            "lifecycle.configuration.invalid",
            "lifecycle.configuration.invalid.resolution"
    ),

    SNAPSHOT_MAPPING_FAILED(
            "QMS_ERR_0010",
            QmsHttpStatus.UNPROCESSABLE_ENTITY,
            "record.snapshot.mapping.failed",
            "record.snapshot.mapping.failed.resolution"
    )

    ;

    private final String errorCode;
    private final QmsHttpStatus httpStatus;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
