package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Lifecycle date fields a record may carry. Entering a status stamps the field
 * returned by {@link QmsStatus#getEntryDateField()}.
 */
@Getter
@AllArgsConstructor
public enum QmsRecordDateField {

    CREATED_AT("createdAt"),
    OPENED_DATE("openedDate"),
    SUBMITTED_DATE("submittedDate"),
    IMPLEMENTATION_START_DATE("implementationStartDate"),
    VERIFICATION_REQUESTED_DATE("verificationRequestedDate"),
    VERIFICATION_DATE("verificationDate"),
    CANCELLED_DATE("cancelledDate"),
    ISSUE_DATE("issueDate"),
    RESPONSE_DATE("responseDate"),
    REVIEW_START_DATE("reviewStartDate"),
    REVIEW_DATE("reviewDate"),
    DISPOSITION_REQUESTED_DATE("dispositionRequestedDate"),
    APPROVAL_DATE("approvalDate"),
    REJECTION_DATE("rejectionDate"),
    CLOSED_DATE("closedDate");

    private final String fieldName;
}
