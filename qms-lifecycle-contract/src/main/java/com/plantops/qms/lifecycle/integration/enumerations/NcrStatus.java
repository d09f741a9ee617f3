package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Non-Conformance Report statuses.
 */
@Getter
@AllArgsConstructor
public enum NcrStatus implements QmsStatus {

    DRAFT("draft", "Draft", null),
    OPEN("open", "Open", QmsRecordDateField.OPENED_DATE),
    UNDER_REVIEW("under_review", "Under Review", QmsRecordDateField.REVIEW_DATE),
    PENDING_DISPOSITION("pending_disposition", "Pending Disposition", QmsRecordDateField.DISPOSITION_REQUESTED_DATE),
    CLOSED("closed", "Closed", QmsRecordDateField.CLOSED_DATE);

    private final String value;
    private final String label;

    @Getter(AccessLevel.NONE)
    private final QmsRecordDateField entryDateField;

    @Override
    public QmsRecordKind getKind() {
        return QmsRecordKind.NCR;
    }

    @Override
    public Optional<QmsRecordDateField> getEntryDateField() {
        return Optional.ofNullable(entryDateField);
    }

    public static Optional<NcrStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
