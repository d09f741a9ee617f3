package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supplier Corrective Action Request statuses.
 */
@Getter
@AllArgsConstructor
public enum ScarStatus implements QmsStatus {

    DRAFT("draft", "Draft", null),
    ISSUED("issued", "Issued", QmsRecordDateField.ISSUE_DATE),
    SUPPLIER_RESPONSE("supplier_response", "Supplier Response", QmsRecordDateField.RESPONSE_DATE),
    REVIEW("review", "Review", QmsRecordDateField.REVIEW_DATE),
    CLOSED("closed", "Closed", QmsRecordDateField.CLOSED_DATE);

    private final String value;
    private final String label;

    @Getter(AccessLevel.NONE)
    private final QmsRecordDateField entryDateField;

    @Override
    public QmsRecordKind getKind() {
        return QmsRecordKind.SCAR;
    }

    @Override
    public Optional<QmsRecordDateField> getEntryDateField() {
        return Optional.ofNullable(entryDateField);
    }

    public static Optional<ScarStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
