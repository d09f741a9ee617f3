package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Corrective/Preventive Action statuses.
 *
 * <p>{@link #CANCELLED} is a first-class status with its own edges. It belongs to
 * no milestone stage and only moves on to {@link #CLOSED}.</p>
 */
@Getter
@AllArgsConstructor
public enum CapaStatus implements QmsStatus {

    DRAFT("draft", "Draft", null),
    OPEN("open", "Open", QmsRecordDateField.SUBMITTED_DATE),
    IN_PROGRESS("in_progress", "In Progress", QmsRecordDateField.IMPLEMENTATION_START_DATE),
    PENDING_VERIFICATION("pending_verification", "Pending Verification", QmsRecordDateField.VERIFICATION_REQUESTED_DATE),
    VERIFIED("verified", "Verified", QmsRecordDateField.VERIFICATION_DATE),
    CANCELLED("cancelled", "Cancelled", QmsRecordDateField.CANCELLED_DATE),
    CLOSED("closed", "Closed", QmsRecordDateField.CLOSED_DATE);

    private final String value;
    private final String label;

    @Getter(AccessLevel.NONE)
    private final QmsRecordDateField entryDateField;

    @Override
    public QmsRecordKind getKind() {
        return QmsRecordKind.CAPA;
    }

    @Override
    public Optional<QmsRecordDateField> getEntryDateField() {
        return Optional.ofNullable(entryDateField);
    }

    public static Optional<CapaStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
