package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Material Review Board statuses.
 *
 * <p>{@link #APPROVED} and {@link #REJECTED} are alternative decisions; both
 * still move on to {@link #CLOSED}.</p>
 */
@Getter
@AllArgsConstructor
public enum MrbStatus implements QmsStatus {

    PENDING_REVIEW("pending_review", "Pending Review", null),
    IN_REVIEW("in_review", "In Review", QmsRecordDateField.REVIEW_START_DATE),
    DISPOSITION_PENDING("disposition_pending", "Disposition Pending", QmsRecordDateField.DISPOSITION_REQUESTED_DATE),
    APPROVED("approved", "Approved", QmsRecordDateField.APPROVAL_DATE),
    REJECTED("rejected", "Rejected", QmsRecordDateField.REJECTION_DATE),
    CLOSED("closed", "Closed", QmsRecordDateField.CLOSED_DATE);

    /**
     * Older MRB documents persist the disposition step under the NCR spelling.
     */
    private static final String LEGACY_DISPOSITION_PENDING = "pending_disposition";

    private final String value;
    private final String label;

    @Getter(AccessLevel.NONE)
    private final QmsRecordDateField entryDateField;

    @Override
    public QmsRecordKind getKind() {
        return QmsRecordKind.MRB;
    }

    @Override
    public Optional<QmsRecordDateField> getEntryDateField() {
        return Optional.ofNullable(entryDateField);
    }

    public static Optional<MrbStatus> fromValue(String value) {
        String normalized = value.trim();
        if (LEGACY_DISPOSITION_PENDING.equalsIgnoreCase(normalized)) {
            return Optional.of(DISPOSITION_PENDING);
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
