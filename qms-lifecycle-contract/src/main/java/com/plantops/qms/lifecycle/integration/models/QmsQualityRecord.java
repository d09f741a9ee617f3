package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordDateField;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a quality record (NCR, CAPA, SCAR or MRB).
 *
 * <p>The status always belongs to the vocabulary of the record's kind. Lifecycle
 * dates are kept in {@link #getDates()}; the creation timestamp is exposed through
 * {@link QmsRecordDateField#CREATED_AT} as well.</p>
 *
 * <pre>{@code
 * QmsQualityRecord ncr = QmsQualityRecord.builder()
 *     .id("ncr-1")
 *     .number("NCR-2024-0001")
 *     .kind(QmsRecordKind.NCR)
 *     .status(NcrStatus.DRAFT)
 *     .createdAt(Instant.parse("2024-01-02T08:00:00Z"))
 *     .build();
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class QmsQualityRecord {

    @NotBlank(message = "record id must not be blank")
    private final String id;

    private final String number;

    private final String title;

    @NotNull(message = "record kind must not be null")
    private final QmsRecordKind kind;

    @NotNull(message = "record status must not be null")
    private final QmsStatus status;

    @NotNull(message = "record createdAt must not be null")
    private final Instant createdAt;

    private final Instant updatedAt;

    private final String createdBy;

    @PositiveOrZero
    private final long version;

    private final Map<QmsRecordDateField, Instant> dates;

    private final QmsSupplierResponse supplierResponse;

    private QmsQualityRecord(String id,
                             String number,
                             String title,
                             QmsRecordKind kind,
                             QmsStatus status,
                             Instant createdAt,
                             Instant updatedAt,
                             String createdBy,
                             long version,
                             Map<QmsRecordDateField, Instant> dates,
                             QmsSupplierResponse supplierResponse) {
        this.id = id;
        this.number = number;
        this.title = title;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        if (status.getKind() != kind) {
            throw new IllegalArgumentException(
                    "Status " + status.getValue() + " is not part of the " + kind + " vocabulary");
        }
        if (supplierResponse != null && kind != QmsRecordKind.SCAR) {
            throw new IllegalArgumentException("Only SCAR records carry a supplier response, got " + kind);
        }
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.createdBy = createdBy;
        this.version = version;
        this.dates = copyDates(dates);
        this.supplierResponse = supplierResponse;
    }

    private static Map<QmsRecordDateField, Instant> copyDates(Map<QmsRecordDateField, Instant> dates) {
        EnumMap<QmsRecordDateField, Instant> copy = new EnumMap<>(QmsRecordDateField.class);
        if (dates != null) {
            dates.forEach((field, value) -> {
                if (field != QmsRecordDateField.CREATED_AT && value != null) {
                    copy.put(field, value);
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the value of a lifecycle date field.
     * {@link QmsRecordDateField#RESPONSE_DATE} falls back to the supplier response.
     */
    public Optional<Instant> getDate(QmsRecordDateField field) {
        if (field == QmsRecordDateField.CREATED_AT) {
            return Optional.ofNullable(createdAt);
        }
        Instant value = dates.get(field);
        if (value == null && field == QmsRecordDateField.RESPONSE_DATE && supplierResponse != null) {
            return supplierResponse.getResponseDate();
        }
        return Optional.ofNullable(value);
    }

    public Optional<QmsSupplierResponse> getSupplierResponse() {
        return Optional.ofNullable(supplierResponse);
    }

    /**
     * Copy of this record moved to {@code newStatus} at {@code changedAt}. The target
     * status's entry date field is stamped, the version incremented.
     */
    public QmsQualityRecord withStatusChange(QmsStatus newStatus, Instant changedAt) {
        EnumMap<QmsRecordDateField, Instant> updatedDates = new EnumMap<>(QmsRecordDateField.class);
        updatedDates.putAll(dates);
        newStatus.getEntryDateField().ifPresent(field -> updatedDates.put(field, changedAt));
        return toBuilder()
                .status(newStatus)
                .updatedAt(changedAt)
                .version(version + 1)
                .dates(updatedDates)
                .build();
    }
}
