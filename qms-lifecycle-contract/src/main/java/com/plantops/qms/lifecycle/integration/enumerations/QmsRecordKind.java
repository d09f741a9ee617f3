package com.plantops.qms.lifecycle.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The four quality record kinds. A record's kind selects its status vocabulary
 * and rule table and never changes after creation.
 */
@Getter
@AllArgsConstructor
public enum QmsRecordKind {

    /**
     * Non-Conformance Report.
     */
    NCR("ncr", "Non-Conformance Report"),

    /**
     * Corrective/Preventive Action.
     */
    CAPA("capa", "Corrective/Preventive Action"),

    /**
     * Supplier Corrective Action Request.
     */
    SCAR("scar", "Supplier Corrective Action Request"),

    /**
     * Material Review Board disposition.
     */
    MRB("mrb", "Material Review Board");

    private final String value;
    private final String displayName;

    /**
     * Returns the kind's status vocabulary in canonical order.
     */
    public List<QmsStatus> getStatuses() {
        return switch (this) {
            case NCR -> List.<QmsStatus>of(NcrStatus.values());
            case CAPA -> List.<QmsStatus>of(CapaStatus.values());
            case SCAR -> List.<QmsStatus>of(ScarStatus.values());
            case MRB -> List.<QmsStatus>of(MrbStatus.values());
        };
    }

    /**
     * Returns the status a record of this kind is created in.
     */
    public QmsStatus getInitialStatus() {
        return switch (this) {
            case NCR -> NcrStatus.DRAFT;
            case CAPA -> CapaStatus.DRAFT;
            case SCAR -> ScarStatus.DRAFT;
            case MRB -> MrbStatus.PENDING_REVIEW;
        };
    }

    /**
     * Resolves a wire value against this kind's vocabulary.
     *
     * @param value the persisted status value, e.g. {@code under_review}
     * @return the status, or empty if the value is not part of the vocabulary
     */
    public Optional<QmsStatus> findStatus(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (this) {
            case NCR -> NcrStatus.fromValue(value).map(QmsStatus.class::cast);
            case CAPA -> CapaStatus.fromValue(value).map(QmsStatus.class::cast);
            case SCAR -> ScarStatus.fromValue(value).map(QmsStatus.class::cast);
            case MRB -> MrbStatus.fromValue(value).map(QmsStatus.class::cast);
        };
    }

    /**
     * Same as {@link #findStatus(String)} but fails on unknown values.
     *
     * @throws IllegalArgumentException if the value is not part of the vocabulary
     */
    public QmsStatus parseStatus(String value) {
        return findStatus(value).orElseThrow(() -> new IllegalArgumentException(
                "Unknown " + name() + " status: " + value));
    }

    public static Optional<QmsRecordKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
