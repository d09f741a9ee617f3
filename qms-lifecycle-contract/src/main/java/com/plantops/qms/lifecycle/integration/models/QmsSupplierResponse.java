package com.plantops.qms.lifecycle.integration.models;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

/**
 * Supplier's answer to a SCAR. {@code accepted} stays null until the answer has
 * been reviewed.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class QmsSupplierResponse {

    private final Instant responseDate;
    private final String respondedBy;
    private final Boolean accepted;
    private final String rejectionReason;

    public Optional<Instant> getResponseDate() {
        return Optional.ofNullable(responseDate);
    }

    public boolean isReviewed() {
        return accepted != null;
    }
}
