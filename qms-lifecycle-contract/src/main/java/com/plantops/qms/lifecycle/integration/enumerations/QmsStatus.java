package com.plantops.qms.lifecycle.integration.enumerations;

import java.util.Optional;

/**
 * A lifecycle status. Every record kind has its own closed vocabulary
 * implemented as an enum; there is no status shared across kinds.
 *
 * <p>Declaration order inside a vocabulary is the canonical progression order:
 * a transition whose target is declared before its source moves a record
 * backwards.</p>
 *
 * @see NcrStatus
 * @see CapaStatus
 * @see ScarStatus
 * @see MrbStatus
 */
public interface QmsStatus {

    /**
     * The persisted value, e.g. {@code pending_disposition}.
     */
    String getValue();

    /**
     * Human readable label.
     */
    String getLabel();

    /**
     * The record kind owning this vocabulary.
     */
    QmsRecordKind getKind();

    /**
     * The date field stamped when a record enters this status, if any.
     */
    Optional<QmsRecordDateField> getEntryDateField();

    /**
     * Position within the vocabulary's canonical order.
     */
    int ordinal();

    /**
     * Enum constant name.
     */
    String name();
}
