package com.plantops.qms.lifecycle.core.engine.snapshot;

import com.plantops.qms.lifecycle.core.exception.QmsSnapshotMappingException;
import com.plantops.qms.lifecycle.core.util.QmsBeanValidation;
import com.plantops.qms.lifecycle.core.util.QmsDates;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordDateField;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.models.QmsQualityRecord;
import com.plantops.qms.lifecycle.integration.models.QmsSupplierResponse;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts stored documents into normalized {@link QmsQualityRecord}s and back.
 *
 * <p>Documents written by older clients use kind-specific field names: SCARs keep
 * {@code closeDate} instead of {@code closedDate}, the supplier response date sits
 * under {@code supplierResponse.responseDate}, and MRB approvals live under
 * {@code disposition.approvalDate}. Every alias of a date field is tried in order.
 * A date that cannot be parsed is treated as absent; a missing id, status or
 * creation time fails the mapping.</p>
 *
 * <pre>{@code
 * QmsQualityRecord scar = QmsRecordSnapshotMapper.getInstance().fromJson(QmsRecordKind.SCAR, json);
 * }</pre>
 */
@Slf4j
public class QmsRecordSnapshotMapper {

    private static final String SUPPLIER_RESPONSE = "supplierResponse";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private QmsRecordSnapshotMapper() {}

    private static final class SingletonHolder {
        private static final QmsRecordSnapshotMapper INSTANCE = new QmsRecordSnapshotMapper();
    }

    public static QmsRecordSnapshotMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }

    public QmsQualityRecord fromJson(QmsRecordKind kind, String json) throws QmsSnapshotMappingException {
        Map<String, Object> document;
        try {
            document = objectMapper.readValue(json, Map.class);
        } catch (JacksonException e) {
            throw new QmsSnapshotMappingException("Malformed " + kind + " document: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new QmsSnapshotMappingException("Empty " + kind + " document");
        }
        return fromDocument(kind, document);
    }

    public QmsQualityRecord fromDocument(QmsRecordKind kind, Map<String, ?> document) throws QmsSnapshotMappingException {
        String id = text(document, "id").or(() -> text(document, "_id"))
                .orElseThrow(() -> new QmsSnapshotMappingException(kind + " document has no id"));
        String statusValue = text(document, "status")
                .orElseThrow(() -> new QmsSnapshotMappingException(kind + " document " + id + " has no status"));
        QmsStatus status = kind.findStatus(statusValue)
                .orElseThrow(() -> new QmsSnapshotMappingException(
                        kind + " document " + id + " has unknown status '" + statusValue + "'"));
        Instant createdAt = date(document, "createdAt")
                .orElseThrow(() -> new QmsSnapshotMappingException(
                        kind + " document " + id + " has no valid createdAt"));

        Map<QmsRecordDateField, Instant> dates = new EnumMap<>(QmsRecordDateField.class);
        fieldAliases(kind).forEach((field, aliases) -> aliases.stream()
                .map(alias -> date(document, alias))
                .flatMap(Optional::stream)
                .findFirst()
                .ifPresent(value -> dates.put(field, value)));

        QmsQualityRecord record;
        try {
            record = QmsQualityRecord.builder()
                    .id(id)
                    .number(text(document, "number").orElse(null))
                    .title(text(document, "title").orElse(null))
                    .kind(kind)
                    .status(status)
                    .createdAt(createdAt)
                    .updatedAt(date(document, "updatedAt").orElse(null))
                    .createdBy(text(document, "createdBy").orElse(null))
                    .version(number(document, "version").orElse(0L))
                    .dates(dates)
                    .supplierResponse(kind == QmsRecordKind.SCAR ? supplierResponse(document) : null)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new QmsSnapshotMappingException("Invalid " + kind + " document " + id + ": " + e.getMessage(), e);
        }

        List<String> violations = QmsBeanValidation.violationsOf(record);
        if (!violations.isEmpty()) {
            throw new QmsSnapshotMappingException("Invalid " + kind + " document " + id + ": " + violations);
        }
        log.debug("Mapped {} document {} in status {} with dates {}", kind, id, status.getValue(), dates.keySet());
        return record;
    }

    /**
     * Writes the record in the current document layout, using each kind's preferred field names.
     */
    public Map<String, Object> toDocument(QmsQualityRecord record) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", record.getId());
        document.put("number", record.getNumber());
        document.put("title", record.getTitle());
        document.put("kind", record.getKind().getValue());
        document.put("status", record.getStatus().getValue());
        document.put("createdAt", QmsDates.format(record.getCreatedAt()));
        document.put("updatedAt", QmsDates.format(record.getUpdatedAt()));
        document.put("createdBy", record.getCreatedBy());
        document.put("version", record.getVersion());

        Map<QmsRecordDateField, List<String>> aliases = fieldAliases(record.getKind());
        record.getDates().forEach((field, value) -> {
            List<String> names = aliases.get(field);
            String name = names == null || names.get(0).contains(".") ? field.getFieldName() : names.get(0);
            document.put(name, QmsDates.format(value));
        });

        record.getSupplierResponse().ifPresent(response -> {
            Map<String, Object> nested = new LinkedHashMap<>();
            nested.put("responseDate", response.getResponseDate().map(QmsDates::format).orElse(null));
            nested.put("respondedBy", response.getRespondedBy());
            nested.put("accepted", response.getAccepted());
            nested.put("rejectionReason", response.getRejectionReason());
            document.put(SUPPLIER_RESPONSE, nested);
        });
        return document;
    }

    public String toJson(QmsQualityRecord record) {
        return objectMapper.writeValueAsString(toDocument(record));
    }

    /**
     * Document field names of each date field, preferred name first.
     */
    static Map<QmsRecordDateField, List<String>> fieldAliases(QmsRecordKind kind) {
        Map<QmsRecordDateField, List<String>> aliases = new EnumMap<>(QmsRecordDateField.class);
        switch (kind) {
            case NCR -> {
                aliases.put(QmsRecordDateField.OPENED_DATE, List.of("openedDate"));
                aliases.put(QmsRecordDateField.REVIEW_DATE, List.of("reviewDate"));
                aliases.put(QmsRecordDateField.DISPOSITION_REQUESTED_DATE, List.of("dispositionRequestedDate"));
                aliases.put(QmsRecordDateField.CLOSED_DATE, List.of("closedDate", "closeDate"));
            }
            case CAPA -> {
                aliases.put(QmsRecordDateField.SUBMITTED_DATE, List.of("submittedDate"));
                aliases.put(QmsRecordDateField.IMPLEMENTATION_START_DATE, List.of("implementationStartDate"));
                aliases.put(QmsRecordDateField.VERIFICATION_REQUESTED_DATE, List.of("verificationRequestedDate"));
                aliases.put(QmsRecordDateField.VERIFICATION_DATE, List.of("verificationDate"));
                aliases.put(QmsRecordDateField.CANCELLED_DATE, List.of("cancelledDate"));
                aliases.put(QmsRecordDateField.CLOSED_DATE, List.of("closedDate", "closeDate"));
            }
            case SCAR -> {
                aliases.put(QmsRecordDateField.ISSUE_DATE, List.of("issueDate"));
                aliases.put(QmsRecordDateField.RESPONSE_DATE, List.of("responseDate", SUPPLIER_RESPONSE + ".responseDate"));
                aliases.put(QmsRecordDateField.REVIEW_DATE, List.of("reviewDate"));
                aliases.put(QmsRecordDateField.CLOSED_DATE, List.of("closeDate", "closedDate"));
            }
            case MRB -> {
                aliases.put(QmsRecordDateField.REVIEW_START_DATE, List.of("reviewStartDate", "reviewDate"));
                aliases.put(QmsRecordDateField.DISPOSITION_REQUESTED_DATE, List.of("dispositionRequestedDate"));
                aliases.put(QmsRecordDateField.APPROVAL_DATE, List.of("approvalDate", "disposition.approvalDate"));
                aliases.put(QmsRecordDateField.REJECTION_DATE, List.of("rejectionDate"));
                aliases.put(QmsRecordDateField.CLOSED_DATE, List.of("closedDate", "closeDate"));
            }
        }
        return aliases;
    }

    private QmsSupplierResponse supplierResponse(Map<String, ?> document) {
        Object nested = document.get(SUPPLIER_RESPONSE);
        if (!(nested instanceof Map<?, ?> response)) {
            return null;
        }
        Object accepted = response.get("accepted");
        return QmsSupplierResponse.builder()
                .responseDate(date(document, SUPPLIER_RESPONSE + ".responseDate").orElse(null))
                .respondedBy(text(document, SUPPLIER_RESPONSE + ".respondedBy").orElse(null))
                .accepted(accepted instanceof Boolean flag ? flag : null)
                .rejectionReason(text(document, SUPPLIER_RESPONSE + ".rejectionReason").orElse(null))
                .build();
    }

    private static Optional<Object> value(Map<String, ?> document, String path) {
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    private static Optional<String> text(Map<String, ?> document, String path) {
        return value(document, path)
                .map(Object::toString)
                .map(String::trim)
                .filter(text -> !text.isEmpty());
    }

    private static Optional<Long> number(Map<String, ?> document, String path) {
        return value(document, path)
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).longValue());
    }

    private static Optional<Instant> date(Map<String, ?> document, String path) {
        Optional<Object> raw = value(document, path);
        Optional<Instant> parsed = raw.flatMap(QmsDates::parse);
        if (raw.isPresent() && parsed.isEmpty()) {
            log.debug("Ignoring malformed date in field {}: {}", path, raw.get());
        }
        return parsed;
    }
}
