package com.plantops.qms.lifecycle.integration.models;

import com.plantops.qms.lifecycle.integration.enumerations.CapaStatus;
import com.plantops.qms.lifecycle.integration.enumerations.NcrStatus;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordDateField;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.ScarStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QmsQualityRecord")
class QmsQualityRecordTest {

    private static final Instant CREATED = Instant.parse("2024-01-02T08:00:00Z");

    @Test
    @DisplayName("status from another kind's vocabulary is rejected")
    void shouldRejectForeignStatus() {
        assertThrows(IllegalArgumentException.class, () -> QmsQualityRecord.builder()
                .id("r-1").kind(QmsRecordKind.NCR).status(CapaStatus.OPEN).createdAt(CREATED).build());
    }

    @Test
    @DisplayName("supplier response is only allowed on SCAR records")
    void shouldRejectSupplierResponseOutsideScar() {
        QmsSupplierResponse response = QmsSupplierResponse.builder().respondedBy("acme").build();
        assertThrows(IllegalArgumentException.class, () -> QmsQualityRecord.builder()
                .id("r-1").kind(QmsRecordKind.NCR).status(NcrStatus.OPEN).createdAt(CREATED)
                .supplierResponse(response).build());
    }

    @Test
    @DisplayName("status change stamps the entry date and bumps the version")
    void shouldStampEntryDate() {
        // Given
        QmsQualityRecord record = QmsQualityRecord.builder()
                .id("ncr-1").kind(QmsRecordKind.NCR).status(NcrStatus.PENDING_DISPOSITION)
                .createdAt(CREATED).version(3).build();
        Instant now = Instant.parse("2024-03-01T10:15:00Z");

        // When
        QmsQualityRecord closed = record.withStatusChange(NcrStatus.CLOSED, now);

        // Then
        assertEquals(NcrStatus.CLOSED, closed.getStatus());
        assertEquals(now, closed.getDate(QmsRecordDateField.CLOSED_DATE).orElseThrow());
        assertEquals(now, closed.getUpdatedAt());
        assertEquals(4, closed.getVersion());
        assertTrue(record.getDate(QmsRecordDateField.CLOSED_DATE).isEmpty());
    }

    @Test
    @DisplayName("response date falls back to the supplier response")
    void shouldFallBackToSupplierResponseDate() {
        Instant responded = Instant.parse("2024-02-10T00:00:00Z");
        QmsQualityRecord scar = QmsQualityRecord.builder()
                .id("scar-1").kind(QmsRecordKind.SCAR).status(ScarStatus.SUPPLIER_RESPONSE).createdAt(CREATED)
                .supplierResponse(QmsSupplierResponse.builder().responseDate(responded).build())
                .build();

        assertEquals(responded, scar.getDate(QmsRecordDateField.RESPONSE_DATE).orElseThrow());
        assertEquals(CREATED, scar.getDate(QmsRecordDateField.CREATED_AT).orElseThrow());
    }

    @Test
    void shouldIgnoreCreatedAtInDateMap() {
        QmsQualityRecord record = QmsQualityRecord.builder()
                .id("ncr-1").kind(QmsRecordKind.NCR).status(NcrStatus.DRAFT).createdAt(CREATED)
                .dates(Map.of(QmsRecordDateField.CREATED_AT, Instant.EPOCH))
                .build();

        assertEquals(CREATED, record.getDate(QmsRecordDateField.CREATED_AT).orElseThrow());
        assertTrue(record.getDates().isEmpty());
    }
}
