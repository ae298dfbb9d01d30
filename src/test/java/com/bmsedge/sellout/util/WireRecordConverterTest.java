package com.bmsedge.sellout.util;

import com.bmsedge.sellout.dto.CanonicalEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WireRecordConverterTest {

    private CanonicalEntry entry(BigDecimal salesEur) {
        return CanonicalEntry.builder()
                .uploadId("upload-1")
                .reseller("Boxnox")
                .productEan("7350154320008")
                .month(1)
                .year(2024)
                .quantity(1)
                .salesLc("202,48")
                .salesEur(salesEur)
                .currency("EUR")
                .functionalName("BBSC100")
                .sourceRow(5)
                .build();
    }

    @Test
    @DisplayName("Should convert every field to a wire-safe primitive")
    void testToWireRecord() {
        // Arrange
        Instant createdAt = Instant.parse("2025-05-01T10:15:30Z");

        // Act
        Map<String, Object> record = WireRecordConverter.toWireRecord(entry(new BigDecimal("202.48")), createdAt);

        // Assert
        assertEquals("upload-1", record.get("upload_id"));
        assertEquals(1, record.get("month"));
        assertEquals(2024, record.get("year"));
        assertEquals(1, record.get("quantity"));
        assertEquals("202,48", record.get("sales_lc"));
        assertEquals(202.48, record.get("sales_eur"));
        assertEquals("2025-05-01T10:15:30Z", record.get("created_at"));
        assertFalse(record.containsKey("source_row"));
        for (Object value : record.values()) {
            assertTrue(value == null || value instanceof String || value instanceof Integer || value instanceof Double,
                    "unexpected type " + value.getClass());
        }
    }

    @Test
    @DisplayName("Should keep null optional fields as nulls")
    void testNullFields() {
        Map<String, Object> record = WireRecordConverter.toWireRecord(entry(null), null);

        assertTrue(record.containsKey("sales_eur"));
        assertNull(record.get("sales_eur"));
        assertNull(record.get("created_at"));
    }

    @Test
    @DisplayName("Should restore the entry from its wire record")
    void testFromWireRecord() {
        CanonicalEntry original = entry(new BigDecimal("202.48"));

        CanonicalEntry restored = WireRecordConverter.fromWireRecord(
                WireRecordConverter.toWireRecord(original, Instant.now()));

        assertEquals(original.getReseller(), restored.getReseller());
        assertEquals(original.getProductEan(), restored.getProductEan());
        assertEquals(original.getMonth(), restored.getMonth());
        assertEquals(original.getSalesLc(), restored.getSalesLc());
        assertEquals(0, original.getSalesEur().compareTo(restored.getSalesEur()));
        assertNull(restored.getSourceRow());
    }

    @Test
    @DisplayName("Should restore an entry equal to the one written")
    void testFromWireRecordWholeEntry() {
        // Arrange
        CanonicalEntry whole = entry(new BigDecimal("116"));
        CanonicalEntry fractional = entry(new BigDecimal("202.48"));

        // Act
        CanonicalEntry restoredWhole = WireRecordConverter.fromWireRecord(
                WireRecordConverter.toWireRecord(whole, Instant.now()));
        CanonicalEntry restoredFractional = WireRecordConverter.fromWireRecord(
                WireRecordConverter.toWireRecord(fractional, Instant.now()));

        // Assert
        assertEquals(whole, restoredWhole);
        assertEquals(fractional, restoredFractional);
    }

    @Test
    @DisplayName("Should read created_at back from the wire record")
    void testCreatedAt() {
        Instant createdAt = Instant.parse("2025-05-01T10:15:30Z");

        assertEquals(createdAt, WireRecordConverter.createdAt(
                WireRecordConverter.toWireRecord(entry(null), createdAt)));
        assertNull(WireRecordConverter.createdAt(WireRecordConverter.toWireRecord(entry(null), null)));
    }
}
