package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.dto.CleanedRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalMapperTest {

    private CanonicalMapper canonicalMapper;

    @BeforeEach
    void setUp() {
        canonicalMapper = new CanonicalMapper();
    }

    private static CleanedRow.CleanedRowBuilder row() {
        return CleanedRow.builder()
                .rowIndex(7)
                .productEan("7350154320008")
                .functionalName("BBSC100")
                .month(1)
                .year(2024)
                .quantity(1)
                .salesLc("202,48")
                .salesAmount(new BigDecimal("202.48"))
                .reseller("Boxnox");
    }

    @Test
    @DisplayName("EUR rows carry sales_eur from the local amount")
    void testEurRow() {
        // Act
        List<CanonicalEntry> entries = canonicalMapper.map(List.of(row().currency("EUR").build()), "upload-1");

        // Assert
        assertEquals(1, entries.size());
        CanonicalEntry entry = entries.get(0);
        assertEquals("upload-1", entry.getUploadId());
        assertEquals("Boxnox", entry.getReseller());
        assertEquals("7350154320008", entry.getProductEan());
        assertEquals(1, entry.getMonth());
        assertEquals(2024, entry.getYear());
        assertEquals(1, entry.getQuantity());
        assertEquals("202,48", entry.getSalesLc());
        assertEquals(new BigDecimal("202.48"), entry.getSalesEur());
        assertEquals("BBSC100", entry.getFunctionalName());
        assertEquals(7, entry.getSourceRow());
    }

    @Test
    @DisplayName("Other currencies leave sales_eur empty unless the source had it")
    void testNonEurRow() {
        List<CanonicalEntry> entries = canonicalMapper.map(List.of(
                row().currency("GBP").build(),
                row().currency("SEK").salesEur(new BigDecimal("17.90")).build()), "upload-1");

        assertNull(entries.get(0).getSalesEur());
        assertEquals(new BigDecimal("17.9"), entries.get(1).getSalesEur());
    }

    @Test
    @DisplayName("Blank EAN maps to null, missing name to empty text")
    void testBlankEanAndName() {
        CanonicalEntry entry = canonicalMapper.map(List.of(row().productEan("").functionalName(null).currency("EUR").build()),
                "upload-1").get(0);

        assertNull(entry.getProductEan());
        assertEquals("", entry.getFunctionalName());
    }

    @Test
    @DisplayName("Source row does not take part in equality")
    void testSourceRowExcludedFromEquality() {
        List<CanonicalEntry> entries = canonicalMapper.map(List.of(
                row().currency("EUR").build(),
                row().rowIndex(8).currency("EUR").build()), "upload-1");

        assertEquals(entries.get(0), entries.get(1));
    }
}
