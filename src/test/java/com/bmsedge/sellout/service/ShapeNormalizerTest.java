package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.AuditTrail;
import com.bmsedge.sellout.dto.CleanedRow;
import com.bmsedge.sellout.dto.PeriodCell;
import com.bmsedge.sellout.profile.MetricType;
import com.bmsedge.sellout.profile.SourceProfileRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShapeNormalizerTest {

    private ShapeNormalizer shapeNormalizer;
    private SourceProfileRegistry registry;
    private AuditTrail trail;

    @BeforeEach
    void setUp() {
        shapeNormalizer = new ShapeNormalizer();
        registry = new SourceProfileRegistry();
        trail = new AuditTrail();
    }

    private static CleanedRow wideRow(int rowIndex, String name, PeriodCell... cells) {
        CleanedRow.CleanedRowBuilder builder = CleanedRow.builder()
                .rowIndex(rowIndex)
                .productEan("")
                .functionalName(name)
                .currency("EUR")
                .reseller("Aromateque");
        for (PeriodCell cell : cells) {
            builder.periodCell(cell);
        }
        return builder.build();
    }

    private static PeriodCell quantity(int column, int month, String value) {
        return new PeriodCell(column, "M" + month, month, 2025, MetricType.QUANTITY, value);
    }

    private static PeriodCell amount(int column, int month, String value) {
        return new PeriodCell(column, "Value | M" + month, month, 2025, MetricType.SALES_AMOUNT, value);
    }

    private static CleanedRow flatRow(int rowIndex, String name, int quantity, String salesLc) {
        return CleanedRow.builder()
                .rowIndex(rowIndex)
                .productEan("")
                .functionalName(name)
                .month(6)
                .year(2025)
                .quantity(quantity)
                .salesLc(salesLc)
                .salesAmount(new BigDecimal(salesLc))
                .currency("GBP")
                .reseller("Liberty")
                .build();
    }

    @Test
    @DisplayName("Wide rows unpivot into one row per period with a value")
    void testUnpivot() {
        // Arrange
        List<CleanedRow> rows = List.of(
                wideRow(1, "PERFUME A", quantity(2, 1, "4"), quantity(3, 2, "6"), quantity(4, 3, "1")),
                wideRow(2, "PERFUME B", quantity(2, 1, "2"), quantity(4, 3, "5")));

        // Act
        List<CleanedRow> result = shapeNormalizer.normalize(rows, registry.find("aromateque").orElseThrow(), trail);

        // Assert
        assertEquals(5, result.size());
        CleanedRow first = result.get(0);
        assertFalse(first.isWide());
        assertEquals("PERFUME A", first.getFunctionalName());
        assertEquals(1, first.getMonth());
        assertEquals(2025, first.getYear());
        assertEquals(4, first.getQuantity());
        assertEquals(3, result.get(4).getMonth());
        assertEquals(5, result.get(4).getQuantity());
        assertEquals(5, trail.getRecords().stream()
                .filter(r -> ShapeNormalizer.TYPE_UNPIVOT.equals(r.getTransformationType())).count());
    }

    @Test
    @DisplayName("Units and value cells of the same month merge into one row")
    void testUnitsAndValueMerge() {
        List<CleanedRow> rows = List.of(wideRow(1, "ПАРФУМ",
                quantity(1, 1, "3"), quantity(2, 2, "0"),
                amount(3, 1, "300,50"), amount(4, 2, "120"), amount(5, 3, "90")));

        List<CleanedRow> result = shapeNormalizer.normalize(rows, registry.find("ukraine").orElseThrow(), trail);

        // March has an amount but no units cell
        assertEquals(2, result.size());
        assertEquals(3, result.get(0).getQuantity());
        assertEquals("300,50", result.get(0).getSalesLc());
        assertEquals(0, new BigDecimal("300.50").compareTo(result.get(0).getSalesAmount()));
        assertEquals(0, result.get(1).getQuantity());
        assertEquals(2, result.get(1).getMonth());
        assertEquals(1, trail.getRowsSkipped());
    }

    @Test
    @DisplayName("Invalid period values are dropped without failing the row's other periods")
    void testInvalidPeriodValue() {
        List<CleanedRow> rows = List.of(wideRow(1, "PERFUME A", quantity(2, 1, "n/a"), quantity(3, 2, "2.5"), quantity(4, 3, "7")));

        List<CleanedRow> result = shapeNormalizer.normalize(rows, registry.find("aromateque").orElseThrow(), trail);

        assertEquals(1, result.size());
        assertEquals(7, result.get(0).getQuantity());
        assertEquals(2, trail.getRowsSkipped());
    }

    @Test
    @DisplayName("Flat profiles without dedup pass rows through")
    void testFlatPassThrough() {
        List<CleanedRow> rows = List.of(flatRow(1, "A", 1, "10"), flatRow(2, "A", 1, "10"));

        List<CleanedRow> result = shapeNormalizer.normalize(rows, registry.find("skins_nl").orElseThrow(), trail);

        assertSame(rows, result);
    }

    @Test
    @DisplayName("Of a duplicated pair only the later row is kept")
    void testPairReconciliation() {
        // Arrange
        List<CleanedRow> rows = List.of(
                flatRow(1, "Perfume A", 2, "50"),
                flatRow(2, "Perfume A", 2, "50"),
                flatRow(3, "Perfume B", 1, "30"));

        // Act
        List<CleanedRow> result = shapeNormalizer.normalize(rows, registry.find("liberty").orElseThrow(), trail);

        // Assert
        assertEquals(2, result.size());
        assertEquals(2, result.get(0).getRowIndex());
        assertEquals(3, result.get(1).getRowIndex());
        assertEquals(1, trail.getRowsSkipped());
        assertTrue(trail.getRecords().stream()
                .anyMatch(r -> r.getRowIndex() == 1 && ShapeNormalizer.PAIR_RECONCILIATION.equals(r.getCleanedValue())));
    }

    @Test
    @DisplayName("Groups of three or more rows are kept and reported as anomalies")
    void testDedupAnomaly() {
        List<CleanedRow> rows = List.of(
                flatRow(1, "Perfume A", 2, "50"),
                flatRow(2, "Perfume A", 2, "50"),
                flatRow(3, "Perfume A", 2, "50"));

        List<CleanedRow> result = shapeNormalizer.normalize(rows, registry.find("liberty").orElseThrow(), trail);

        assertEquals(3, result.size());
        assertEquals(1, trail.getAnomalies());
        assertEquals(0, trail.getRowsSkipped());
    }
}
