package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.SheetTable;
import com.bmsedge.sellout.exception.UnreadableFileException;
import com.bmsedge.sellout.profile.SourceProfileRegistry;
import com.bmsedge.sellout.support.WorkbookFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bmsedge.sellout.support.WorkbookFixtures.row;
import static org.junit.jupiter.api.Assertions.*;

class SheetLoaderTest {

    private SheetLoader sheetLoader;
    private SourceProfileRegistry registry;

    @BeforeEach
    void setUp() {
        sheetLoader = new SheetLoader();
        registry = new SourceProfileRegistry();
    }

    @Test
    @DisplayName("Should pick the preferred sheet and drop empty rows")
    void testLoadPreferredSheet() {
        // Arrange
        Map<String, Object[][]> sheets = new LinkedHashMap<>();
        sheets.put("Summary", new Object[][]{row("Totals only")});
        sheets.put("Sell Out by EAN", new Object[][]{
                row("EAN", "QTY", "AMOUNT", "MONTH", "YEAR", "SKU"),
                row(7350154320008L, 1, "202,48", 1, 2024, "BBSC100"),
                row(),
                null,
                row(7350154320015L, 2, "99,00", 1, 2024, "BBSC050")
        });
        byte[] content = WorkbookFixtures.xlsx(sheets);

        // Act
        SheetTable table = sheetLoader.load(content, "boxnox.xlsx", registry.find("boxnox").get());

        // Assert
        assertEquals("Sell Out by EAN", table.getSheetName());
        assertEquals(List.of("Summary", "Sell Out by EAN"), table.getSheetNames());
        assertEquals(List.of("EAN", "QTY", "AMOUNT", "MONTH", "YEAR", "SKU"), table.getHeaders());
        assertEquals(2, table.getRows().size());
        assertEquals("7350154320008", table.getRows().get(0).cell(0));
        assertEquals(4, table.getRows().get(1).getRowNumber());
    }

    @Test
    @DisplayName("Should list sheet names without loading data")
    void testInspect() {
        Map<String, Object[][]> sheets = new LinkedHashMap<>();
        sheets.put("First", new Object[][]{row("a")});
        sheets.put("TDSheet", new Object[][]{row("b")});

        assertEquals(List.of("First", "TDSheet"), sheetLoader.inspect(WorkbookFixtures.xlsx(sheets), "x.xlsx"));
        assertEquals(List.of("export"), sheetLoader.inspect(new byte[]{1}, "export.csv"));
    }

    @Test
    @DisplayName("Should keep rows above the header row as preamble")
    void testHeaderRowOffset() {
        byte[] content = WorkbookFixtures.xlsx("Sheet1",
                row("Creme de la Creme sell-out"),
                row("", "2025 March"),
                row(),
                row("No", "EAN", "Name"),
                row(1, 7350154320008L, "Perfume A"));

        SheetTable table = sheetLoader.load(content, "CDLC report.xlsx", registry.find("cdlc").get());

        assertEquals(3, table.getPreamble().size());
        assertEquals("2025 March", table.getPreamble().get(1).get(1));
        assertEquals(List.of("No", "EAN", "Name"), table.getHeaders());
        assertEquals(1, table.getRows().size());
        assertEquals(4, table.getRows().get(0).getRowNumber());
    }

    @Test
    @DisplayName("Should merge a two-row header into section and month labels")
    void testTwoRowHeader() {
        byte[] content = WorkbookFixtures.xlsx("TDSheet",
                row("Товар", "Кількість", null, "Сума", null),
                row(null, "Січень 2025", "Лютий 2025", "Січень 2025", "Лютий 2025"),
                row("Парфум А", 3, 2, 300, 200));

        SheetTable table = sheetLoader.load(content, "Ukraine 2025.xlsx", registry.find("ukraine").get());

        assertEquals(List.of("Товар", "Кількість | Січень 2025", "Кількість | Лютий 2025",
                "Сума | Січень 2025", "Сума | Лютий 2025"), table.getHeaders());
        assertEquals(1, table.getRows().size());
    }

    @Test
    @DisplayName("A standalone label does not spread into following columns")
    void testMergeHeaderRowsStandaloneLabel() {
        List<String> merged = SheetLoader.mergeHeaderRows(
                List.of("Product", "", "Units", "", "Total"),
                List.of("", "Code", "Jan", "Feb", ""));

        assertEquals(List.of("Product", "Code", "Units | Jan", "Units | Feb", "Total"), merged);
    }

    @Test
    @DisplayName("Should guess the header row for the generic profile")
    void testGuessHeaderRow() {
        byte[] content = WorkbookFixtures.xlsx("Sheet1",
                row("Monthly export"),
                row(),
                row("Product EAN", "Quantity", "Month", "Year"),
                row("7350154320008", 4, 3, 2025));

        SheetTable table = sheetLoader.load(content, "export.xlsx", registry.fallback());

        assertEquals(List.of("Product EAN", "Quantity", "Month", "Year"), table.getHeaders());
        assertEquals(1, table.getRows().size());
    }

    @Test
    @DisplayName("Should read CSV files as a single sheet")
    void testLoadCsv() {
        byte[] content = "\uFEFFProduct EAN,Quantity,Month,Year\n7350154320008,4,3,2025\n,,,\n"
                .getBytes(StandardCharsets.UTF_8);

        SheetTable table = sheetLoader.load(content, "export.csv", registry.fallback());

        assertEquals("export", table.getSheetName());
        assertEquals("Product EAN", table.getHeaders().get(0));
        assertEquals(1, table.getRows().size());
        assertEquals("4", table.getRows().get(0).cell(1));
    }

    @Test
    @DisplayName("Should raise UnreadableFile for content that is not a workbook")
    void testUnreadable() {
        byte[] garbage = "definitely not a spreadsheet".getBytes(StandardCharsets.UTF_8);

        UnreadableFileException exception = assertThrows(UnreadableFileException.class,
                () -> sheetLoader.load(garbage, "report.xlsx", registry.fallback()));

        assertEquals("UNREADABLE_FILE", exception.getErrorCode());
        assertThrows(UnreadableFileException.class, () -> sheetLoader.inspect(new byte[0], "report.xlsx"));
    }
}
