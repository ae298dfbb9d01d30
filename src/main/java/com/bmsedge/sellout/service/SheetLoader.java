package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.RawRow;
import com.bmsedge.sellout.dto.SheetTable;
import com.bmsedge.sellout.exception.UnreadableFileException;
import com.bmsedge.sellout.profile.ColumnRef;
import com.bmsedge.sellout.profile.SourceProfile;
import com.bmsedge.sellout.util.CellValueUtil;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the sheet a profile points at into a headered table.
 * Excel workbooks go through POI, CSV files through OpenCSV as a single sheet.
 */
@Service
public class SheetLoader {

    private static final Logger logger = LoggerFactory.getLogger(SheetLoader.class);

    static final int FALLBACK_HEADER_SCAN_ROWS = 5;
    static final String SECTION_SEPARATOR = " | ";

    public List<String> inspect(byte[] content, String filename) {
        if (isCsv(filename)) {
            return List.of(baseName(filename));
        }
        try (Workbook workbook = openWorkbook(content, filename)) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        } catch (IOException e) {
            throw new UnreadableFileException("Failed to read workbook '" + filename + "': " + e.getMessage(), e);
        }
    }

    public SheetTable load(byte[] content, String filename, SourceProfile profile) {
        List<String> sheetNames;
        String sheetName;
        List<List<String>> grid;

        if (isCsv(filename)) {
            sheetName = baseName(filename);
            sheetNames = List.of(sheetName);
            grid = readCsv(content, filename);
        } else {
            try (Workbook workbook = openWorkbook(content, filename)) {
                sheetNames = new ArrayList<>();
                for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                    sheetNames.add(workbook.getSheetName(i));
                }
                if (sheetNames.isEmpty()) {
                    throw new UnreadableFileException("Workbook '" + filename + "' has no sheets");
                }
                int sheetIndex = profile.getSheetSelection().select(sheetNames);
                Sheet sheet = workbook.getSheetAt(sheetIndex);
                sheetName = sheet.getSheetName();
                grid = readSheet(sheet);
            } catch (IOException e) {
                throw new UnreadableFileException("Failed to read workbook '" + filename + "': " + e.getMessage(), e);
            }
        }

        int headerIndex = profile.isGuessHeaderRow() ? guessHeaderRow(grid, profile) : profile.getHeaderRow();
        logger.info("Loading sheet '{}' of '{}' with header row {} ({} raw rows)",
                sheetName, filename, headerIndex, grid.size());

        SheetTable.SheetTableBuilder table = SheetTable.builder()
                .sheetName(sheetName)
                .sheetNames(sheetNames);

        for (int i = 0; i < Math.min(headerIndex, grid.size()); i++) {
            table.preambleRow(grid.get(i));
        }

        int dataStart;
        if (profile.isTwoRowHeader()) {
            table.headers(mergeHeaderRows(rowAt(grid, headerIndex), rowAt(grid, headerIndex + 1)));
            dataStart = headerIndex + 2;
        } else {
            table.headers(rowAt(grid, headerIndex));
            dataStart = headerIndex + 1;
        }

        for (int i = dataStart; i < grid.size(); i++) {
            RawRow row = new RawRow(i, grid.get(i));
            if (!row.isBlank()) {
                table.row(row);
            }
        }
        return table.build();
    }

    /**
     * Combines a section label row with the subtype row below it. A label spans the
     * following columns only when it sits over a subtype of its own, so standalone
     * headers such as "Product" do not leak into the month block.
     */
    static List<String> mergeHeaderRows(List<String> labels, List<String> subtypes) {
        int width = Math.max(labels.size(), subtypes.size());
        List<String> merged = new ArrayList<>(width);
        String currentSection = "";
        for (int i = 0; i < width; i++) {
            String label = i < labels.size() ? labels.get(i).trim() : "";
            String subtype = i < subtypes.size() ? subtypes.get(i).trim() : "";

            String section;
            if (!label.isEmpty()) {
                section = label;
                currentSection = subtype.isEmpty() ? "" : label;
            } else {
                section = subtype.isEmpty() ? "" : currentSection;
            }

            if (!section.isEmpty() && !subtype.isEmpty()) {
                merged.add(section + SECTION_SEPARATOR + subtype);
            } else if (!section.isEmpty()) {
                merged.add(section);
            } else {
                merged.add(subtype);
            }
        }
        return merged;
    }

    private int guessHeaderRow(List<List<String>> grid, SourceProfile profile) {
        Set<String> aliases = new HashSet<>();
        for (ColumnRef ref : profile.getColumns().values()) {
            aliases.addAll(ref.getAliases());
        }
        int best = 0;
        int bestHits = 0;
        for (int i = 0; i < Math.min(FALLBACK_HEADER_SCAN_ROWS, grid.size()); i++) {
            int hits = 0;
            for (String cell : grid.get(i)) {
                if (aliases.contains(ColumnRef.normalizeHeader(cell))) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                best = i;
                bestHits = hits;
            }
        }
        return best;
    }

    private Workbook openWorkbook(byte[] content, String filename) {
        if (content == null || content.length == 0) {
            throw new UnreadableFileException("File '" + filename + "' is empty");
        }
        try {
            return WorkbookFactory.create(new ByteArrayInputStream(content));
        } catch (IOException | RuntimeException e) {
            throw new UnreadableFileException("File '" + filename + "' is not a readable workbook: " + e.getMessage(), e);
        }
    }

    private List<List<String>> readSheet(Sheet sheet) {
        List<List<String>> grid = new ArrayList<>();
        for (int r = 0; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<String> cells = new ArrayList<>();
            if (row != null && row.getLastCellNum() > 0) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    Cell cell = row.getCell(c);
                    cells.add(CellValueUtil.getCellValueAsString(cell));
                }
            }
            grid.add(cells);
        }
        return grid;
    }

    private List<List<String>> readCsv(byte[] content, String filename) {
        if (content == null || content.length == 0) {
            throw new UnreadableFileException("File '" + filename + "' is empty");
        }
        try (CSVReader reader = new CSVReader(new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8))) {
            List<List<String>> grid = new ArrayList<>();
            for (String[] line : reader.readAll()) {
                List<String> cells = new ArrayList<>(Arrays.asList(line));
                cells.replaceAll(cell -> cell == null ? "" : cell.trim());
                grid.add(cells);
            }
            if (!grid.isEmpty() && !grid.get(0).isEmpty()) {
                grid.get(0).set(0, grid.get(0).get(0).replace("\uFEFF", ""));
            }
            return grid;
        } catch (IOException | CsvException e) {
            throw new UnreadableFileException("Failed to read CSV '" + filename + "': " + e.getMessage(), e);
        }
    }

    private static List<String> rowAt(List<List<String>> grid, int index) {
        return index >= 0 && index < grid.size() ? grid.get(index) : List.of();
    }

    private static boolean isCsv(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private static String baseName(String filename) {
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
