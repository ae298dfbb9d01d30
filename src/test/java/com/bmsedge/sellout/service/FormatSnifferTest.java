package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.DetectionResult;
import com.bmsedge.sellout.profile.SourceProfileRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatSnifferTest {

    @Spy
    private SourceProfileRegistry registry = new SourceProfileRegistry();

    @InjectMocks
    private FormatSniffer formatSniffer;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private String detect(String filename, String... sheets) {
        DetectionResult result = formatSniffer.detect(filename, List.of(sheets));
        assertFalse(result.isLowConfidence(), "expected a confident match for " + filename);
        return result.getProfile().getSourceId();
    }

    @Test
    @DisplayName("Should detect each source from its filename")
    void testDetectByFilename() {
        assertEquals("galilu", detect("Galilu sell out 2025.xlsx", "Sheet1"));
        assertEquals("boxnox", detect("BOXNOX - BIBBI Monthly Sales Report APR2025.xlsx", "Sheet1"));
        assertEquals("skins_sa", detect("Skins SA BIBBI 2025 March.xlsx", "Sheet1"));
        assertEquals("skins_nl", detect("BIBBIPARFU_ReportPeriod02-2025.xlsx", "Sheet1"));
        assertEquals("cdlc", detect("CDLC 2025 03.xlsx", "Sheet1"));
        assertEquals("cdlc", detect("BIBBI Sell Out 2025 03.xlsx", "Sheet1"));
        assertEquals("liberty", detect("Continuity Supplier Size Report 09-06-2025.xlsx", "Sheet1"));
        assertEquals("aromateque", detect("Aromateque BIBBI Sales March'25.xlsx", "Sheet1"));
        assertEquals("ukraine", detect("Ukraine sales 2025.xlsx", "Sheet1"));
    }

    @Test
    @DisplayName("Should treat underscores and repeated spaces as single spaces")
    void testNormalization() {
        assertEquals("skins_sa", detect("skins_sa_2025_march.xlsx"));
        assertEquals("skins_sa", detect("SKINS   SA 2025 March.xlsx"));
    }

    @Test
    @DisplayName("Should fall back to sheet names when the filename is unknown")
    void testDetectBySheetName() {
        assertEquals("boxnox", detect("export.xlsx", "Summary", "Sell Out by EAN"));
        assertEquals("skins_nl", detect("export.xlsx", "SalesPerSKU"));
        assertEquals("ukraine", detect("export.xlsx", "TDSheet"));
        assertEquals("cdlc", detect("export.xlsx", "BIBBI", "2025 03"));
        assertEquals("skins_sa", detect("export.xlsx", "BIBBI"));
        assertEquals("skins_sa", detect("export.xlsx", "BIBBI", "March 2025"));
    }

    @Test
    @DisplayName("A filename pattern still wins over the cdlc sheet signature")
    void testFilenameBeforeSheetSignature() {
        assertEquals("skins_sa", detect("Skins SA BIBBI Sell Out 2025 03.xlsx", "BIBBI", "2025 03"));
    }

    @Test
    @DisplayName("Filename patterns win over sheet patterns")
    void testFilenameBeforeSheet() {
        assertEquals("liberty", detect("Liberty weekly 09-06-2025.xlsx", "Sell Out by EAN"));
    }

    @Test
    @DisplayName("Should return the generic profile with low confidence when nothing matches")
    void testFallback() {
        DetectionResult result = formatSniffer.detect("random.xlsx", List.of("Sheet1"));

        assertTrue(result.isLowConfidence());
        assertEquals(SourceProfileRegistry.FALLBACK_ID, result.getProfile().getSourceId());
    }

    @Test
    @DisplayName("Should tolerate null filename and sheet list")
    void testNullInputs() {
        DetectionResult result = formatSniffer.detect(null, null);

        assertTrue(result.isLowConfidence());
        assertNotNull(result.getProfile());
    }
}
