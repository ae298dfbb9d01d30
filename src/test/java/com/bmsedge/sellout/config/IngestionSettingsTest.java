package com.bmsedge.sellout.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IngestionSettingsTest {

    private IngestionSettings settings;

    @BeforeEach
    void setUp() {
        settings = new IngestionSettings();
        ReflectionTestUtils.setField(settings, "allowedExtensions", List.of("xlsx", "xls", "csv"));
    }

    @Test
    @DisplayName("Configured extensions are allowed regardless of case")
    void testAllowedExtensions() {
        assertTrue(settings.isAllowedExtension("report.xlsx"));
        assertTrue(settings.isAllowedExtension("REPORT.XLS"));
        assertTrue(settings.isAllowedExtension("export.csv"));
    }

    @Test
    @DisplayName("A present extension that is not configured is rejected")
    void testRejectedExtension() {
        assertFalse(settings.isAllowedExtension("report.pdf"));
        assertFalse(settings.isAllowedExtension("archive.zip"));
        assertFalse(settings.isAllowedExtension(null));
    }

    @Test
    @DisplayName("Filenames without an extension are allowed")
    void testMissingExtension() {
        assertTrue(settings.isAllowedExtension("BOXNOX - BIBBI Monthly Sales Report APR2025"));
        assertTrue(settings.isAllowedExtension("Report v1.2 APR2025"));
        assertTrue(settings.isAllowedExtension("export."));
    }
}
