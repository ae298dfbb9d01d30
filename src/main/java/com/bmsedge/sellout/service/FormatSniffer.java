package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.DetectionResult;
import com.bmsedge.sellout.profile.SourceProfile;
import com.bmsedge.sellout.profile.SourceProfileRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks the source profile for a file from its name and sheet names.
 * Filename patterns are tried across all profiles before any sheet pattern.
 */
@Service
public class FormatSniffer {

    private static final Logger logger = LoggerFactory.getLogger(FormatSniffer.class);

    @Autowired
    private SourceProfileRegistry registry;

    public DetectionResult detect(String filename, List<String> sheetNames) {
        String normalizedName = normalize(filename);

        for (SourceProfile profile : registry.all()) {
            for (String pattern : profile.getFilenamePatterns()) {
                if (!normalizedName.isEmpty() && normalizedName.contains(pattern)) {
                    logger.info("Detected source '{}' from filename '{}'", profile.getSourceId(), filename);
                    return new DetectionResult(profile, false);
                }
            }
        }

        if (sheetNames != null) {
            // A sheet signature makes a profile more specific than a bare sheet pattern.
            List<SourceProfile> bySheet = new ArrayList<>(registry.all());
            bySheet.sort(Comparator.comparing(profile -> profile.getSheetNameSignature() == null));
            for (SourceProfile profile : bySheet) {
                String sheetName = matchingSheet(profile, sheetNames);
                if (sheetName != null) {
                    logger.info("Detected source '{}' from sheet '{}'", profile.getSourceId(), sheetName);
                    return new DetectionResult(profile, false);
                }
            }
        }

        logger.warn("No source matched file '{}' (sheets {}), using generic profile", filename, sheetNames);
        return new DetectionResult(registry.fallback(), true);
    }

    private static String matchingSheet(SourceProfile profile, List<String> sheetNames) {
        Pattern signature = profile.getSheetNameSignature();
        if (signature != null && sheetNames.stream()
                .noneMatch(name -> name != null && signature.matcher(name.toLowerCase(Locale.ROOT)).matches())) {
            return null;
        }
        for (String pattern : profile.getSheetNamePatterns()) {
            for (String sheetName : sheetNames) {
                String normalizedSheet = normalize(sheetName);
                if (!normalizedSheet.isEmpty() && normalizedSheet.contains(pattern)) {
                    return sheetName;
                }
            }
        }
        return null;
    }

    static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ").trim();
    }
}
