package com.bmsedge.sellout.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

@Getter
@Component
public class IngestionSettings {

    private static final Pattern EXTENSION = Pattern.compile("[A-Za-z0-9]{1,5}");

    @Value("${sellout.ingestion.loader-timeout-ms:30000}")
    private long loaderTimeoutMillis;

    @Value("${sellout.ingestion.max-file-size-bytes:10485760}")
    private long maxFileSizeBytes;

    @Value("${sellout.ingestion.allowed-extensions:xlsx,xls,csv}")
    private List<String> allowedExtensions;

    @Value("${sellout.ingestion.worker-pool-size:4}")
    private int workerPoolSize;

    @Value("${sellout.ingestion.worker-queue-capacity:100}")
    private int workerQueueCapacity;

    /**
     * A filename without an extension is allowed and read as a workbook; POI detects the
     * format from the bytes. Text after the last dot only counts as an extension when it
     * looks like one, so "Report v1.2 APR2025" has none.
     */
    public boolean isAllowedExtension(String filename) {
        if (filename == null) return false;
        int dot = filename.lastIndexOf('.');
        if (dot < 0) return true;
        String extension = filename.substring(dot + 1).trim();
        if (!EXTENSION.matcher(extension).matches()) return true;
        return allowedExtensions.stream()
                .anyMatch(allowed -> allowed.trim().equalsIgnoreCase(extension));
    }
}
