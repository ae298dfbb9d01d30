package com.bmsedge.sellout.service;

import com.bmsedge.sellout.config.IngestionSettings;
import com.bmsedge.sellout.dto.AuditTrail;
import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.dto.CleanedRow;
import com.bmsedge.sellout.dto.DetectionResult;
import com.bmsedge.sellout.dto.ProcessingSummary;
import com.bmsedge.sellout.dto.SheetTable;
import com.bmsedge.sellout.exception.IngestionException;
import com.bmsedge.sellout.exception.LoaderTimeoutException;
import com.bmsedge.sellout.exception.UnreadableFileException;
import com.bmsedge.sellout.exception.WorkerRejectedException;
import com.bmsedge.sellout.profile.SourceProfile;
import com.bmsedge.sellout.store.StepLogger;
import com.bmsedge.sellout.store.TransformLogStore;
import com.bmsedge.sellout.store.UploadStatusReporter;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one uploaded file through detection, loading, cleaning, reshaping, mapping,
 * the quality gate and storage. A hard failure fails this file only.
 */
@Service
public class UploadProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(UploadProcessingService.class);

    static final String UNEXPECTED = "UNEXPECTED";

    @Autowired
    private FormatSniffer formatSniffer;

    @Autowired
    private SheetLoader sheetLoader;

    @Autowired
    private RowCleaner rowCleaner;

    @Autowired
    private ShapeNormalizer shapeNormalizer;

    @Autowired
    private CanonicalMapper canonicalMapper;

    @Autowired
    private QualityGate qualityGate;

    @Autowired
    private PersistenceAdapter persistenceAdapter;

    @Autowired
    private TransformLogStore transformLogStore;

    @Autowired
    private UploadStatusReporter uploadStatusReporter;

    @Autowired(required = false)
    private StepLogger stepLogger;

    @Autowired
    private IngestionSettings settings;

    @Autowired
    @Qualifier("ingestionExecutor")
    private Executor ingestionExecutor;

    @Autowired
    @Qualifier("sheetLoaderExecutor")
    private Executor sheetLoaderExecutor;

    /**
     * Processes a file on the ingestion worker pool. A file the pool refuses to queue
     * completes immediately as FAILED.
     */
    public CompletableFuture<ProcessingSummary> processAsync(String uploadId, String filename, byte[] content) {
        try {
            return CompletableFuture.supplyAsync(() -> process(uploadId, filename, content), ingestionExecutor);
        } catch (RejectedExecutionException e) {
            WorkerRejectedException rejected = new WorkerRejectedException(
                    "Ingestion workers are saturated, '" + filename + "' was not queued", e);
            logger.error("Upload {} rejected: {}", uploadId, rejected.toStatusMessage());
            ProcessingSummary summary = ProcessingSummary.start(uploadId, filename);
            summary.fail(rejected.toStatusMessage());
            try {
                uploadStatusReporter.markFailed(summary);
            } catch (RuntimeException statusError) {
                logger.error("Could not mark upload {} as failed", uploadId, statusError);
            }
            return CompletableFuture.completedFuture(summary);
        }
    }

    public ProcessingSummary process(String uploadId, String filename, byte[] content) {
        ProcessingSummary summary = ProcessingSummary.start(uploadId, filename);
        AuditTrail trail = new AuditTrail();
        logger.info("Processing upload {} ({})", uploadId, filename);

        try {
            uploadStatusReporter.markProcessing(uploadId, filename);
        } catch (RuntimeException e) {
            logger.warn("Could not mark upload {} as processing: {}", uploadId, e.getMessage());
        }

        try {
            validateFile(filename, content);

            LoadedFile loaded = loadWithTimeout(filename, content);
            SourceProfile profile = loaded.getDetection().getProfile();
            SheetTable table = loaded.getTable();
            summary.setSourceId(profile.getSourceId());
            summary.setLowConfidence(loaded.getDetection().isLowConfidence());
            summary.setRowsProcessed(table.getRows().size());
            logStep(uploadId, "load", details(
                    "source_id", profile.getSourceId(),
                    "low_confidence", loaded.getDetection().isLowConfidence(),
                    "sheet", table.getSheetName(),
                    "rows", table.getRows().size()));

            qualityGate.verifyStructure(table, profile);

            List<CleanedRow> cleaned = rowCleaner.clean(table, profile, filename, trail);
            logStep(uploadId, "clean", details("rows_cleaned", cleaned.size(), "rows_skipped", trail.getRowsSkipped()));

            List<CleanedRow> normalized = shapeNormalizer.normalize(cleaned, profile, trail);
            logStep(uploadId, "normalize", details("rows", normalized.size(), "anomalies", trail.getAnomalies()));

            List<CanonicalEntry> candidates = canonicalMapper.map(normalized, uploadId);
            List<CanonicalEntry> accepted = qualityGate.evaluate(candidates, trail);
            logStep(uploadId, "validate", details("candidates", candidates.size(), "accepted", accepted.size()));

            boolean replay = false;
            if (!accepted.isEmpty()) {
                replay = persistenceAdapter.submit(uploadId, accepted, Instant.now()) == 0;
            }
            logStep(uploadId, "persist", details("stored", replay ? 0 : accepted.size(), "replay", replay));

            summary.setRowsCleaned(accepted.size());
            applyTrail(summary, trail);
            // A replay already wrote its transform log on the first run.
            if (!replay) {
                writeTransformLogs(uploadId, trail);
            }
            summary.complete();
            logger.info("Upload {} completed: source={}, processed={}, stored={}, skipped={}, anomalies={}",
                    uploadId, summary.getSourceId(), summary.getRowsProcessed(), summary.getRowsCleaned(),
                    summary.getRowsSkipped(), summary.getAnomalies());
            reportCompleted(summary);
        } catch (IngestionException e) {
            logger.error("Upload {} failed: {}", uploadId, e.toStatusMessage());
            fail(summary, trail, e.toStatusMessage());
        } catch (RuntimeException e) {
            logger.error("Upload {} failed unexpectedly", uploadId, e);
            fail(summary, trail, UNEXPECTED + ": " + e.getMessage());
        }
        return summary;
    }

    private void validateFile(String filename, byte[] content) {
        if (!settings.isAllowedExtension(filename)) {
            throw new UnreadableFileException("Unsupported file type '" + filename + "', allowed: "
                    + settings.getAllowedExtensions());
        }
        if (content == null || content.length == 0) {
            throw new UnreadableFileException("File '" + filename + "' is empty");
        }
        if (content.length > settings.getMaxFileSizeBytes()) {
            throw new UnreadableFileException("File '" + filename + "' is " + content.length
                    + " bytes, limit is " + settings.getMaxFileSizeBytes());
        }
    }

    private LoadedFile loadWithTimeout(String filename, byte[] content) {
        CompletableFuture<LoadedFile> future = CompletableFuture.supplyAsync(() -> {
            List<String> sheetNames = sheetLoader.inspect(content, filename);
            DetectionResult detection = formatSniffer.detect(filename, sheetNames);
            SheetTable table = sheetLoader.load(content, filename, detection.getProfile());
            return new LoadedFile(detection, table);
        }, sheetLoaderExecutor);

        long timeout = settings.getLoaderTimeoutMillis();
        try {
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LoaderTimeoutException("Reading '" + filename + "' took longer than " + timeout + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new LoaderTimeoutException("Interrupted while reading '" + filename + "'");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new UnreadableFileException("Failed to read '" + filename + "': " + cause, cause);
        }
    }

    private void fail(ProcessingSummary summary, AuditTrail trail, String message) {
        applyTrail(summary, trail);
        writeTransformLogs(summary.getUploadId(), trail);
        summary.fail(message);
        try {
            uploadStatusReporter.markFailed(summary);
        } catch (RuntimeException e) {
            logger.error("Could not mark upload {} as failed", summary.getUploadId(), e);
        }
    }

    private void reportCompleted(ProcessingSummary summary) {
        try {
            uploadStatusReporter.markCompleted(summary);
        } catch (RuntimeException e) {
            logger.error("Could not mark upload {} as completed", summary.getUploadId(), e);
        }
    }

    private void writeTransformLogs(String uploadId, AuditTrail trail) {
        if (trail.getRecords().isEmpty()) {
            return;
        }
        try {
            transformLogStore.append(uploadId, trail.getRecords());
        } catch (RuntimeException e) {
            logger.warn("Could not write {} transform log records for upload {}: {}",
                    trail.getRecords().size(), uploadId, e.getMessage());
        }
    }

    private void logStep(String uploadId, String step, Map<String, Object> details) {
        StepLogger target = stepLogger != null ? stepLogger : StepLogger.NO_OP;
        try {
            target.logStep(uploadId, step, details);
        } catch (RuntimeException e) {
            logger.warn("Step logger failed at '{}' for upload {}: {}", step, uploadId, e.getMessage());
        }
    }

    private static void applyTrail(ProcessingSummary summary, AuditTrail trail) {
        summary.setRowsSkipped(trail.getRowsSkipped());
        summary.setTransformationsApplied(trail.getTransformationsApplied());
        summary.setAnomalies(trail.getAnomalies());
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }

    @Value
    static class LoadedFile {
        DetectionResult detection;
        SheetTable table;
    }
}
