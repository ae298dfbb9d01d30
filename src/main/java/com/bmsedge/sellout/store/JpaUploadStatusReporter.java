package com.bmsedge.sellout.store;

import com.bmsedge.sellout.dto.ProcessingSummary;
import com.bmsedge.sellout.model.Upload;
import com.bmsedge.sellout.model.UploadStatus;
import com.bmsedge.sellout.repository.UploadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaUploadStatusReporter implements UploadStatusReporter {

    private static final Logger logger = LoggerFactory.getLogger(JpaUploadStatusReporter.class);

    @Autowired
    private UploadRepository uploadRepository;

    @Override
    @Transactional
    public void markProcessing(String uploadId, String filename) {
        Upload upload = uploadRepository.findById(uploadId).orElseGet(() -> new Upload(uploadId, filename));
        // A re-run of a completed upload keeps its status until it completes again.
        if (upload.getStatus() == UploadStatus.COMPLETED) {
            return;
        }
        upload.setStatus(UploadStatus.PROCESSING);
        upload.setErrorMessage(null);
        uploadRepository.save(upload);
    }

    @Override
    @Transactional
    public void markCompleted(ProcessingSummary summary) {
        Upload upload = applySummary(summary);
        upload.setStatus(UploadStatus.COMPLETED);
        uploadRepository.save(upload);
    }

    @Override
    @Transactional
    public void markFailed(ProcessingSummary summary) {
        Upload existing = uploadRepository.findById(summary.getUploadId()).orElse(null);
        if (existing != null && existing.getStatus() == UploadStatus.COMPLETED) {
            logger.warn("Upload {} is already completed, ignoring failure: {}",
                    summary.getUploadId(), summary.getErrorMessage());
            return;
        }
        Upload upload = applySummary(summary);
        upload.setStatus(UploadStatus.FAILED);
        upload.setErrorMessage(summary.getErrorMessage());
        uploadRepository.save(upload);
    }

    private Upload applySummary(ProcessingSummary summary) {
        Upload upload = uploadRepository.findById(summary.getUploadId())
                .orElseGet(() -> new Upload(summary.getUploadId(), summary.getFilename()));
        upload.setSourceId(summary.getSourceId());
        upload.setLowConfidence(summary.isLowConfidence());
        upload.setRowsProcessed(summary.getRowsProcessed());
        upload.setRowsCleaned(summary.getRowsCleaned());
        upload.setRowsSkipped(summary.getRowsSkipped());
        upload.setTransformationsApplied(summary.getTransformationsApplied());
        upload.setAnomalies(summary.getAnomalies());
        upload.setProcessingTimeMs(summary.getProcessingTimeMs());
        return upload;
    }
}
