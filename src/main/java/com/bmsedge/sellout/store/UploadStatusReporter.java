package com.bmsedge.sellout.store;

import com.bmsedge.sellout.dto.ProcessingSummary;

public interface UploadStatusReporter {

    void markProcessing(String uploadId, String filename);

    void markCompleted(ProcessingSummary summary);

    void markFailed(ProcessingSummary summary);
}
