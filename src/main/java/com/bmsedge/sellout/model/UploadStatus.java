package com.bmsedge.sellout.model;

public enum UploadStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
