package com.bmsedge.sellout.store;

import com.bmsedge.sellout.dto.AuditRecord;

import java.util.List;

public interface TransformLogStore {

    /** Appends records in the given order. */
    void append(String uploadId, List<AuditRecord> records);
}
