package com.bmsedge.sellout.store;

import java.util.List;
import java.util.Map;

/**
 * Durable storage for canonical entries. Receives wire-safe records only.
 */
public interface SelloutEntryStore {

    /**
     * Writes one upload's records as a single batch; either all are stored or none.
     * Re-submitting the batch already stored for the upload is a no-op.
     *
     * @return false if an identical batch was already stored, true if the records were written
     */
    boolean saveBatch(String uploadId, List<Map<String, Object>> records);
}
