package com.bmsedge.sellout.service;

import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.exception.EncodingException;
import com.bmsedge.sellout.store.SelloutEntryStore;
import com.bmsedge.sellout.util.WireRecordConverter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Last stop before storage. Every record is converted to wire-safe primitives and checked
 * before the store sees anything.
 */
@Service
public class PersistenceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceAdapter.class);

    // No date modules registered: a date object that slips through must fail here.
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    private SelloutEntryStore selloutEntryStore;

    public int submit(String uploadId, List<CanonicalEntry> entries, Instant createdAt) {
        List<Map<String, Object>> records = new ArrayList<>(entries.size());
        for (CanonicalEntry entry : entries) {
            records.add(WireRecordConverter.toWireRecord(entry, createdAt));
        }
        return submitRecords(uploadId, records);
    }

    /**
     * @return the number of records newly stored, 0 when the upload already holds this batch
     */
    public int submitRecords(String uploadId, List<Map<String, Object>> records) {
        verifyWireSafe(records);
        if (!selloutEntryStore.saveBatch(uploadId, records)) {
            logger.info("Upload {} was already stored, {} records skipped", uploadId, records.size());
            return 0;
        }
        logger.info("Submitted {} records for upload {}", records.size(), uploadId);
        return records.size();
    }

    public void verifyWireSafe(List<Map<String, Object>> records) {
        for (int i = 0; i < records.size(); i++) {
            for (Map.Entry<String, Object> field : records.get(i).entrySet()) {
                Object value = field.getValue();
                if (!isWireSafe(value)) {
                    throw new EncodingException("Field '" + field.getKey() + "' of record " + i
                            + " holds non wire-safe value of type " + value.getClass().getName());
                }
            }
        }
        try {
            objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Batch could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isWireSafe(Object value) {
        if (value == null || value instanceof String || value instanceof Integer
                || value instanceof Long || value instanceof Boolean) {
            return true;
        }
        if (value instanceof Double) {
            double d = (Double) value;
            return !Double.isNaN(d) && !Double.isInfinite(d);
        }
        return false;
    }
}
