package com.bmsedge.sellout.store;

import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.exception.StorageException;
import com.bmsedge.sellout.model.SelloutEntry;
import com.bmsedge.sellout.repository.SelloutEntryRepository;
import com.bmsedge.sellout.util.WireRecordConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class JpaSelloutEntryStore implements SelloutEntryStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaSelloutEntryStore.class);

    @Autowired
    private SelloutEntryRepository selloutEntryRepository;

    @Override
    @Transactional
    public boolean saveBatch(String uploadId, List<Map<String, Object>> records) {
        if (selloutEntryRepository.countByUploadId(uploadId) > 0) {
            List<CanonicalEntry> stored = selloutEntryRepository.findByUploadId(uploadId).stream()
                    .map(SelloutEntry::toCanonicalEntry)
                    .collect(Collectors.toList());
            List<CanonicalEntry> incoming = records.stream()
                    .map(WireRecordConverter::fromWireRecord)
                    .collect(Collectors.toList());
            if (counts(stored).equals(counts(incoming))) {
                logger.info("Upload {} already holds the same {} entries, nothing stored", uploadId, stored.size());
                return false;
            }
            throw new StorageException("Entries for upload " + uploadId + " were already stored and differ from this batch");
        }
        List<SelloutEntry> entities = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            entities.add(SelloutEntry.fromWireRecord(record));
        }
        try {
            selloutEntryRepository.saveAll(entities);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store " + entities.size() + " entries for upload " + uploadId, e);
        }
        logger.info("Stored {} sell-out entries for upload {}", entities.size(), uploadId);
        return true;
    }

    // Duplicate rows are legal within a batch, so compare as multisets.
    private static Map<CanonicalEntry, Long> counts(List<CanonicalEntry> entries) {
        return entries.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }
}
