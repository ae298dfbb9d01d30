package com.bmsedge.sellout.store;

import com.bmsedge.sellout.dto.AuditRecord;
import com.bmsedge.sellout.model.TransformLog;
import com.bmsedge.sellout.repository.TransformLogRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Component
public class JpaTransformLogStore implements TransformLogStore {

    @Autowired
    private TransformLogRepository transformLogRepository;

    @Override
    @Transactional
    public void append(String uploadId, List<AuditRecord> records) {
        int seq = transformLogRepository.countByUploadId(uploadId);
        List<TransformLog> logs = new ArrayList<>(records.size());
        for (AuditRecord record : records) {
            logs.add(new TransformLog(uploadId, seq++, record.getRowIndex(), record.getColumnName(),
                    record.getOriginalValue(), record.getCleanedValue(), record.getTransformationType()));
        }
        transformLogRepository.saveAll(logs);
    }
}
