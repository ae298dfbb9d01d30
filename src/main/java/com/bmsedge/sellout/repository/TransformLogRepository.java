package com.bmsedge.sellout.repository;

import com.bmsedge.sellout.model.TransformLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TransformLogRepository extends JpaRepository<TransformLog, Long> {

    int countByUploadId(String uploadId);
}
