package com.bmsedge.sellout.repository;

import com.bmsedge.sellout.model.SelloutEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SelloutEntryRepository extends JpaRepository<SelloutEntry, UUID> {

    long countByUploadId(String uploadId);

    List<SelloutEntry> findByUploadId(String uploadId);
}
