package com.bmsedge.sellout.repository;

import com.bmsedge.sellout.model.Upload;
import org.springframework.stereotype.Repository;
import org.springframework.data.jpa.repository.JpaRepository;

@Repository
public interface UploadRepository extends JpaRepository<Upload, String> {
}
