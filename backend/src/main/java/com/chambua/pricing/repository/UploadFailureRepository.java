package com.chambua.pricing.repository;

import com.chambua.pricing.model.UploadFailure;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UploadFailureRepository extends JpaRepository<UploadFailure, Long> {
    List<UploadFailure> findByUploadJobIdOrderByRowIndexAsc(Long uploadJobId);
}
