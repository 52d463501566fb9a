package com.chambua.pricing.repository;

import com.chambua.pricing.model.ChangeType;
import com.chambua.pricing.model.HistoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, Long> {

    List<HistoryEntry> findByProductIdOrderByIdDesc(Long productId, Pageable pageable);

    Optional<HistoryEntry> findFirstByProductIdOrderByIdDesc(Long productId);

    long countByUploadJobId(Long uploadJobId);

    long countByUploadJobIdAndChangeType(Long uploadJobId, ChangeType changeType);
}
