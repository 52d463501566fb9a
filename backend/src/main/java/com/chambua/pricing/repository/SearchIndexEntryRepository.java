package com.chambua.pricing.repository;

import com.chambua.pricing.model.SearchIndexEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface SearchIndexEntryRepository extends JpaRepository<SearchIndexEntry, Long>, JpaSpecificationExecutor<SearchIndexEntry> {

    @Modifying
    @Query("delete from SearchIndexEntry e")
    int deleteAllEntries();
}
