package com.patina.orchestrator.repository;

import com.patina.orchestrator.model.RunRecord;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the runs table. Spring Data JPA generates the implementation.
 */
public interface RunRecordRepository extends JpaRepository<RunRecord, String> {
}
