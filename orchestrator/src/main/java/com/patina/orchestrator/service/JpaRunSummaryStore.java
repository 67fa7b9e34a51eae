package com.patina.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.model.RunRecord;
import com.patina.orchestrator.model.RunSummary;
import com.patina.orchestrator.repository.RunRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Stores each RunSummary as one row of the runs table, the full summary as JSON.
 */
@Service
public class JpaRunSummaryStore implements RunSummaryStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRunSummaryStore.class);

    private final RunRecordRepository repository;
    private final ObjectMapper        objectMapper;

    public JpaRunSummaryStore(RunRecordRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(RunSummary summary) {
        RunRecord record = repository.findById(summary.runId())
                .orElseGet(() -> new RunRecord(summary.runId(), summary.goal()));
        record.setStatus(summary.status());
        record.setSummaryHash(summary.summaryHash());
        record.setErrorLabel(summary.terminatingError() == null ? null : summary.terminatingError().label());
        try {
            record.setSummaryJson(objectMapper.writeValueAsString(summary));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("run summary of " + summary.runId() + " is not serializable", e);
        }
        repository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunSummary> find(String runId) {
        return repository.findById(runId).map(record -> {
            try {
                return objectMapper.readValue(record.getSummaryJson(), RunSummary.class);
            } catch (JsonProcessingException e) {
                log.warn("Stored summary of run {} is unreadable: {}", runId, e.getOriginalMessage());
                throw new IllegalStateException("stored summary of run " + runId + " is unreadable", e);
            }
        });
    }
}
