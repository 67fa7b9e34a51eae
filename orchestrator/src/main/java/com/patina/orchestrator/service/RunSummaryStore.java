package com.patina.orchestrator.service;

import com.patina.orchestrator.model.RunSummary;

import java.util.Optional;

/**
 * Where finished runs go. The orchestrator keeps in-flight runs in memory
 * and asks the store for everything else.
 */
public interface RunSummaryStore {

    void save(RunSummary summary);

    Optional<RunSummary> find(String runId);
}
