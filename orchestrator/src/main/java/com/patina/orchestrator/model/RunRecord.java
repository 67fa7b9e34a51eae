package com.patina.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Persisted form of a finished run.
 *
 * The full {@link RunSummary} is kept as JSON in {@code summary_json}; the
 * other columns exist for querying.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "runs")
public class RunRecord {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Column(name = "goal", nullable = false, columnDefinition = "TEXT")
    private String goal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status;

    @Column(name = "summary_hash", nullable = false)
    private String summaryHash;

    // "KIND/CODE" of the terminating error, null for runs that were not aborted.
    @Column(name = "error_label")
    private String errorLabel;

    @Column(name = "summary_json", nullable = false, columnDefinition = "TEXT")
    private String summaryJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected RunRecord() {}   // required by JPA

    public RunRecord(String runId, String goal) {
        this.runId = runId;
        this.goal  = goal;
    }

    public String    getRunId()       { return runId; }
    public String    getGoal()        { return goal; }
    public RunStatus getStatus()      { return status; }
    public String    getSummaryHash() { return summaryHash; }
    public String    getErrorLabel()  { return errorLabel; }
    public String    getSummaryJson() { return summaryJson; }
    public Instant   getCreatedAt()   { return createdAt; }
    public Instant   getUpdatedAt()   { return updatedAt; }

    public void setStatus(RunStatus status)         { this.status = status; }
    public void setSummaryHash(String summaryHash)  { this.summaryHash = summaryHash; }
    public void setErrorLabel(String errorLabel)    { this.errorLabel = errorLabel; }
    public void setSummaryJson(String summaryJson)  { this.summaryJson = summaryJson; }
}
