package com.patina.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.OrchestratorError;
import com.patina.orchestrator.model.ResultEnvelope;
import com.patina.orchestrator.model.RunRecord;
import com.patina.orchestrator.model.RunStatus;
import com.patina.orchestrator.model.RunSummary;
import com.patina.orchestrator.repository.RunRecordRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JpaRunSummaryStoreTest {

    RunRecordRepository repository = mock(RunRecordRepository.class);
    ObjectMapper        mapper     = new ObjectMapper().findAndRegisterModules();
    JpaRunSummaryStore  store      = new JpaRunSummaryStore(repository, mapper);

    private static RunSummary summary() {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        NodeOutcome node = new NodeOutcome("count", "plan-1", NodeState.SUCCEEDED, ResultEnvelope.of("3 files"),
                null, 1, false, at, at, 1);
        return new RunSummary("run-1", "count files", RunStatus.FAILED, "count: SUCCEEDED 3 files", "abc123",
                List.of(), Map.of("files", 3), List.of(node), List.of(),
                OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.RUN_LIMIT, "wall clock exhausted"),
                List.of("hash-1"));
    }

    @Test
    void save_writesQueryColumnsAndJson() {
        when(repository.findById("run-1")).thenReturn(Optional.empty());

        store.save(summary());

        ArgumentCaptor<RunRecord> captor = ArgumentCaptor.forClass(RunRecord.class);
        verify(repository).save(captor.capture());
        RunRecord record = captor.getValue();
        assertThat(record.getRunId()).isEqualTo("run-1");
        assertThat(record.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(record.getSummaryHash()).isEqualTo("abc123");
        assertThat(record.getErrorLabel()).isEqualTo("BUDGET/RUN_LIMIT");
        assertThat(record.getSummaryJson()).contains("\"summary_hash\":\"abc123\"", "\"run_id\":\"run-1\"");
    }

    @Test
    void find_readsBackTheSavedSummary() {
        when(repository.findById("run-1")).thenReturn(Optional.empty());
        store.save(summary());
        ArgumentCaptor<RunRecord> captor = ArgumentCaptor.forClass(RunRecord.class);
        verify(repository).save(captor.capture());
        when(repository.findById("run-1")).thenReturn(Optional.of(captor.getValue()));

        RunSummary found = store.find("run-1").orElseThrow();

        assertThat(found.status()).isEqualTo(RunStatus.FAILED);
        assertThat(found.summary()).isEqualTo("count: SUCCEEDED 3 files");
        assertThat(found.state()).containsEntry("files", 3);
        assertThat(found.node("count").envelope().summary()).isEqualTo("3 files");
        assertThat(found.terminatingError().is(ErrorKind.BUDGET, ErrorCodes.RUN_LIMIT)).isTrue();
    }

    @Test
    void find_unknownRun_isEmpty() {
        when(repository.findById("run-x")).thenReturn(Optional.empty());

        assertThat(store.find("run-x")).isEmpty();
    }

    @Test
    void find_corruptJson_throws() {
        RunRecord broken = new RunRecord("run-2", "goal");
        broken.setSummaryJson("{not json");
        when(repository.findById("run-2")).thenReturn(Optional.of(broken));

        assertThatThrownBy(() -> store.find("run-2"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("run-2");
    }
}
