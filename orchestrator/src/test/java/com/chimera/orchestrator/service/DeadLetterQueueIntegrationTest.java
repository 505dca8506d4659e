package com.chimera.orchestrator.service;

import com.chimera.orchestrator.model.ChimeraPhase;
import com.chimera.orchestrator.model.DeadLetterEntry;
import com.chimera.orchestrator.model.WorkflowTask;
import com.chimera.orchestrator.repository.DeadLetterRepository;
import com.chimera.orchestrator.repository.WorkflowTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class DeadLetterQueueIntegrationTest {

    @Autowired DeadLetterQueue        deadLetters;
    @Autowired DeadLetterRepository   deadLetterRepo;
    @Autowired WorkflowTaskRepository taskRepo;

    @BeforeEach
    void cleanTables() {
        deadLetterRepo.deleteAll();
        taskRepo.deleteAll();
    }

    @Test
    void add_storesSnapshotOfTask() {
        WorkflowTask task = failedTask("wf-1");

        assertThat(deadLetters.add(task, "Review decision: rejected", ChimeraPhase.REVIEW)).isTrue();

        DeadLetterEntry entry = deadLetters.get("wf-1").orElseThrow();
        assertThat(entry.getFailureReason()).isEqualTo("Review decision: rejected");
        assertThat(entry.getLastErrorPhase()).isEqualTo(ChimeraPhase.REVIEW);
        assertThat(entry.getFeatureDescription()).isEqualTo("feature wf-1");
        assertThat(entry.getWorkflowState()).containsEntry("pr_id", "PR-1");
    }

    @Test
    void add_sameTaskTwice_keepsFirstEntry() {
        WorkflowTask task = failedTask("wf-1");
        deadLetters.add(task, "first", ChimeraPhase.REVIEW);

        assertThat(deadLetters.add(task, "second", ChimeraPhase.REVIEW)).isFalse();
        assertThat(deadLetters.count()).isEqualTo(1);
        assertThat(deadLetters.get("wf-1").orElseThrow().getFailureReason()).isEqualTo("first");
    }

    @Test
    void entries_newestFirstWithOffset() throws Exception {
        for (int i = 0; i < 5; i++) {
            deadLetters.add(failedTask("wf-" + i), "reason " + i, ChimeraPhase.STAGING_DEPLOYMENT);
            Thread.sleep(5);
        }

        assertThat(deadLetters.entries(2, 0)).extracting(DeadLetterEntry::getTaskId)
                .containsExactly("wf-4", "wf-3");
        assertThat(deadLetters.entries(2, 3)).extracting(DeadLetterEntry::getTaskId)
                .containsExactly("wf-1", "wf-0");
        assertThat(deadLetters.entries(10, 5)).isEmpty();
    }

    @Test
    void entries_pagingNearIntMax_doesNotOverflow() {
        for (int i = 0; i < 3; i++) {
            deadLetters.add(failedTask("wf-" + i), "reason " + i, ChimeraPhase.REVIEW);
        }

        assertThat(deadLetters.entries(Integer.MAX_VALUE, 1)).hasSize(2);
        assertThat(deadLetters.entries(10, Integer.MAX_VALUE)).isEmpty();
        assertThat(deadLetters.entries(Integer.MAX_VALUE, Integer.MAX_VALUE)).isEmpty();
    }

    @Test
    void entries_invalidPaging_rejected() {
        assertThatThrownBy(() -> deadLetters.entries(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> deadLetters.entries(1, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void remove_deletesOnlyExisting() {
        deadLetters.add(failedTask("wf-1"), "boom", ChimeraPhase.CODE_IMPLEMENTATION);

        assertThat(deadLetters.remove("wf-1")).isTrue();
        assertThat(deadLetters.remove("wf-1")).isFalse();
        assertThat(deadLetters.get("wf-1")).isEmpty();
        assertThat(deadLetters.count()).isZero();
    }

    private static WorkflowTask failedTask(String id) {
        WorkflowTask task = new WorkflowTask(id, "feature " + id, "https://app.test", 0);
        task.extendContext(Map.of("test_path", "tests/x.spec.ts", "pr_id", "PR-1"));
        task.incrementRetryCount();
        return task;
    }
}
