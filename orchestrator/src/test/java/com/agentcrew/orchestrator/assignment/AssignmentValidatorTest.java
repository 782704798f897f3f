package com.agentcrew.orchestrator.assignment;

import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.model.ProcessStatus;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static com.agentcrew.orchestrator.assignment.AssignmentException.Kind.*;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssignmentValidatorTest {

    static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock ProcessRuntime runtime;

    AssignmentStore     store;
    AssignmentValidator validator;

    @BeforeEach
    void setUp() {
        store     = new AssignmentStore();
        validator = new AssignmentValidator(store, runtime);
        lenient().when(runtime.find(anyString())).thenReturn(Optional.empty());
    }

    // ------------------------------------------------------------------
    // validateTaskAssignment()
    // ------------------------------------------------------------------

    @Test
    void taskAssignment_readyWorker_passes() {
        process("worker-1", ProcessStatus.READY);

        assertThatCode(() -> validator.validateTaskAssignment("worker-1", "perles-abc.1")).doesNotThrowAnyException();
    }

    @Test
    void taskAssignment_heldByLiveWorker_namesHolder() {
        process("worker-1", ProcessStatus.WORKING);
        process("worker-2", ProcessStatus.READY);
        store.assignImplementer("worker-1", "perles-abc.1", NOW);

        assertThatThrownBy(() -> validator.validateTaskAssignment("worker-2", "perles-abc.1"))
                .hasMessage("task perles-abc.1 already assigned to worker-1")
                .matches(e -> ((AssignmentException) e).getKind() == ALREADY_ASSIGNED);
    }

    @Test
    void taskAssignment_heldByRetiredWorker_allowsTakeover() {
        process("worker-1", ProcessStatus.RETIRED);
        process("worker-2", ProcessStatus.READY);
        store.assignImplementer("worker-1", "perles-abc.1", NOW);

        assertThatCode(() -> validator.validateTaskAssignment("worker-2", "perles-abc.1")).doesNotThrowAnyException();
    }

    @Test
    void taskAssignment_busyWorker_namesCurrentTask() {
        process("worker-1", ProcessStatus.READY);
        store.assignImplementer("worker-1", "perles-xyz.1", NOW);

        assertThatThrownBy(() -> validator.validateTaskAssignment("worker-1", "perles-abc.1"))
                .hasMessage("worker worker-1 already assigned to task perles-xyz.1");
    }

    @Test
    void taskAssignment_unknownWorker_isNotFound() {
        assertThatThrownBy(() -> validator.validateTaskAssignment("worker-9", "perles-abc.1"))
                .hasMessage("worker worker-9 not found")
                .matches(e -> ((AssignmentException) e).getKind() == NOT_FOUND);
    }

    @Test
    void taskAssignment_workingWorker_includesStatus() {
        process("worker-1", ProcessStatus.WORKING);

        assertThatThrownBy(() -> validator.validateTaskAssignment("worker-1", "perles-abc.1"))
                .hasMessage("worker worker-1 is not ready (status: WORKING)");
    }

    // ------------------------------------------------------------------
    // validateReviewAssignment()
    // ------------------------------------------------------------------

    @Test
    void review_selfReview_isRejectedBeforeAnyLookup() {
        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-1", "perles-abc.1", "worker-1"))
                .hasMessage("reviewer cannot be the same as implementer")
                .matches(e -> ((AssignmentException) e).getKind() == SELF_REVIEW);
    }

    @Test
    void review_unknownTask_isMismatch() {
        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-2", "perles-abc.1", "worker-1"))
                .hasMessage("task perles-abc.1 not found");
    }

    @Test
    void review_wrongImplementer_isMismatch() {
        store.assignImplementer("worker-1", "perles-abc.1", NOW);

        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-2", "perles-abc.1", "worker-3"))
                .hasMessage("task perles-abc.1 is implemented by worker-1, not worker-3");
    }

    @Test
    void review_implementerStillWorking_includesPhase() {
        store.assignImplementer("worker-1", "perles-abc.1", NOW);

        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-2", "perles-abc.1", "worker-1"))
                .hasMessage("implementer worker-1 is not awaiting review (phase: IMPLEMENTING)");
    }

    @Test
    void review_reviewerAlreadySet_namesReviewer() {
        awaitingReview();
        process("worker-2", ProcessStatus.READY);
        store.assignReviewer("worker-2", "perles-abc.1", "worker-1", NOW);

        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-3", "perles-abc.1", "worker-1"))
                .hasMessage("task perles-abc.1 already has reviewer worker-2")
                .matches(e -> ((AssignmentException) e).getKind() == REVIEWER_ALREADY_SET);
    }

    @Test
    void review_reviewerMissing_isNotReady() {
        awaitingReview();

        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-2", "perles-abc.1", "worker-1"))
                .hasMessage("reviewer worker-2 not found")
                .matches(e -> ((AssignmentException) e).getKind() == REVIEWER_NOT_READY);
    }

    @Test
    void review_reviewerRetired_includesStatus() {
        awaitingReview();
        process("worker-2", ProcessStatus.RETIRED);

        assertThatThrownBy(() -> validator.validateReviewAssignment("worker-2", "perles-abc.1", "worker-1"))
                .hasMessage("reviewer worker-2 is not ready (status: RETIRED)");
    }

    @Test
    void review_readyReviewer_passes() {
        awaitingReview();
        process("worker-2", ProcessStatus.READY);

        assertThatCode(() -> validator.validateReviewAssignment("worker-2", "perles-abc.1", "worker-1"))
                .doesNotThrowAnyException();
    }

    private void awaitingReview() {
        store.assignImplementer("worker-1", "perles-abc.1", NOW);
        store.update(m -> m.moveWorker("worker-1", WorkerPhase.AWAITING_REVIEW));
    }

    private void process(String id, ProcessStatus status) {
        lenient().when(runtime.find(id)).thenReturn(Optional.of(new ProcessInfo(id, status, null, null, null)));
    }
}
