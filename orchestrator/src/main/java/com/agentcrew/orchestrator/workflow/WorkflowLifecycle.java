package com.agentcrew.orchestrator.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records the one completion signal a workflow may receive.
 */
@Component
public class WorkflowLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLifecycle.class);

    public record Completion(WorkflowOutcome outcome, String summary, Instant completedAt) {}

    private final AtomicReference<Completion> completion = new AtomicReference<>();
    private final Clock clock;

    public WorkflowLifecycle(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the recorded completion, or empty if the workflow was already signalled
     */
    public Optional<Completion> complete(WorkflowOutcome outcome, String summary) {
        Completion next = new Completion(outcome, summary == null ? "" : summary, clock.instant());
        if (!completion.compareAndSet(null, next)) {
            return Optional.empty();
        }
        log.info("Workflow completed with outcome {}: {}", outcome, next.summary());
        return Optional.of(next);
    }

    public Optional<Completion> completion() {
        return Optional.ofNullable(completion.get());
    }

    public boolean isComplete() {
        return completion.get() != null;
    }
}
