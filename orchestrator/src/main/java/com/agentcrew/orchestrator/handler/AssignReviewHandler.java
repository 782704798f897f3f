package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.assignment.AssignmentValidator;
import com.agentcrew.orchestrator.command.Command.AssignReview;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Puts an implemented task in front of a second worker for review.
 */
@Component
public class AssignReviewHandler implements CommandHandler<AssignReview> {

    private final AssignmentStore     store;
    private final AssignmentValidator validator;
    private final ProcessRuntime      runtime;
    private final WorkerInstructions  instructions;
    private final Clock               clock;

    public AssignReviewHandler(AssignmentStore store,
                               AssignmentValidator validator,
                               ProcessRuntime runtime,
                               WorkerInstructions instructions,
                               Clock clock) {
        this.store        = store;
        this.validator    = validator;
        this.runtime      = runtime;
        this.instructions = instructions;
        this.clock        = clock;
    }

    @Override
    public CommandType type() {
        return CommandType.ASSIGN_REVIEW;
    }

    @Override
    public CommandResult handle(AssignReview command) {
        validator.validateReviewAssignment(command.reviewerId(), command.taskId(), command.implementerId());

        runtime.resume(command.reviewerId(), instructions.review(
                command.taskId(), command.implementerId(), command.summary(), command.reviewType()));

        TaskAssignment task = store.assignReviewer(
                command.reviewerId(), command.taskId(), command.implementerId(), clock.instant());
        return CommandResult.success("assigned %s to review task %s".formatted(command.reviewerId(), command.taskId()), task);
    }
}
