package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.command.ReviewType;
import com.agentcrew.orchestrator.tracker.TrackerIssue;
import org.springframework.stereotype.Component;

/**
 * Messages delivered to workers when the workflow hands them a new step.
 *
 * Kept deliberately plain: the coordinator supplies the substance (summary, feedback,
 * commit message); these templates only frame it and name the tool the worker must
 * call when done.
 */
@Component
public class WorkerInstructions {

    public String implement(TrackerIssue issue, String summary) {
        return IMPLEMENT
                .replace("{{TASK_ID}}", issue.id())
                .replace("{{TITLE}}", nullToEmpty(issue.title()))
                .replace("{{DESCRIPTION}}", nullToEmpty(issue.description()))
                .replace("{{SUMMARY}}", orNone(summary));
    }

    public String review(String taskId, String implementerId, String summary, ReviewType reviewType) {
        return REVIEW
                .replace("{{TASK_ID}}", taskId)
                .replace("{{IMPLEMENTER}}", implementerId)
                .replace("{{DEPTH}}", reviewType == ReviewType.SIMPLE
                        ? "Do a quick correctness pass over the diff."
                        : "Review the change thoroughly: correctness, tests, edge cases and style.")
                .replace("{{SUMMARY}}", orNone(summary));
    }

    public String feedback(String taskId, String feedback) {
        return FEEDBACK
                .replace("{{TASK_ID}}", taskId)
                .replace("{{FEEDBACK}}", feedback);
    }

    public String commit(String taskId, String commitMessage) {
        return COMMIT
                .replace("{{TASK_ID}}", taskId)
                .replace("{{MESSAGE}}", commitMessage == null || commitMessage.isBlank()
                        ? "Write a concise message describing the change."
                        : "Use this commit message: " + commitMessage);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String orNone(String s) {
        return s == null || s.isBlank() ? "(none)" : s;
    }

    private static final String IMPLEMENT = """
            [TASK ASSIGNMENT] {{TASK_ID}}: {{TITLE}}

            {{DESCRIPTION}}

            Coordinator notes: {{SUMMARY}}

            Implement the task. When you are done, call report_implementation_complete
            with a short summary of what you changed.
            """;

    private static final String REVIEW = """
            [REVIEW REQUEST] {{TASK_ID}} (implemented by {{IMPLEMENTER}})

            {{DEPTH}}

            Implementation summary: {{SUMMARY}}

            When finished, call report_review_verdict with APPROVED or DENIED and your comments.
            """;

    private static final String FEEDBACK = """
            [REVIEW FEEDBACK] {{TASK_ID}}

            The reviewer denied your implementation:

            {{FEEDBACK}}

            Address the feedback, then call report_implementation_complete again.
            """;

    private static final String COMMIT = """
            [COMMIT APPROVED] {{TASK_ID}}

            Your implementation was approved. Commit the change now.
            {{MESSAGE}}
            """;
}
