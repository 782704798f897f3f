package com.agentcrew.orchestrator.api;

import com.agentcrew.orchestrator.api.dto.ToolRequest;
import com.agentcrew.orchestrator.service.OrchestrationService;
import com.agentcrew.orchestrator.service.ToolResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * JSON endpoints the coordinator's tool bridge calls, one per tool.
 *
 * POST /api/tools/{tool}           — run a tool; body is a {@link ToolRequest}
 * GET  /api/tools/query_worker_state?workerId=&taskId=
 *
 * The body is always a {@link ToolResult}. Failures map to:
 *   400 bad input, 404 unknown worker, 409 workflow conflict,
 *   502 runtime/tracker failure, 503 processor unavailable, 504 timeout.
 */
@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final OrchestrationService service;

    public ToolController(OrchestrationService service) {
        this.service = service;
    }

    @PostMapping("/spawn_worker")
    public ResponseEntity<ToolResult> spawnWorker(@RequestBody(required = false) ToolRequest req) {
        return respond(service.spawnWorker(req == null ? null : req.agentType()));
    }

    @PostMapping("/assign_task")
    public ResponseEntity<ToolResult> assignTask(@RequestBody ToolRequest req) {
        return respond(service.assignTask(req.workerId(), req.taskId(), req.summary()));
    }

    @PostMapping("/replace_worker")
    public ResponseEntity<ToolResult> replaceWorker(@RequestBody ToolRequest req) {
        return respond(service.replaceWorker(req.workerId(), req.reason()));
    }

    @PostMapping("/retire_worker")
    public ResponseEntity<ToolResult> retireWorker(@RequestBody ToolRequest req) {
        return respond(service.retireWorker(req.workerId(), req.reason()));
    }

    @PostMapping("/send_to_worker")
    public ResponseEntity<ToolResult> sendToWorker(@RequestBody ToolRequest req) {
        return respond(service.sendToWorker(req.workerId(), req.message()));
    }

    @PostMapping("/broadcast")
    public ResponseEntity<ToolResult> broadcast(@RequestBody ToolRequest req) {
        return respond(service.broadcast(req.message()));
    }

    @PostMapping("/assign_task_review")
    public ResponseEntity<ToolResult> assignTaskReview(@RequestBody ToolRequest req) {
        return respond(service.assignTaskReview(
                req.reviewerId(), req.taskId(), req.implementerId(), req.summary(), req.reviewType()));
    }

    @PostMapping("/assign_review_feedback")
    public ResponseEntity<ToolResult> assignReviewFeedback(@RequestBody ToolRequest req) {
        return respond(service.assignReviewFeedback(req.implementerId(), req.taskId(), req.feedback()));
    }

    @PostMapping("/approve_commit")
    public ResponseEntity<ToolResult> approveCommit(@RequestBody ToolRequest req) {
        return respond(service.approveCommit(req.implementerId(), req.taskId(), req.commitMessage()));
    }

    @PostMapping("/mark_task_complete")
    public ResponseEntity<ToolResult> markTaskComplete(@RequestBody ToolRequest req) {
        return respond(service.markTaskComplete(req.taskId()));
    }

    @PostMapping("/mark_task_failed")
    public ResponseEntity<ToolResult> markTaskFailed(@RequestBody ToolRequest req) {
        return respond(service.markTaskFailed(req.taskId(), req.reason()));
    }

    /** Returns 202: the stop is queued, not yet performed. */
    @PostMapping("/stop_worker")
    public ResponseEntity<ToolResult> stopWorker(@RequestBody ToolRequest req) {
        ToolResult result = service.stopWorker(req.workerId(), req.forceOrDefault(), req.reason());
        return result.success() ? ResponseEntity.accepted().body(result) : respond(result);
    }

    @PostMapping("/report_implementation_complete")
    public ResponseEntity<ToolResult> reportImplementationComplete(@RequestBody ToolRequest req) {
        return respond(service.reportImplementationComplete(req.workerId(), req.summary()));
    }

    @PostMapping("/report_review_verdict")
    public ResponseEntity<ToolResult> reportReviewVerdict(@RequestBody ToolRequest req) {
        return respond(service.reportReviewVerdict(req.workerId(), req.verdict(), req.comments()));
    }

    @PostMapping("/signal_workflow_complete")
    public ResponseEntity<ToolResult> signalWorkflowComplete(@RequestBody ToolRequest req) {
        return respond(service.signalWorkflowComplete(req.status(), req.summary()));
    }

    @GetMapping("/query_worker_state")
    public ResponseEntity<ToolResult> queryWorkerState(@RequestParam(required = false) String workerId,
                                                       @RequestParam(required = false) String taskId) {
        return respond(service.queryWorkerState(workerId, taskId));
    }

    static ResponseEntity<ToolResult> respond(ToolResult result) {
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    static HttpStatus statusFor(ToolResult result) {
        if (result.success()) return HttpStatus.OK;
        String code = result.errorCode() == null ? "" : result.errorCode();
        return switch (code) {
            case "INVALID_ARGUMENT"                 -> HttpStatus.BAD_REQUEST;
            case "NOT_FOUND", "UNKNOWN_COMMAND"     -> HttpStatus.NOT_FOUND;
            case "RUNTIME_ERROR", "HANDLER_ERROR"   -> HttpStatus.BAD_GATEWAY;
            case "QUEUE_FULL", "MAILBOX_FULL", "NOT_RUNNING",
                 "SHUTDOWN", "INTERRUPTED"          -> HttpStatus.SERVICE_UNAVAILABLE;
            case "TIMEOUT"                          -> HttpStatus.GATEWAY_TIMEOUT;
            default                                 -> HttpStatus.CONFLICT;
        };
    }
}
