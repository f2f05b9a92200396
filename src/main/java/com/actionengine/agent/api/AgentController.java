package com.actionengine.agent.api;

import com.actionengine.agent.core.ThreadRecord;
import com.actionengine.agent.core.WorkflowService;
import com.actionengine.agent.graph.ThreadStatus;
import com.actionengine.agent.model.ResumeRequest;
import com.actionengine.agent.model.RunEvent;
import com.actionengine.agent.model.RunResponse;
import com.actionengine.agent.model.TaskRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thread endpoints.
 *
 * POST   /api/v1/agent/threads                    submit a task, blocks until done or suspended
 * POST   /api/v1/agent/threads/stream             same, streamed as Server-Sent Events
 * POST   /api/v1/agent/threads/{threadId}/resume  answer a pending approval
 * POST   /api/v1/agent/threads/{threadId}/resume/stream
 * POST   /api/v1/agent/threads/{threadId}/cancel
 * DELETE /api/v1/agent/threads/{threadId}         tear down the thread
 * GET    /api/v1/agent/threads/{threadId}         latest checkpoint
 * GET    /api/v1/agent/threads                    recently active threads
 * GET    /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@Slf4j
public class AgentController {

    static final String EVENT_DONE = "done";
    static final String EVENT_ERROR = "error";

    private final WorkflowService workflowService;
    private final TaskExecutor workflowTaskExecutor;
    private final long streamTimeoutMs;

    public AgentController(WorkflowService workflowService,
                           @Qualifier("workflowTaskExecutor") TaskExecutor workflowTaskExecutor,
                           @Value("${engine.stream.timeout-ms:1800000}") long streamTimeoutMs) {
        this.workflowService = workflowService;
        this.workflowTaskExecutor = workflowTaskExecutor;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    @PostMapping("/threads")
    public ResponseEntity<RunResponse> submit(@Valid @RequestBody TaskRequest request) {
        log.info("Submit request [threadId={}]", request.getThreadId());
        return ResponseEntity.ok(workflowService.submit(request));
    }

    @PostMapping(value = "/threads/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter submitStreaming(@Valid @RequestBody TaskRequest request) {
        log.info("Streaming submit request [threadId={}]", request.getThreadId());
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        workflowTaskExecutor.execute(() -> stream(emitter,
                () -> workflowService.submit(request, event -> send(emitter, event))));
        return emitter;
    }

    @PostMapping("/threads/{threadId}/resume")
    public ResponseEntity<RunResponse> resume(@PathVariable String threadId,
                                              @Valid @RequestBody ResumeRequest request) {
        return ResponseEntity.ok(workflowService.resume(threadId, request));
    }

    @PostMapping(value = "/threads/{threadId}/resume/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter resumeStreaming(@PathVariable String threadId,
                                      @Valid @RequestBody ResumeRequest request) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        workflowTaskExecutor.execute(() -> stream(emitter,
                () -> workflowService.resume(threadId, request, event -> send(emitter, event))));
        return emitter;
    }

    @PostMapping("/threads/{threadId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String threadId) {
        ThreadStatus status = workflowService.cancel(threadId);
        String message = status == ThreadStatus.RUNNING ? "Cancellation requested" : "Thread is " + status;
        return ResponseEntity.ok(Map.of("threadId", threadId, "status", status, "message", message));
    }

    @DeleteMapping("/threads/{threadId}")
    public ResponseEntity<Map<String, String>> cleanup(@PathVariable String threadId) {
        workflowService.cleanup(threadId);
        return ResponseEntity.ok(Map.of("message", "Thread cleaned up", "threadId", threadId));
    }

    @GetMapping("/threads/{threadId}")
    public ResponseEntity<RunResponse> getState(@PathVariable String threadId) {
        return ResponseEntity.ok(workflowService.getState(threadId));
    }

    @GetMapping("/threads")
    public ResponseEntity<List<ThreadRecord>> recentThreads() {
        return ResponseEntity.ok(workflowService.recentThreads());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    // ─── SSE plumbing ────────────────────────────────────────────────────────

    /**
     * Runs {@code run} on the calling worker, then sends the final response
     * as a "done" event. Failures become an "error" event.
     */
    private void stream(SseEmitter emitter, Supplier<RunResponse> run) {
        try {
            RunResponse response = run.get();
            emitter.send(SseEmitter.event().name(EVENT_DONE).data(summary(response)));
            emitter.complete();
        } catch (IOException e) {
            log.warn("Stream client went away: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Streamed run failed", e);
            try {
                emitter.send(SseEmitter.event().name(EVENT_ERROR)
                        .data(Map.of("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())));
                emitter.complete();
            } catch (IOException sendFailure) {
                emitter.completeWithError(sendFailure);
            }
        }
    }

    private void send(SseEmitter emitter, RunEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.getType().name()).data(event));
        } catch (IOException e) {
            // Reported by the driver as a listener failure; the run carries on
            throw new UncheckedIOException(e);
        }
    }

    /** Final stream event; the events were already streamed one by one */
    private RunResponse summary(RunResponse response) {
        return RunResponse.builder()
                .threadId(response.getThreadId())
                .status(response.getStatus())
                .state(response.getState())
                .interrupt(response.getInterrupt())
                .stepsExecuted(response.getStepsExecuted())
                .build();
    }
}
