package com.actionengine.agent.api;

import com.actionengine.agent.observability.AgentRunTrace;
import com.actionengine.agent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for run traces and analytics.
 *
 * GET /api/v1/traces/thread/{threadId}   traces of one thread, newest first
 * GET /api/v1/traces/analytics           latency, run count and status breakdown
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/thread/{threadId}")
    public ResponseEntity<List<AgentRunTrace>> getThreadTraces(@PathVariable String threadId) {
        return ResponseEntity.ok(traceService.getTracesForThread(threadId));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics() {
        return ResponseEntity.ok(traceService.getAnalytics());
    }
}
