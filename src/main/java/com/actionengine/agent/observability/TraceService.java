package com.actionengine.agent.observability;

import com.actionengine.agent.graph.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes analytics.
 *
 * Trace persistence is @Async so it never delays the caller's response.
 * Analytics queries are synchronous.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final AgentRunTraceRepository traceRepository;

    /**
     * Persist the trace of a finished run. {@code error} is set when the run
     * did not produce a result at all, e.g. a stale resume.
     */
    @Async("traceTaskExecutor")
    public void persistTrace(RunTraceRecorder recorder, RunResult result, Throwable error) {
        try {
            AgentRunTrace trace = AgentRunTrace.builder()
                    .threadId(recorder.getThreadId())
                    .kind(recorder.getKind())
                    .task(truncate(recorder.getTask(), 4000))
                    .status(result != null ? result.getStatus() : null)
                    .stepsExecuted(result != null ? result.getStepsExecuted() : 0)
                    .totalLatencyMs(recorder.elapsedMs())
                    .nodeVisits(List.copyOf(recorder.getNodeVisits()))
                    .toolsExecuted(List.copyOf(recorder.getToolsExecuted()))
                    .interruptMessage(truncate(recorder.getInterruptMessage(), 2000))
                    .errorMessage(truncate(errorOf(result, error), 2000))
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [thread={}, kind={}, status={}, steps={}, latency={}ms]",
                    trace.getThreadId(), trace.getKind(), trace.getStatus(),
                    trace.getStepsExecuted(), trace.getTotalLatencyMs());

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist run trace for thread={}", recorder.getThreadId(), e);
        }
    }

    public List<AgentRunTrace> getTracesForThread(String threadId) {
        return traceRepository.findByThreadIdOrderByCreatedAtDesc(threadId);
    }

    /**
     * Summary analytics: average latency, runs and steps in the last 24h,
     * status breakdown.
     */
    public Map<String, Object> getAnalytics() {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatency();
        Long stepsLast24h = traceRepository.totalStepsSince(since24h);
        long runsLast24h = traceRepository.countByCreatedAtAfter(since24h);

        Map<String, Long> statusBreakdown = traceRepository.statusBreakdown().stream()
                .collect(Collectors.toMap(
                        row -> row.id() != null ? row.id() : "NONE",
                        AgentRunTraceRepository.StatusCount::count,
                        Long::sum
                ));

        return Map.of(
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0,
                "runsLast24h", runsLast24h,
                "stepsLast24h", stepsLast24h != null ? stepsLast24h : 0,
                "statusBreakdown", statusBreakdown
        );
    }

    private String errorOf(RunResult result, Throwable error) {
        if (error != null) return error.getMessage();
        if (result != null && result.getState() != null) return result.getState().getError();
        return null;
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
