package com.actionengine.agent.observability;

import com.actionengine.agent.graph.ThreadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Trace of one driver run (a submission or a resume) stored in MongoDB.
 *
 * Captures:
 * - the task and whether the run started fresh or resumed
 * - node visits in execution order with their latency
 * - tools executed
 * - final status, interrupt message and error
 */
@Document(collection = "agent_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunTrace {

    public enum Kind { START, RESUME }

    @Id
    private String id;

    @Indexed
    private String threadId;

    private Kind kind;

    private String task;

    @Indexed
    private ThreadStatus status;

    private int stepsExecuted;
    private long totalLatencyMs;

    @Builder.Default
    private List<RunTraceRecorder.NodeVisit> nodeVisits = new ArrayList<>();

    @Builder.Default
    private List<String> toolsExecuted = new ArrayList<>();

    /** Approval question when the run ended suspended */
    private String interruptMessage;

    private String errorMessage;

    @Indexed
    @CreatedDate
    private Instant createdAt;
}
