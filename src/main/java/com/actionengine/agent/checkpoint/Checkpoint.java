package com.actionengine.agent.checkpoint;

import com.actionengine.agent.environment.EnvironmentConfig;
import com.actionengine.agent.graph.InterruptPayload;
import com.actionengine.agent.graph.NodeId;
import com.actionengine.agent.graph.ThreadStatus;
import com.actionengine.agent.state.WorkflowState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable snapshot of a thread, written after every node. Contains only
 * plain data; live handles are re-attached on load through the
 * environment manager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private String threadId;

    /** Node executions so far; writes with a lower step than the stored one are dropped */
    private long step;

    private NodeId lastNode;

    /** Node to run next, or the suspended node while status is SUSPENDED */
    private NodeId nextNode;

    private ThreadStatus status;

    private WorkflowState state;

    private InterruptPayload interrupt;

    /** Settings the thread's environment was created with, reused on resume */
    private EnvironmentConfig environmentConfig;

    /** State fields a resume is expected to write, e.g. pending_approval */
    @Builder.Default
    private List<String> pendingWrites = new ArrayList<>();

    /** Write count per state field key */
    @Builder.Default
    private Map<String, Long> channelVersions = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant createdAt;

    /**
     * Copy with every structural field present: empty collections for
     * missing pending writes, channel versions and metadata, and a fresh
     * state when none was stored.
     */
    public Checkpoint normalized() {
        return Checkpoint.builder()
                .threadId(threadId)
                .step(step)
                .lastNode(lastNode)
                .nextNode(nextNode)
                .status(status != null ? status : ThreadStatus.TERMINATED)
                .state(state != null ? state.copy() : new WorkflowState().copy())
                .interrupt(interrupt)
                .environmentConfig(environmentConfig != null ? environmentConfig : EnvironmentConfig.defaults())
                .pendingWrites(pendingWrites != null ? new ArrayList<>(pendingWrites) : new ArrayList<>())
                .channelVersions(channelVersions != null ? new LinkedHashMap<>(channelVersions) : new LinkedHashMap<>())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .createdAt(createdAt != null ? createdAt : Instant.now())
                .build();
    }
}
