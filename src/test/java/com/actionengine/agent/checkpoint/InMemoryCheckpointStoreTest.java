package com.actionengine.agent.checkpoint;

import com.actionengine.agent.environment.EnvironmentConfig;
import com.actionengine.agent.environment.EnvironmentManager;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.graph.NodeId;
import com.actionengine.agent.graph.ThreadStatus;
import com.actionengine.agent.state.WorkflowState;
import com.actionengine.agent.support.RecordingTerminalSession;
import com.actionengine.agent.support.ScriptedLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCheckpointStoreTest {

    private EnvironmentManager environments;
    private InMemoryCheckpointStore store;

    @BeforeEach
    void setUp() {
        environments = new EnvironmentManager(config -> new ScriptedLlmClient(),
                (threadId, config) -> null,
                (threadId, config) -> new RecordingTerminalSession());
        store = new InMemoryCheckpointStore(environments);
    }

    private static Checkpoint checkpoint(long step, String task) {
        return Checkpoint.builder()
                .step(step)
                .status(ThreadStatus.RUNNING)
                .nextNode(NodeId.THINKING)
                .state(WorkflowState.initial(task))
                .build();
    }

    @Test
    void load_unknownThread_isEmpty() {
        assertThat(store.load("missing")).isEmpty();
    }

    @Test
    void save_thenLoad_returnsCheckpointWithDefaults() {
        Checkpoint sparse = new Checkpoint();
        sparse.setStep(1);

        store.save("t1", sparse);
        Checkpoint loaded = store.load("t1").orElseThrow().checkpoint();

        assertThat(loaded.getThreadId()).isEqualTo("t1");
        assertThat(loaded.getStatus()).isEqualTo(ThreadStatus.TERMINATED);
        assertThat(loaded.getState()).isNotNull();
        assertThat(loaded.getState().getToolsUsed()).isEmpty();
        assertThat(loaded.getPendingWrites()).isEmpty();
        assertThat(loaded.getChannelVersions()).isEmpty();
        assertThat(loaded.getMetadata()).isEmpty();
        assertThat(loaded.getEnvironmentConfig()).isNotNull();
        assertThat(loaded.getCreatedAt()).isNotNull();
    }

    @Test
    void save_stripsLiveResourcesAtAnyDepth() {
        RecordingTerminalSession terminal = new RecordingTerminalSession();
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("terminal", terminal);
        nested.put("user", "ada");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", "api");
        metadata.put("client", new ScriptedLlmClient());
        metadata.put("context", nested);
        metadata.put("handles", List.of(terminal, "keep"));
        Checkpoint checkpoint = checkpoint(1, "task");
        checkpoint.setMetadata(metadata);

        store.save("t2", checkpoint);

        Map<String, Object> stored = store.load("t2").orElseThrow().checkpoint().getMetadata();
        assertThat(stored).containsOnlyKeys("source", "context", "handles");
        assertThat(stored.get("context")).isEqualTo(Map.of("user", "ada"));
        assertThat(stored.get("handles")).isEqualTo(List.of("keep"));
    }

    @Test
    void save_olderStepIsDropped() {
        assertThat(store.save("t3", checkpoint(5, "newer"))).isTrue();
        assertThat(store.save("t3", checkpoint(4, "older"))).isFalse();
        assertThat(store.save("t3", checkpoint(5, "same step"))).isTrue();

        Checkpoint loaded = store.load("t3").orElseThrow().checkpoint();
        assertThat(loaded.getStep()).isEqualTo(5);
        assertThat(loaded.getState().getTask()).isEqualTo("same step");
    }

    @Test
    void save_isIsolatedFromLaterChanges() {
        Checkpoint checkpoint = checkpoint(1, "original");
        store.save("t4", checkpoint);

        checkpoint.getState().getToolsUsed().add(ScriptedLlmClient.toolCall("c1", "terminal", Map.of()));
        checkpoint.setStep(99);

        Checkpoint loaded = store.load("t4").orElseThrow().checkpoint();
        assertThat(loaded.getStep()).isEqualTo(1);
        assertThat(loaded.getState().getToolsUsed()).isEmpty();
    }

    @Test
    void load_attachesLiveEnvironmentWhenPresent() {
        store.save("t5", checkpoint(1, "task"));
        assertThat(store.load("t5").orElseThrow().environment()).isEmpty();

        ThreadEnvironment environment = environments.getOrCreate("t5",
                EnvironmentConfig.builder().useBrowser(false).build());

        assertThat(store.load("t5").orElseThrow().environment()).containsSame(environment);
    }

    @Test
    void delete_removesCheckpoint() {
        store.save("t6", checkpoint(1, "task"));

        store.delete("t6");

        assertThat(store.load("t6")).isEmpty();
    }
}
