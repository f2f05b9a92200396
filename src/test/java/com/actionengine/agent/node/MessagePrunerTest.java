package com.actionengine.agent.node;

import com.actionengine.agent.model.Message;
import com.actionengine.agent.model.ToolCall;
import com.actionengine.agent.support.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MessagePrunerTest {

    private static final ToolCall CALL = ScriptedLlmClient.toolCall("call_1", "terminal", Map.of("script", "ls"));

    private static Message assistantWithCall() {
        return Message.builder().role(Message.Role.assistant).toolCalls(List.of(CALL)).build();
    }

    @Test
    void dropsSystemUserAndEmptyTurns() {
        List<Message> messages = List.of(
                Message.system("prompt"),
                Message.user("task"),
                Message.assistant(""),
                Message.assistant("thinking"),
                assistantWithCall(),
                Message.toolResult(CALL, "a.txt"));

        List<Message> pruned = MessagePruner.prune(messages, 10);

        assertThat(pruned).extracting(Message::getRole)
                .containsExactly(Message.Role.assistant, Message.Role.assistant, Message.Role.tool);
        assertThat(pruned.get(0).getContent()).isEqualTo("thinking");
    }

    @Test
    void keepsLastWindowMessages() {
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            messages.add(Message.assistant("m" + i));
        }

        assertThat(MessagePruner.prune(messages, 3)).extracting(Message::getContent)
                .containsExactly("m17", "m18", "m19");
    }

    @Test
    void windowNeverStartsWithOrphanToolResult() {
        List<Message> messages = List.of(
                Message.assistant("first"),
                assistantWithCall(),
                Message.toolResult(CALL, "output"),
                Message.assistant("after"));

        List<Message> pruned = MessagePruner.prune(messages, 2);

        assertThat(pruned).extracting(Message::getContent).containsExactly("after");
    }

    @Test
    void nullOrEmpty_givesEmptyList() {
        assertThat(MessagePruner.prune(null, 5)).isEmpty();
        assertThat(MessagePruner.prune(List.of(), 5)).isEmpty();
    }
}
