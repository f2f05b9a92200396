package com.actionengine.agent.node;

import com.actionengine.agent.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Trims the shared conversation before it is sent to the model. Nodes add
 * their own system prompt and the task on every call, so stored system and
 * user turns are dropped, as are empty turns; the last {@code window}
 * remaining messages are kept.
 */
public final class MessagePruner {

    private MessagePruner() {
    }

    public static List<Message> prune(List<Message> messages, int window) {
        if (messages == null || messages.isEmpty()) return new ArrayList<>();

        List<Message> kept = messages.stream()
                .filter(m -> m.getRole() != Message.Role.system && m.getRole() != Message.Role.user)
                .filter(m -> !isEmpty(m))
                .toList();

        int from = Math.max(0, kept.size() - window);
        // A tool result without its assistant turn is rejected by providers
        while (from < kept.size() && kept.get(from).getRole() == Message.Role.tool) {
            from++;
        }
        return new ArrayList<>(kept.subList(from, kept.size()));
    }

    private static boolean isEmpty(Message m) {
        boolean noContent = m.getContent() == null || m.getContent().isBlank();
        boolean noCalls = m.getToolCalls() == null || m.getToolCalls().isEmpty();
        return noContent && noCalls;
    }
}
