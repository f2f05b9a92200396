package com.actionengine.agent.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The closed set of merge policies available to {@link StateField}.
 */
public final class MergeStrategies {

    private MergeStrategies() {
    }

    /** The written value replaces the current one, including an explicit null. */
    public static <T> MergeStrategy<T> lastWrite() {
        return (current, update) -> update;
    }

    /** New keys overwrite, other keys are retained. A null update is a no-op. */
    public static <V> MergeStrategy<Map<String, V>> shallowMerge() {
        return (current, update) -> {
            if (update == null) return current;
            Map<String, V> result = current != null ? new LinkedHashMap<>(current) : new LinkedHashMap<>();
            result.putAll(update);
            return result;
        };
    }

    /** Field-wise overlay of {@link PendingApproval}: non-null fields of the update win. */
    public static MergeStrategy<PendingApproval> shallowMergeApproval() {
        return (current, update) -> {
            if (update == null) return current;
            PendingApproval result = current != null ? current.copy() : new PendingApproval();
            if (update.getToolCall() != null) result.setToolCall(update.getToolCall());
            if (update.getApproved() != null) result.setApproved(update.getApproved());
            if (update.getReason() != null) result.setReason(update.getReason());
            return result;
        };
    }

    /**
     * Appends items, replacing earlier items with the same key in place.
     * Items without a key are dropped.
     */
    public static <T> MergeStrategy<List<T>> appendUnique(Function<T, String> keyOf) {
        return (current, update) -> {
            if (update == null) return current;
            Map<String, T> seen = new LinkedHashMap<>();
            if (current != null) {
                current.stream()
                        .filter(item -> keyOf.apply(item) != null)
                        .forEach(item -> seen.put(keyOf.apply(item), item));
            }
            update.stream()
                    .filter(item -> keyOf.apply(item) != null)
                    .forEach(item -> seen.put(keyOf.apply(item), item));
            return new ArrayList<>(seen.values());
        };
    }
}
