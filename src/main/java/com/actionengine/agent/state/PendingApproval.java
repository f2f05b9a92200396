package com.actionengine.agent.state;

import com.actionengine.agent.model.ToolCall;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Approval bookkeeping for the tool call currently selected by the tool
 * generator. Merged field by field: a null field in an update keeps the
 * previous value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingApproval {

    private ToolCall toolCall;
    private Boolean approved;
    private String reason;

    @JsonIgnore
    public boolean isGranted() {
        return toolCall != null && Boolean.TRUE.equals(approved);
    }

    public PendingApproval copy() {
        return new PendingApproval(toolCall, approved, reason);
    }
}
