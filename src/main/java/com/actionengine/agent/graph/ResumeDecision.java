package com.actionengine.agent.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Human answer to an {@link InterruptPayload}. A null {@code toolCallId}
 * applies to whatever call is pending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeDecision {

    private boolean approved;
    private String reason;
    private String toolCallId;

    public static ResumeDecision approve() {
        return ResumeDecision.builder().approved(true).build();
    }

    public static ResumeDecision reject(String reason) {
        return ResumeDecision.builder().approved(false).reason(reason).build();
    }
}
