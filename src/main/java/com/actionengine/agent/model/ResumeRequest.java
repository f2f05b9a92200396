package com.actionengine.agent.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ResumeRequest {

    @NotNull(message = "approved must be provided")
    private Boolean approved;

    private String reason;

    /**
     * Optional: id of the tool call being decided. When present it must match
     * the pending interrupt, otherwise the resume is rejected as stale.
     */
    private String toolCallId;
}
