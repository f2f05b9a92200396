package com.actionengine.agent.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanStep {

    public static final String NOT_STARTED = "not_started";
    public static final String IN_PROGRESS = "in_progress";
    public static final String COMPLETED = "completed";
    public static final String BLOCKED = "blocked";

    public static final List<String> STATUSES = List.of(NOT_STARTED, IN_PROGRESS, COMPLETED, BLOCKED);

    private String content;

    @Builder.Default
    private String status = NOT_STARTED;

    @Builder.Default
    private String notes = "";

    @Builder.Default
    private List<PlanStep> substeps = new ArrayList<>();

    public PlanStep copy() {
        List<PlanStep> copied = new ArrayList<>();
        if (substeps != null) {
            substeps.forEach(s -> copied.add(s.copy()));
        }
        return new PlanStep(content, status, notes, copied);
    }
}
