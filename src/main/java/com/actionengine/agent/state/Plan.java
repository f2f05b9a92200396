package com.actionengine.agent.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Hierarchical plan produced by the planning tool. The planning store owns the
 * mutable instance; workflow state only ever holds a {@link #copy()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String planId;
    private String title;

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();

    public Plan copy() {
        List<PlanStep> copied = new ArrayList<>();
        if (steps != null) {
            steps.forEach(s -> copied.add(s.copy()));
        }
        return new Plan(planId, title, copied);
    }
}
