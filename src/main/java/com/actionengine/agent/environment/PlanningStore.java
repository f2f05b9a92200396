package com.actionengine.agent.environment;

import com.actionengine.agent.state.Plan;
import com.actionengine.agent.state.PlanStep;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-thread plan storage used by the planning tool. Lives in the thread
 * environment; the workflow state only receives snapshots.
 */
@Slf4j
public class PlanningStore implements LiveResource {

    private final Map<String, Plan> plans = new LinkedHashMap<>();
    private String currentPlanId;

    public synchronized Plan create(String title, List<PlanStep> steps) {
        String planId = "plan_" + plans.size();
        Plan plan = Plan.builder().planId(planId).title(title).steps(steps).build();
        plans.put(planId, plan);
        currentPlanId = planId;
        log.debug("Created plan {} with {} steps", planId, steps.size());
        return plan.copy();
    }

    public synchronized Plan replaceSteps(String planId, String title, List<PlanStep> steps) {
        Plan plan = require(planId);
        plan.setSteps(steps);
        if (title != null && !title.isBlank()) {
            plan.setTitle(title);
        }
        return plan.copy();
    }

    /**
     * Sets the status of the step at {@code indexPath}; a path of length two
     * addresses a substep.
     */
    public synchronized void markStep(String planId, List<Integer> indexPath, String status) {
        if (!PlanStep.STATUSES.contains(status)) {
            throw new IllegalArgumentException("Invalid status: " + status);
        }
        if (indexPath == null || indexPath.isEmpty()) {
            throw new IllegalArgumentException("Step index path must not be empty");
        }
        List<PlanStep> level = require(planId).getSteps();
        PlanStep step = null;
        for (Integer index : indexPath) {
            if (index == null || index < 0 || index >= level.size()) {
                throw new IllegalArgumentException("Invalid step index path: " + indexPath);
            }
            step = level.get(index);
            level = step.getSubsteps();
        }
        step.setStatus(status);
    }

    public synchronized Optional<Plan> current() {
        if (currentPlanId == null) return Optional.empty();
        return Optional.ofNullable(plans.get(currentPlanId)).map(Plan::copy);
    }

    public synchronized Optional<Plan> get(String planId) {
        return Optional.ofNullable(plans.get(planId)).map(Plan::copy);
    }

    /**
     * Text rendering of the current plan, sent to the model as context.
     */
    public synchronized String formatCurrent() {
        return current().map(PlanningStore::format).orElse("No plan available");
    }

    public static String format(Plan plan) {
        StringBuilder sb = new StringBuilder();
        String header = "The current plan: " + plan.getTitle() + " (ID: " + plan.getPlanId() + ")";
        sb.append(header).append('\n').append("=".repeat(header.length())).append("\n\n");

        List<PlanStep> steps = plan.getSteps();
        long completed = steps.stream().filter(s -> PlanStep.COMPLETED.equals(s.getStatus())).count();
        sb.append(String.format("Progress: %d/%d steps completed (%.1f%%)%n", completed, steps.size(),
                steps.isEmpty() ? 0.0 : completed * 100.0 / steps.size()));
        sb.append("Steps:\n");
        appendSteps(sb, steps, "");
        return sb.toString();
    }

    private static void appendSteps(StringBuilder sb, List<PlanStep> steps, String indent) {
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            sb.append(indent).append(i).append(". ").append(symbol(step.getStatus()))
                    .append(' ').append(step.getContent()).append('\n');
            if (step.getNotes() != null && !step.getNotes().isBlank()) {
                sb.append(indent).append("   Notes: ").append(step.getNotes()).append('\n');
            }
            if (step.getSubsteps() != null && !step.getSubsteps().isEmpty()) {
                appendSteps(sb, step.getSubsteps(), indent + "   ");
            }
        }
    }

    private static String symbol(String status) {
        return switch (status == null ? PlanStep.NOT_STARTED : status) {
            case PlanStep.IN_PROGRESS -> "[→]";
            case PlanStep.COMPLETED -> "[✓]";
            case PlanStep.BLOCKED -> "[!]";
            default -> "[ ]";
        };
    }

    private Plan require(String planId) {
        Plan plan = plans.get(planId);
        if (plan == null) {
            throw new IllegalArgumentException("No plan found with ID: " + planId);
        }
        return plan;
    }

    @Override
    public synchronized void close() {
        plans.clear();
        currentPlanId = null;
    }
}
