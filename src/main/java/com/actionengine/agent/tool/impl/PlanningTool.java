package com.actionengine.agent.tool.impl;

import com.actionengine.agent.environment.PlanningStore;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.state.Plan;
import com.actionengine.agent.state.PlanStep;
import com.actionengine.agent.tool.AgentTool;
import com.actionengine.agent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates and maintains the hierarchical plan of a thread.
 *
 * Commands: create, update_plan, mark_steps. Plans live in the thread's
 * {@link PlanningStore}; every successful command returns the formatted plan.
 */
@Component
@Slf4j
public class PlanningTool implements AgentTool {

    public static final String NAME = "planning";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                Create and update a hierarchical plan for the current task.
                - create: new plan from 'task' (used as title when 'title' is absent) and 'steps'.
                  Also use it to replace a plan that no longer relates to the task.
                - update_plan: replace all steps of 'plan_id'; statuses reset to not_started.
                - mark_steps: set step statuses via 'step_updates', e.g.
                  [{"index": 0, "status": "completed"}, {"index": [1, 0], "status": "in_progress"}]
                Statuses: not_started, in_progress, completed, blocked.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        Map<String, Object> step = Map.of(
                "type", "object",
                "properties", Map.of(
                        "content", Map.of("type", "string"),
                        "notes", Map.of("type", "string"),
                        "substeps", Map.of("type", "array", "items", Map.of("type", "object"))
                ),
                "required", List.of("content")
        );
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "command", Map.of(
                                "type", "string",
                                "enum", List.of("create", "update_plan", "mark_steps"),
                                "description", "The planning command to execute"
                        ),
                        "plan_id", Map.of("type", "string",
                                "description", "Plan identifier, required for update_plan and mark_steps"),
                        "title", Map.of("type", "string", "description", "Optional plan title"),
                        "task", Map.of("type", "string", "description", "Task description, required for create"),
                        "steps", Map.of("type", "array", "items", step),
                        "step_updates", Map.of(
                                "type", "array",
                                "items", Map.of(
                                        "type", "object",
                                        "properties", Map.of(
                                                "index", Map.of("description", "Step index or index path"),
                                                "status", Map.of("type", "string", "enum", PlanStep.STATUSES)
                                        )
                                )
                        )
                ),
                "required", List.of("command")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ThreadEnvironment environment) {
        String command = (String) arguments.get("command");
        PlanningStore store = environment.getPlanningStore();
        log.info("Planning tool invoked [thread={}, command={}]", environment.getThreadId(), command);

        try {
            Plan plan = switch (command) {
                case "create" -> create(arguments, store);
                case "update_plan" -> updatePlan(arguments, store);
                case "mark_steps" -> markSteps(arguments, store);
                default -> throw new IllegalArgumentException("Unknown command '" + command + "'");
            };
            return ToolResult.success(PlanningStore.format(plan));
        } catch (IllegalArgumentException | ClassCastException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private Plan create(Map<String, Object> args, PlanningStore store) {
        String task = (String) args.get("task");
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("'task' is required for create command");
        }
        List<PlanStep> steps = parseSteps(args.get("steps"), "create");
        String title = (String) args.get("title");
        return store.create(title != null && !title.isBlank() ? title : task, steps);
    }

    private Plan updatePlan(Map<String, Object> args, PlanningStore store) {
        String planId = requirePlanId(args, "update_plan");
        List<PlanStep> steps = parseSteps(args.get("steps"), "update_plan");
        return store.replaceSteps(planId, (String) args.get("title"), steps);
    }

    private Plan markSteps(Map<String, Object> args, PlanningStore store) {
        String planId = requirePlanId(args, "mark_steps");
        if (!(args.get("step_updates") instanceof List<?> updates) || updates.isEmpty()) {
            throw new IllegalArgumentException("'step_updates' array is required for mark_steps command");
        }
        if (store.get(planId).isEmpty()) {
            throw new IllegalArgumentException("No plan found with ID: " + planId);
        }
        for (Object raw : updates) {
            if (!(raw instanceof Map<?, ?> update)) {
                throw new IllegalArgumentException("Each step update must be an object");
            }
            Object index = update.get("index");
            Object status = update.get("status");
            if (index == null) throw new IllegalArgumentException("Each step update requires an 'index'");
            if (status == null) throw new IllegalArgumentException("Each step update requires a 'status'");
            store.markStep(planId, indexPath(index), status.toString());
        }
        return store.get(planId).orElseThrow();
    }

    private static String requirePlanId(Map<String, Object> args, String command) {
        String planId = (String) args.get("plan_id");
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("'plan_id' is required for " + command + " command");
        }
        return planId;
    }

    private static List<Integer> indexPath(Object index) {
        if (index instanceof Number n) {
            return List.of(n.intValue());
        }
        if (index instanceof List<?> list) {
            List<Integer> path = new ArrayList<>();
            for (Object part : list) {
                if (!(part instanceof Number n)) {
                    throw new IllegalArgumentException("Invalid step index path: " + index);
                }
                path.add(n.intValue());
            }
            return path;
        }
        throw new IllegalArgumentException("Invalid step index: " + index);
    }

    private static List<PlanStep> parseSteps(Object raw, String command) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException("'steps' array is required for " + command + " command");
        }
        List<PlanStep> steps = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> data) || data.get("content") == null) {
                throw new IllegalArgumentException("Invalid steps format: each step needs a 'content'");
            }
            PlanStep step = PlanStep.builder().content(data.get("content").toString()).build();
            if (data.get("notes") != null) {
                step.setNotes(data.get("notes").toString());
            }
            if (data.get("substeps") instanceof List<?> substeps && !substeps.isEmpty()) {
                step.setSubsteps(parseSteps(substeps, command));
            }
            steps.add(step);
        }
        return steps;
    }
}
