package com.maestro.core.plan;

import com.maestro.core.agent.AgentProfile;
import com.maestro.core.agent.AgentRegistry;
import com.maestro.core.config.EngineProperties;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.PlanItem;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns planner output into {@link WorkflowTask}s and routes each task to an agent.
 * <p>
 * Item <i>n</i> of the plan (1-based) becomes task {@code task_<n>}. A plan appended to a
 * workflow that already has <i>k</i> tasks is numbered from {@code task_<k+1>}. Dependencies
 * given as integers or numeric strings are positions within the plan being translated; any
 * other string is taken as a task id, which is how later plans refer to earlier tasks.
 * The assignee is the registry profile with the requested name, else the best capability
 * match for the task text, else the configured default assignee.
 */
@Component
public class PlanTranslator {

    private static final Logger log = LoggerFactory.getLogger(PlanTranslator.class);

    static final String TASK_ID_PREFIX = "task_";
    static final int MAX_NAME_LENGTH = 100;
    private static final Pattern PLAN_POSITION = Pattern.compile("\\d{1,9}");

    private final AgentRegistry registry;
    private final PlanValidator validator;
    private final MaestroMetrics metrics;
    private final int defaultPriority;
    private final int defaultMaxRetries;
    private final String defaultAssignee;
    private final boolean validatePlans;

    @Autowired
    public PlanTranslator(AgentRegistry registry, EngineProperties properties, MaestroMetrics metrics) {
        this(registry, metrics, properties.getDefaultPriority(), properties.getDefaultMaxRetries(),
                properties.getDefaultAssignee(), properties.isValidatePlans());
    }

    public PlanTranslator(AgentRegistry registry, MaestroMetrics metrics, int defaultPriority,
                          int defaultMaxRetries, String defaultAssignee, boolean validatePlans) {
        this.registry = registry;
        this.validator = new PlanValidator();
        this.metrics = metrics;
        this.defaultPriority = defaultPriority;
        this.defaultMaxRetries = defaultMaxRetries;
        this.defaultAssignee = defaultAssignee;
        this.validatePlans = validatePlans;
    }

    /**
     * Builds tasks for every plan item and appends them to the workflow.
     *
     * @return the created tasks in plan order
     * @throws InvalidPlanException  when validation is enabled and the plan is not a DAG of
     *                               known ids; the workflow is left untouched in that case
     * @throws IllegalStateException when a generated id is already taken by a task added
     *                               outside of plan translation
     */
    public List<WorkflowTask> translate(Workflow workflow, List<PlanItem> plan) {
        int offset = workflow.getTasks().size();
        var tasks = new ArrayList<WorkflowTask>(plan.size());
        for (int i = 0; i < plan.size(); i++) {
            var task = toTask(plan.get(i), i + 1, offset);
            if (workflow.containsTask(task.getId())) {
                throw new IllegalStateException("Workflow " + workflow.getId() + " already has a task "
                        + task.getId());
            }
            tasks.add(task);
        }

        if (validatePlans) {
            var candidates = new ArrayList<>(workflow.getTasks());
            candidates.addAll(tasks);
            validator.validate(candidates);
        }

        tasks.forEach(workflow::addTask);
        log.info("Workflow {}: translated {} plan items into tasks", workflow.getId(), tasks.size());
        return tasks;
    }

    private WorkflowTask toTask(PlanItem item, int position, int offset) {
        int number = offset + position;
        String id = TASK_ID_PREFIX + number;
        String text = item.task() != null ? item.task() : "";
        String name = item.name() != null && !item.name().isBlank()
                ? item.name()
                : (text.isBlank() ? "Task " + number : abbreviate(text));

        var route = route(item.assignee(), text);
        var task = new WorkflowTask(id, name, text, route.assignee(),
                item.priority() != null ? item.priority() : defaultPriority,
                number,
                resolveDependencies(item.dependsOn(), offset),
                item.maxRetries() != null ? item.maxRetries() : defaultMaxRetries);

        task.getMetadata().put("routing", route.kind());
        if (item.assignee() != null) {
            task.getMetadata().put("requestedAssignee", item.assignee());
        }
        log.debug("  {} -> {} ({}), deps {}", id, route.assignee(), route.kind(), task.getDependsOn());
        return task;
    }

    Set<String> resolveDependencies(List<Object> dependsOn, int offset) {
        var ids = new LinkedHashSet<String>();
        for (Object dep : dependsOn) {
            if (dep == null) continue;
            if (dep instanceof Number n) {
                ids.add(TASK_ID_PREFIX + (offset + n.intValue()));
                continue;
            }
            String text = dep.toString().trim();
            if (text.isEmpty()) continue;
            ids.add(PLAN_POSITION.matcher(text).matches() ? TASK_ID_PREFIX + (offset + Integer.parseInt(text)) : text);
        }
        return ids;
    }

    Route route(String requested, String taskText) {
        Optional<AgentProfile> exact = registry.get(requested);
        Route route;
        if (exact.isPresent()) {
            route = new Route(exact.get().name(), "exact");
        } else {
            route = registry.findBest(taskText)
                    .map(p -> new Route(p.name(), "capability"))
                    .orElseGet(() -> new Route(defaultAssignee, "default"));
        }
        if (metrics != null) {
            metrics.recordRouting(route.kind());
        }
        return route;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_NAME_LENGTH ? text : text.substring(0, MAX_NAME_LENGTH);
    }

    record Route(String assignee, String kind) {}
}
