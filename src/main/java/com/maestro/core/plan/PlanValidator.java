package com.maestro.core.plan;

import com.maestro.core.model.WorkflowTask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a set of tasks forms a DAG whose edges all resolve.
 */
public class PlanValidator {

    private enum Mark { VISITING, DONE }

    /**
     * @throws InvalidPlanException  on the first unknown dependency, self dependency or cycle
     * @throws IllegalStateException when two tasks share an id
     */
    public void validate(Collection<WorkflowTask> tasks) {
        var byId = new HashMap<String, WorkflowTask>();
        for (WorkflowTask task : tasks) {
            if (byId.put(task.getId(), task) != null) {
                throw new IllegalStateException("Duplicate task id " + task.getId());
            }
        }

        for (WorkflowTask task : tasks) {
            if (task.getDependsOn().contains(task.getId())) {
                throw new InvalidPlanException(PlanErrorKind.SELF_DEPENDENCY, List.of(task.getId()),
                        "Task " + task.getId() + " depends on itself");
            }
            for (String dep : task.getDependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new InvalidPlanException(PlanErrorKind.UNKNOWN_DEPENDENCY, List.of(task.getId()),
                            "Task " + task.getId() + " depends on unknown task " + dep);
                }
            }
        }

        var marks = new HashMap<String, Mark>();
        for (WorkflowTask task : tasks) {
            if (!marks.containsKey(task.getId())) {
                visit(task, byId, marks, new ArrayList<>());
            }
        }
    }

    private void visit(WorkflowTask task, Map<String, WorkflowTask> byId,
                       Map<String, Mark> marks, List<String> path) {
        marks.put(task.getId(), Mark.VISITING);
        path.add(task.getId());
        for (String dep : task.getDependsOn().stream().sorted().toList()) {
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                throw new InvalidPlanException(PlanErrorKind.CYCLE, cycle,
                        "Dependency cycle: " + String.join(" -> ", cycle) + " -> " + dep);
            }
            if (mark == null) {
                visit(byId.get(dep), byId, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(task.getId(), Mark.DONE);
    }
}
