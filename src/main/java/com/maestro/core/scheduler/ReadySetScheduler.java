package com.maestro.core.scheduler;

import com.maestro.core.model.TaskStatus;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes which tasks of a workflow can run next and converts tasks that can never
 * run into SKIPPED.
 * <p>
 * Readiness is recomputed by scanning every task, which is cheap for plans of a few
 * dozen tasks.
 */
@Service
public class ReadySetScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReadySetScheduler.class);

    static final String DEPENDENCY_FAILED = "Dependency failed";

    private static final Comparator<WorkflowTask> DISPATCH_ORDER =
            Comparator.comparingInt(WorkflowTask::getPriority).thenComparingInt(WorkflowTask::getSequence);

    /**
     * Marks every PENDING task whose dependencies have all COMPLETED as READY.
     *
     * @return the ready tasks (including ones already READY), most urgent first
     */
    public List<WorkflowTask> computeReadySet(Workflow workflow) {
        var ready = new ArrayList<WorkflowTask>();
        for (var task : workflow.getTasks()) {
            if (task.getStatus() == TaskStatus.READY) {
                ready.add(task);
                continue;
            }
            if (task.getStatus() != TaskStatus.PENDING) {
                continue;
            }
            if (!allDependenciesCompleted(workflow, task)) {
                log.debug("  {} [{}] — deps unsatisfied: {}", task.getId(), task.getAssignee(), task.getDependsOn());
                continue;
            }
            task.markReady();
            ready.add(task);
        }
        ready.sort(DISPATCH_ORDER);
        log.debug("computeReadySet: {} tasks, {} ready", workflow.getTasks().size(), ready.size());
        return ready;
    }

    /**
     * Takes the first {@code maxParallel} tasks of a ready set.
     */
    public List<WorkflowTask> nextBatch(List<WorkflowTask> readySet, int maxParallel) {
        int limit = Math.max(1, maxParallel);
        return readySet.size() <= limit ? List.copyOf(readySet) : List.copyOf(readySet.subList(0, limit));
    }

    /**
     * Skips every PENDING or READY task that waits on a FAILED, SKIPPED or CANCELLED task.
     * Called when nothing is ready. Dependents listed before the task they wait on are
     * picked up by the next call.
     *
     * @return the tasks that were skipped
     */
    public List<WorkflowTask> skipBlockedTasks(Workflow workflow, Instant now) {
        var skipped = new ArrayList<WorkflowTask>();
        for (var task : workflow.getTasks()) {
            if (task.getStatus() != TaskStatus.PENDING && task.getStatus() != TaskStatus.READY) {
                continue;
            }
            String failedDep = firstUnsuccessfulDependency(workflow, task);
            if (failedDep != null) {
                task.markSkipped(DEPENDENCY_FAILED + ": " + failedDep, now);
                skipped.add(task);
                log.info("  {} [{}] — skipped, dependency {} did not complete",
                        task.getId(), task.getAssignee(), failedDep);
            }
        }
        return skipped;
    }

    /**
     * True when some task is still PENDING or READY.
     */
    public boolean hasUnresolvedTasks(Workflow workflow) {
        return workflow.getTasks().stream()
                .anyMatch(t -> t.getStatus() == TaskStatus.PENDING || t.getStatus() == TaskStatus.READY);
    }

    private boolean allDependenciesCompleted(Workflow workflow, WorkflowTask task) {
        for (String dep : task.getDependsOn()) {
            WorkflowTask depTask = workflow.getTask(dep);
            // unknown ids are permanently unmet
            if (depTask == null || depTask.getStatus() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private String firstUnsuccessfulDependency(Workflow workflow, WorkflowTask task) {
        return task.getDependsOn().stream()
                .sorted()
                .filter(dep -> {
                    WorkflowTask depTask = workflow.getTask(dep);
                    return depTask != null && depTask.getStatus().isUnsuccessful();
                })
                .findFirst()
                .orElse(null);
    }
}
