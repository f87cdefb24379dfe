package com.maestro.core.scheduler;

import com.maestro.core.model.TaskStatus;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReadySetSchedulerTest {

    private ReadySetScheduler scheduler;
    private Workflow workflow;
    private int sequence;

    @BeforeEach
    void setUp() {
        scheduler = new ReadySetScheduler();
        workflow = new Workflow("wf", "Test", "Objective");
        sequence = 0;
    }

    private WorkflowTask task(String id, int priority, String... deps) {
        var task = new WorkflowTask(id, id, "Do " + id, "Developer", priority, ++sequence, Set.of(deps), 2);
        workflow.addTask(task);
        return task;
    }

    private static List<String> ids(List<WorkflowTask> tasks) {
        return tasks.stream().map(WorkflowTask::getId).toList();
    }

    private static void complete(WorkflowTask task) {
        task.markRunning(Instant.now());
        task.markCompleted("ok", Instant.now());
    }

    private static void fail(WorkflowTask task) {
        while (task.getStatus() != TaskStatus.FAILED) {
            task.recordFailure("boom", Instant.now());
        }
    }

    @Test
    @DisplayName("3 independent tasks -> all ready")
    void threeIndependentTasks() {
        task("A", 3);
        task("B", 3);
        task("C", 3);

        var ready = scheduler.computeReadySet(workflow);

        assertEquals(List.of("A", "B", "C"), ids(ready));
        assertTrue(ready.stream().allMatch(t -> t.getStatus() == TaskStatus.READY));
    }

    @Test
    @DisplayName("Linear chain A->B->C -> one ready task at a time")
    void linearChain() {
        var a = task("A", 3);
        var b = task("B", 3, "A");
        task("C", 3, "B");

        assertEquals(List.of("A"), ids(scheduler.computeReadySet(workflow)));
        complete(a);
        assertEquals(List.of("B"), ids(scheduler.computeReadySet(workflow)));
        complete(b);
        assertEquals(List.of("C"), ids(scheduler.computeReadySet(workflow)));
    }

    @Test
    @DisplayName("Diamond A->{B,C}->D")
    void diamondDependency() {
        var a = task("A", 3);
        var b = task("B", 3, "A");
        var c = task("C", 3, "A");
        task("D", 3, "B", "C");

        assertEquals(List.of("A"), ids(scheduler.computeReadySet(workflow)));
        complete(a);
        assertEquals(List.of("B", "C"), ids(scheduler.computeReadySet(workflow)));
        complete(b);
        assertEquals(List.of("C"), ids(scheduler.computeReadySet(workflow)));
        complete(c);
        assertEquals(List.of("D"), ids(scheduler.computeReadySet(workflow)));
    }

    @Test
    @DisplayName("Ready set is sorted by priority, ties by plan order")
    void sortedByPriority() {
        task("A", 3);
        task("B", 1);
        task("C", 3);
        task("D", 2);

        assertEquals(List.of("B", "D", "A", "C"), ids(scheduler.computeReadySet(workflow)));
    }

    @Test
    @DisplayName("nextBatch limits batch size")
    void nextBatchLimits() {
        task("A", 3);
        task("B", 3);
        task("C", 3);
        var ready = scheduler.computeReadySet(workflow);

        assertEquals(List.of("A", "B"), ids(scheduler.nextBatch(ready, 2)));
        assertEquals(3, scheduler.nextBatch(ready, 10).size());
        assertEquals(1, scheduler.nextBatch(ready, 0).size());
    }

    @Test
    @DisplayName("Unknown dependency is never satisfied")
    void unknownDependencyNeverReady() {
        task("A", 3, "missing");

        assertTrue(scheduler.computeReadySet(workflow).isEmpty());
        assertTrue(scheduler.skipBlockedTasks(workflow, Instant.now()).isEmpty());
        assertTrue(scheduler.hasUnresolvedTasks(workflow));
    }

    @Test
    @DisplayName("Failed dependency does not make a task ready")
    void failedDependencyNotReady() {
        var a = task("A", 3);
        task("B", 3, "A");
        fail(a);

        assertTrue(scheduler.computeReadySet(workflow).isEmpty());
    }

    @Test
    @DisplayName("skipBlockedTasks skips dependents of failed tasks with a reason")
    void skipBlocked() {
        var a = task("A", 3);
        var b = task("B", 3, "A");
        var c = task("C", 3, "B");
        var d = task("D", 3);
        fail(a);

        var skipped = scheduler.skipBlockedTasks(workflow, Instant.now());

        assertEquals(List.of("B", "C"), ids(skipped));
        assertEquals("Dependency failed: A", b.getError());
        assertEquals("Dependency failed: B", c.getError());
        assertEquals(TaskStatus.PENDING, d.getStatus());
        assertNotNull(b.getCompletedAt());
    }

    @Test
    @DisplayName("Completed tasks are excluded and an all-complete workflow has no unresolved tasks")
    void allCompleted() {
        var a = task("A", 3);
        var b = task("B", 3);
        complete(a);
        complete(b);

        assertTrue(scheduler.computeReadySet(workflow).isEmpty());
        assertFalse(scheduler.hasUnresolvedTasks(workflow));
    }
}
