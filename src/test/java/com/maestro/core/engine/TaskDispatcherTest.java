package com.maestro.core.engine;

import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.TaskStatus;
import com.maestro.core.model.Workflow;
import com.maestro.core.model.WorkflowTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TaskDispatcherTest {

    private AgentExecutor executor;
    private TaskDispatcher dispatcher;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        executor = mock(AgentExecutor.class);
        dispatcher = new TaskDispatcher(executor);
        workflow = new Workflow("wf", "Test", "Objective");
    }

    private WorkflowTask task(String id, String... deps) {
        var task = new WorkflowTask(id, id, "Do " + id, "Developer", 3, workflow.getTasks().size() + 1,
                Set.of(deps), 2);
        workflow.addTask(task);
        return task;
    }

    @Test
    @DisplayName("successful attempt completes the task with the executor result")
    void successCompletes() throws Exception {
        var a = task("A");
        when(executor.execute(eq("Developer"), eq("Do A"), anyMap())).thenReturn("done");

        dispatcher.dispatch(workflow, List.of(a), 2);

        assertEquals(TaskStatus.COMPLETED, a.getStatus());
        assertEquals("done", a.getResult());
        assertNotNull(a.getStartedAt());
        assertNotNull(a.getCompletedAt());
    }

    @Test
    @DisplayName("failed attempt with retries left returns the task to PENDING")
    void failureRetries() throws Exception {
        var a = task("A");
        when(executor.execute(anyString(), anyString(), anyMap())).thenThrow(new RuntimeException("down"));

        dispatcher.dispatch(workflow, List.of(a), 2);

        assertEquals(TaskStatus.PENDING, a.getStatus());
        assertEquals(1, a.getRetries());
        assertEquals("down", a.getError());
    }

    @Test
    @DisplayName("exception without message records the exception type")
    void failureWithoutMessage() throws Exception {
        var a = task("A");
        when(executor.execute(anyString(), anyString(), anyMap())).thenThrow(new IllegalStateException());

        dispatcher.dispatch(workflow, List.of(a), 1);

        assertEquals("IllegalStateException", a.getError());
    }

    @Test
    @DisplayName("every task of the batch is executed")
    void wholeBatchExecuted() throws Exception {
        var a = task("A");
        var b = task("B");
        var c = task("C");
        when(executor.execute(anyString(), anyString(), anyMap())).thenReturn("ok");

        dispatcher.dispatch(workflow, List.of(a, b, c), 3);

        verify(executor, times(3)).execute(anyString(), anyString(), anyMap());
        assertTrue(List.of(a, b, c).stream().allMatch(t -> t.getStatus() == TaskStatus.COMPLETED));
    }

    @Test
    @DisplayName("context holds results of completed dependencies only")
    void dependencyContext() {
        var a = task("A");
        var b = task("B");
        var c = task("C", "A", "B");
        a.markRunning(Instant.now());
        a.markCompleted("result A", Instant.now());
        b.recordFailure("x", Instant.now());

        assertEquals(Map.of("A", "result A"), dispatcher.dependencyContext(workflow, c));
    }

    @Test
    @DisplayName("attempt outcomes are recorded as metrics")
    void metricsRecorded() throws Exception {
        var registry = new SimpleMeterRegistry();
        dispatcher = new TaskDispatcher(executor, new LifecycleNotifier(null), new MaestroMetrics(registry));
        var a = task("A");
        when(executor.execute(anyString(), anyString(), anyMap())).thenReturn("ok");

        dispatcher.dispatch(workflow, List.of(a), 1);

        assertEquals(1.0, registry.find("maestro.task.attempts").tag("outcome", "completed").counter().count());
        assertEquals(1, registry.find("maestro.task.duration").tag("agent", "Developer").timer().count());
    }
}
