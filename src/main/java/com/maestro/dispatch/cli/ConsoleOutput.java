package com.maestro.dispatch.cli;

import com.maestro.core.events.WorkflowEvent;
import com.maestro.core.model.TaskSnapshot;
import com.maestro.core.model.TaskStatus;
import com.maestro.core.model.WorkflowSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Maestro CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MAESTRO v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MAESTRO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + name + "]|@ " + message));
    }

    /**
     * One line per lifecycle event while a workflow runs.
     */
    public static void event(WorkflowEvent event) {
        if (event.isTaskEvent()) {
            Object assignee = event.payload().get("assignee");
            Object error = event.payload().get("error");
            String line = event.taskId() + " " + event.eventType().substring("task.".length())
                    + (error != null && !"task.started".equals(event.eventType()) ? " (" + error + ")" : "");
            agent(String.valueOf(assignee), line);
        } else {
            info("workflow " + event.eventType().substring("workflow.".length()));
        }
    }

    public static void workflowSummary(WorkflowSnapshot snapshot) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Workflow:|@ " + snapshot.id() + " — " + snapshot.name()));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Status:|@   " + statusColor(snapshot.status().value())));
        for (TaskSnapshot task : snapshot.tasks()) {
            String icon = switch (task.status()) {
                case COMPLETED -> "@|fg(green) ✓|@";
                case FAILED -> "@|fg(red) ✗|@";
                case SKIPPED, CANCELLED -> "@|fg(yellow) -|@";
                default -> "○";
            };
            String detail = task.status() == TaskStatus.COMPLETED ? "" : " " + task.status().value()
                    + (task.error() != null ? ": " + task.error() : "");
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + icon + " " + task.id() + " [" + task.assignee() + "] " + task.name() + detail));
        }
        System.out.printf("  %d completed, %d failed, %d skipped, %d cancelled%n",
                snapshot.countByStatus(TaskStatus.COMPLETED), snapshot.countByStatus(TaskStatus.FAILED),
                snapshot.countByStatus(TaskStatus.SKIPPED), snapshot.countByStatus(TaskStatus.CANCELLED));
    }

    private static String statusColor(String status) {
        return switch (status) {
            case "completed" -> "@|fg(green) " + status + "|@";
            case "completed_with_errors" -> "@|fg(red) " + status + "|@";
            default -> "@|fg(yellow) " + status + "|@";
        };
    }
}
