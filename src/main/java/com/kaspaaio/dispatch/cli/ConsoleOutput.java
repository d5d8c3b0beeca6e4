package com.kaspaaio.dispatch.cli;

import com.kaspaaio.core.engine.ReconciliationOutcome;
import com.kaspaaio.core.engine.ServiceDiff;
import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.validation.ValidationIssue;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the installer CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) KASPA ALL-IN-ONE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KASPA-AIO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void error(AioError error) {
        error("[" + error.code() + "] " + error.message());
        if (error.remediation() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|faint " + error.remediation() + "|@"));
        }
    }

    public static void errors(List<AioError> errors) {
        errors.forEach(ConsoleOutput::error);
    }

    public static void issue(ValidationIssue issue, boolean blocking) {
        String line = "[" + issue.code() + "] " + issue.message();
        if (blocking) {
            error(line);
        } else {
            warn(line);
        }
        if (issue.remediation() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|faint " + issue.remediation() + "|@"));
        }
    }

    public static void diff(ServiceDiff diff) {
        diff.added().forEach(s -> System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green) +|@ " + s)));
        diff.changed().forEach(s -> System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) ~|@ " + s)));
        diff.removed().forEach(s -> System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) -|@ " + s)));
        if (!diff.changedKeys().isEmpty()) {
            System.out.println("  keys changed: " + String.join(", ", diff.changedKeys()));
        }
    }

    public static void outcome(ReconciliationOutcome outcome) {
        System.out.println(RULE);
        diff(outcome.diff());
        outcome.warnings().forEach(ConsoleOutput::warn);
        switch (outcome.status()) {
            case COMMITTED -> success(outcome.id() + " committed (backup " + outcome.snapshotId() + ")");
            case ROLLED_BACK -> {
                errors(outcome.errors());
                error(outcome.id() + " rolled back to backup " + outcome.snapshotId());
            }
            case MANUAL_RECOVERY_REQUIRED -> {
                errors(outcome.errors());
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "@|fg(red),bold MANUAL RECOVERY REQUIRED|@ restore backup " + outcome.snapshotId()));
            }
            default -> {
                errors(outcome.errors());
                error(outcome.id() + " " + outcome.status().name().toLowerCase());
            }
        }
    }

    public static void event(String eventType, String data) {
        String prefix = switch (eventType) {
            case "reconciliation.started" -> "@|fg(cyan) [START]|@";
            case "reconciliation.phase" -> "@|fg(blue) [PHASE]|@";
            case "service.deployed" -> "@|fg(green) [DEPLOYED]|@";
            case "service.removed" -> "@|fg(magenta) [REMOVED]|@";
            case "reconciliation.committed" -> "@|fg(green),bold [COMMITTED]|@";
            case "reconciliation.rolled_back" -> "@|fg(yellow),bold [ROLLED BACK]|@";
            case "reconciliation.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        return String.format("%.1f MB", bytes / (1024.0 * 1024));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
