package com.presentos.dispatch.cli;

import com.presentos.core.model.RouteOutcome;
import com.presentos.core.model.RouteWarning;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the router CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PRESENTOS ROUTER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROUTER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(RouteWarning warning) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [" + warning.stage().toUpperCase(Locale.ROOT) + "]|@ " + warning.detail()));
    }

    public static void outcome(RouteOutcome outcome) {
        String status = switch (outcome.status()) {
            case ROUTED -> "@|fg(green),bold ROUTED|@";
            case UNKNOWN -> "@|fg(white),bold UNKNOWN|@";
            case NOT_FOUND -> "@|fg(yellow),bold NOT_FOUND|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                status + " " + outcome.requestId() + " intent=" + outcome.intent()));
        if (outcome.taskId() != null) {
            System.out.println("  Task:       " + outcome.taskId());
        }
        if (outcome.link() != null) {
            System.out.println("  Link:       " + outcome.link());
        }
        if (outcome.downstream() != null) {
            System.out.println("  Downstream: " + outcome.downstream().handler()
                    + " HTTP " + outcome.downstream().status());
        }
        if (outcome.errorKind() != null) {
            error(outcome.errorKind() + ": " + outcome.detail());
        }
        if (outcome.warnings() != null) {
            outcome.warnings().forEach(ConsoleOutput::warning);
        }
    }
}
