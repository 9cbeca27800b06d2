package com.workgraph.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workgraph.core.model.Bottleneck;
import com.workgraph.core.model.WorkRecommendation;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Workgraph CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private static final JsonMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WORKGRAPH v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WORKGRAPH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    /** Machine-readable output for agents and hook scripts. */
    public static void json(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render result as JSON", e);
        }
    }

    public static void bottlenecks(List<Bottleneck> bottlenecks) {
        if (bottlenecks.isEmpty()) {
            success("No bottlenecks: nothing unfinished blocks other work");
            return;
        }
        System.out.printf("  %-16s %-9s %-7s %-8s %s%n", "ID", "PRIORITY", "BLOCKS", "IMPACT", "TITLE");
        System.out.println("  " + "-".repeat(64));
        for (var b : bottlenecks) {
            System.out.printf("  %-16s %-9s %-7d %-8.1f %s%n",
                    b.id(), b.priority().value(), b.blocksCount(), b.impactScore(), truncate(b.title(), 30));
            System.out.println("      blocks: " + String.join(", ", b.blockedTasks()));
        }
    }

    public static void recommendations(List<WorkRecommendation> recommendations) {
        if (recommendations.isEmpty()) {
            info("Nothing is ready to start");
            return;
        }
        int rank = 1;
        for (var r : recommendations) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  @|bold %d.|@ %s  %s  @|fg(green) score %.1f|@", rank++, r.id(), truncate(r.title(), 40), r.score())));
            System.out.println("     " + String.join("; ", r.reasons()));
            if (!r.unlocks().isEmpty()) {
                System.out.println("     unlocks: " + String.join(", ", r.unlocks()));
            }
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
