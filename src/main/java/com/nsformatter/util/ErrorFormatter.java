package com.nsformatter.util;

import com.nsformatter.api.error.FormatterError;
import com.nsformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility for formatting error messages consistently.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * Creates a new error formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one error as {@code SEVERITY: message (Line l:c)} plus an optional suggestion line.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        sb.append(" (Line ").append(error.getLine()).append(':').append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a summary of errors per file, followed by totals per severity.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = countBySeverity(errors);
            counts.forEach((severity, count) -> totals.merge(severity, count, Long::sum));

            sb.append(entry.getKey().getFileName()).append(": ")
                    .append(formatCounts(counts))
                    .append("\n");
        }

        sb.append("\nTotal: ").append(formatCounts(totals));
        return sb.toString();
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private Map<Severity, Long> countBySeverity(List<FormatterError> errors) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (FormatterError error : errors) {
            counts.merge(error.getSeverity(), 1L, Long::sum);
        }
        return counts;
    }

    private String formatCounts(Map<Severity, Long> counts) {
        return counts.entrySet().stream()
                .map(e -> colorize(colorFor(e.getKey()), e.getValue() + " " + labelFor(e.getKey())))
                .collect(Collectors.joining(", "));
    }

    private static String colorFor(Severity severity) {
        return switch (severity) {
            case FATAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }

    private static String labelFor(Severity severity) {
        return switch (severity) {
            case FATAL -> "fatal";
            case ERROR -> "errors";
            case WARNING -> "warnings";
            case INFO -> "info";
        };
    }
}
