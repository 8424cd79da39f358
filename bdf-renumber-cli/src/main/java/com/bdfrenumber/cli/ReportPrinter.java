package com.bdfrenumber.cli;

import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingSeverity;
import com.bdfrenumber.core.model.RunStatus;
import com.bdfrenumber.core.model.ValidationReport;

import java.io.PrintStream;

/**
 * Console output of validation reports.
 */
final class ReportPrinter {

    private ReportPrinter() {
        // Utility class
    }

    static void print(ValidationReport report, PrintStream out) {
        for (Finding finding : report.findings()) {
            out.println("  " + symbol(finding.severity()) + " " + finding);
        }
    }

    static void printStatus(String action, RunStatus status, ValidationReport report, PrintStream out) {
        out.println();
        switch (status) {
            case SUCCESS -> out.println("✓ " + action + " complete");
            case SUCCESS_WITH_WARNINGS ->
                out.println("⚠ " + action + " complete with " + report.warnings().size() + " warning(s)");
            case FAILURE -> out.println("✗ " + action + " failed with " + report.errors().size() + " error(s)");
        }
    }

    private static String symbol(FindingSeverity severity) {
        return switch (severity) {
            case ERROR -> "✗";
            case WARNING -> "⚠";
            case INFO -> "•";
        };
    }
}
