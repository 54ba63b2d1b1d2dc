package com.sysdiagram.cli;

import java.io.PrintWriter;
import java.util.List;

/**
 * Prints parser warnings in a uniform format.
 */
final class WarningPrinter {

    private WarningPrinter() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static void print(PrintWriter err, List<String> warnings) {
        for (String warning : warnings) {
            err.println("⚠ " + warning);
        }
        err.flush();
    }
}
