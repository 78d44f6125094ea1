package edu.brandeis.cosi103a.knockout.model;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prints the first few model range warnings and counts the rest.
 */
public class WarningPrinter implements ModelRangeListener {

    private static final int MAX_PRINTED = 5;

    private final PrintStream out;
    private final AtomicInteger warnings = new AtomicInteger();

    public WarningPrinter() {
        this(System.err);
    }

    public WarningPrinter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onOutOfRange(ModelRangeWarning warning) {
        int seen = warnings.incrementAndGet();
        if (seen <= MAX_PRINTED) {
            out.println("Warning: " + warning.describe());
        } else if (seen == MAX_PRINTED + 1) {
            out.println("Warning: Suppressing further frame probability range warnings...");
        }
    }

    /**
     * Number of warnings received so far, printed or not.
     */
    public int getWarningCount() {
        return warnings.get();
    }
}
