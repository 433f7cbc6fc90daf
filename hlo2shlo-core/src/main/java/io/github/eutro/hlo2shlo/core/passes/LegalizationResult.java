package io.github.eutro.hlo2shlo.core.passes;

import io.github.eutro.hlo2shlo.core.conversion.Diagnostic;
import io.github.eutro.hlo2shlo.core.ir.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of running a {@link ConversionDriver} over a program.
 */
public final class LegalizationResult {
    private final Program program;
    private final boolean success;
    private final int convertedCount;
    private final List<String> failedOps;
    private final List<Diagnostic> diagnostics;

    public LegalizationResult(Program program,
                              boolean success,
                              int convertedCount,
                              List<String> failedOps,
                              List<Diagnostic> diagnostics) {
        this.program = program;
        this.success = success;
        this.convertedCount = convertedCount;
        this.failedOps = Collections.unmodifiableList(new ArrayList<>(failedOps));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public Program getProgram() {
        return program;
    }

    /**
     * Whether every operation that had to be converted was.
     *
     * @return Whether the conversion succeeded.
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Get the number of operations converted. In full conversion mode, a failed
     * conversion is rolled back entirely, but this still counts the operations that were
     * converted before the rollback.
     *
     * @return The count.
     */
    public int getConvertedCount() {
        return convertedCount;
    }

    /**
     * Get the names of the operations (and procedures) that had to be converted, but were not.
     *
     * @return The names, in the order they failed.
     */
    public List<String> getFailedOps() {
        return failedOps;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Get the diagnostics of a severity.
     *
     * @param severity The severity.
     * @return The diagnostics.
     */
    public List<Diagnostic> getDiagnostics(Diagnostic.Severity severity) {
        List<Diagnostic> matching = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.severity == severity) matching.add(diagnostic);
        }
        return matching;
    }

    @Override
    public String toString() {
        return (success ? "success" : "failure") + ": " + convertedCount + " converted, "
                + failedOps.size() + " failed " + failedOps;
    }
}
