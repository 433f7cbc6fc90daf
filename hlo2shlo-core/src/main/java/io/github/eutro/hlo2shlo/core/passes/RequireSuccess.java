package io.github.eutro.hlo2shlo.core.passes;

import io.github.eutro.hlo2shlo.core.conversion.Diagnostic;
import io.github.eutro.hlo2shlo.core.ir.Program;

import java.util.stream.Collectors;

/**
 * A pass which unwraps the program of a successful {@link LegalizationResult}, and throws on a failed one.
 */
public class RequireSuccess implements IRPass<LegalizationResult, Program> {
    public static final RequireSuccess INSTANCE = new RequireSuccess();

    @Override
    public Program run(LegalizationResult result) {
        if (!result.isSuccess()) {
            throw new IllegalStateException("Conversion failed on " + result.getFailedOps() + ":\n"
                    + result.getDiagnostics().stream()
                    .map(Diagnostic::toString)
                    .collect(Collectors.joining("\n")));
        }
        return result.getProgram();
    }
}
