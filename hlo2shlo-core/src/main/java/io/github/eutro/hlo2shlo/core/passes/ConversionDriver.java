package io.github.eutro.hlo2shlo.core.passes;

import io.github.eutro.hlo2shlo.core.conversion.ConversionPattern;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.Diagnostic;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ir.Procedure;
import io.github.eutro.hlo2shlo.core.ir.Program;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Applies {@link ConversionPattern}s to every operation of a program.
 * <p>
 * Operations are visited in pre-order, so an operation is visited before the operations nested in it.
 * Each pattern application is atomic: if the pattern fails, everything it changed is rolled back.
 * An operation that has no pattern, or whose pattern fails, is a failure if it is illegal.
 */
public final class ConversionDriver {
    private static final Logger log = LoggerFactory.getLogger(ConversionDriver.class);

    public enum Mode {
        /**
         * If any illegal operation is left unconverted, roll back the whole conversion.
         */
        FULL,
        /**
         * Keep the operations that were converted, and leave the rest as they were.
         */
        PARTIAL,
    }

    private final Map<OpKey, ConversionPattern> patterns;
    private final Predicate<Operation> isIllegal;
    private final Mode mode;
    private final @Nullable TypeConverter signatureConverter;

    /**
     * Construct a driver.
     *
     * @param patterns           The patterns to apply, at most one per kind of operation.
     * @param isIllegal          Which operations must be converted.
     * @param mode               The conversion mode.
     * @param signatureConverter The converter to convert procedure signatures with, or null to leave them alone.
     */
    public ConversionDriver(Collection<? extends ConversionPattern> patterns,
                            Predicate<Operation> isIllegal,
                            Mode mode,
                            @Nullable TypeConverter signatureConverter) {
        Map<OpKey, ConversionPattern> byKey = new HashMap<>();
        for (ConversionPattern pattern : patterns) {
            if (byKey.putIfAbsent(pattern.getRootKey(), pattern) != null) {
                throw new IllegalArgumentException("Two patterns for " + pattern.getRootKey());
            }
        }
        this.patterns = byKey;
        this.isIllegal = isIllegal;
        this.mode = mode;
        this.signatureConverter = signatureConverter;
    }

    /**
     * Convert a program.
     *
     * @param program The program.
     * @return The result.
     */
    public LegalizationResult run(Program program) {
        ConversionRewriter rewriter = new ConversionRewriter(program);
        int start = rewriter.checkpoint();
        List<String> failed = new ArrayList<>();
        int converted = 0;

        if (signatureConverter != null) {
            for (Procedure procedure : new ArrayList<>(program.getProcedures())) {
                int checkpoint = rewriter.checkpoint();
                if (!convertSignature(procedure, rewriter)) {
                    rewriter.rollbackTo(checkpoint);
                    failed.add("func.func @" + procedure.getName());
                }
            }
        }

        List<Operation> worklist = new ArrayList<>();
        program.walk(worklist::add);
        for (Operation op : worklist) {
            // erased, or nested in an erased operation
            if (op.getParentProgram() != program) continue;

            ConversionPattern pattern = patterns.get(op.getKey());
            if (pattern == null) {
                if (isIllegal.test(op)) {
                    rewriter.notifyMatchFailure(op, "no conversion pattern for op");
                    failed.add(op.getName());
                }
                continue;
            }
            int checkpoint = rewriter.checkpoint();
            if (pattern.matchAndRewrite(op, rewriter)) {
                converted++;
            } else {
                rewriter.rollbackTo(checkpoint);
                if (isIllegal.test(op)) {
                    failed.add(op.getName());
                }
            }
        }

        boolean success = failed.isEmpty();
        if (!success && mode == Mode.FULL) {
            log.info("Conversion failed on {} op(s), rolling back: {}", failed.size(), failed);
            rewriter.rollbackTo(start);
        } else {
            log.info("Converted {} op(s), {} left unconverted", converted, failed.size());
        }
        rewriter.commit();
        return new LegalizationResult(program, success, converted, failed, rewriter.getDiagnostics());
    }

    private boolean convertSignature(Procedure procedure, ConversionRewriter rewriter) {
        Type converted = signatureConverter.convertType(procedure.getType());
        if (!(converted instanceof FunctionType)
                || !rewriter.convertRegionTypes(procedure.getBody(), signatureConverter)) {
            rewriter.report(new Diagnostic(Diagnostic.Severity.ERROR,
                    "func.func @" + procedure.getName(),
                    "failed to convert signature " + procedure.getType()));
            return false;
        }
        if (!converted.equals(procedure.getType())) {
            rewriter.setProcedureType(procedure, (FunctionType) converted);
        }
        return true;
    }
}
