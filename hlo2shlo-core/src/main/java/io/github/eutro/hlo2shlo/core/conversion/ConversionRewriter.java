package io.github.eutro.hlo2shlo.core.conversion;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.ir.*;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Makes changes to a {@link Program} on behalf of conversion patterns, remembering how to undo each of them.
 * <p>
 * The driver takes a {@link #checkpoint()} before running a pattern, and {@link #rollbackTo(int) rolls back}
 * to it if the pattern fails, so a failed pattern never leaves a partial rewrite behind.
 * <p>
 * Diagnostics reported through the rewriter are kept across rollbacks.
 */
public class ConversionRewriter {
    private static final Logger log = LoggerFactory.getLogger(ConversionRewriter.class);

    private final Program program;
    private final List<Runnable> undoLog = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ConversionRewriter(Program program) {
        this.program = program;
    }

    public Program getProgram() {
        return program;
    }

    /**
     * Get a point in the history of changes that can later be rolled back to.
     *
     * @return The checkpoint.
     */
    public int checkpoint() {
        return undoLog.size();
    }

    /**
     * Undo every change made since a checkpoint, most recent first.
     *
     * @param checkpoint The checkpoint, from {@link #checkpoint()}.
     */
    public void rollbackTo(int checkpoint) {
        if (undoLog.size() > checkpoint) {
            log.debug("Rolling back {} change(s)", undoLog.size() - checkpoint);
        }
        while (undoLog.size() > checkpoint) {
            undoLog.remove(undoLog.size() - 1).run();
        }
    }

    /**
     * Forget the history of changes, so they can no longer be rolled back.
     */
    public void commit() {
        undoLog.clear();
    }

    /**
     * Create an operation and insert it before another.
     *
     * @param anchor      The operation to insert before.
     * @param key         The kind of operation.
     * @param resultTypes The types of its results.
     * @param operands    The operands.
     * @param attributes  The attributes.
     * @param numRegions  The number of empty regions it should have.
     * @return The new operation.
     */
    public Operation create(Operation anchor,
                            OpKey key,
                            List<Type> resultTypes,
                            List<Value> operands,
                            Map<String, ? extends Attribute> attributes,
                            int numRegions) {
        Operation op = OpBuilder.before(anchor).create(key, resultTypes, operands, attributes, numRegions);
        undoLog.add(op::erase);
        return op;
    }

    /**
     * Replace every use of the results of an operation with the results of another, and erase it.
     *
     * @param op          The operation to replace.
     * @param replacement The operation replacing it, with as many results.
     */
    public void replaceOp(Operation op, Operation replacement) {
        if (op.getResults().size() != replacement.getResults().size()) {
            throw new IllegalArgumentException("Replacing " + op.getName() + " with " + op.getResults().size()
                    + " result(s) by " + replacement.getName() + " with " + replacement.getResults().size());
        }
        for (int i = 0; i < op.getResults().size(); i++) {
            replaceAllUsesWith(op.getResult(i), replacement.getResult(i));
        }
        eraseOp(op);
    }

    /**
     * Replace every use of a value in the program with another.
     *
     * @param from The value to replace.
     * @param to   The value to replace it with.
     */
    public void replaceAllUsesWith(Value from, Value to) {
        program.walk(user -> {
            List<Value> operands = user.getOperands();
            for (int i = 0; i < operands.size(); i++) {
                if (operands.get(i) == from) {
                    int index = i;
                    operands.set(index, to);
                    undoLog.add(() -> operands.set(index, from));
                }
            }
        });
    }

    /**
     * Check whether a value is used anywhere in the program.
     *
     * @param value The value.
     * @return Whether it has uses.
     */
    public boolean hasUses(Value value) {
        boolean[] found = {false};
        program.walk(user -> {
            if (user.getOperands().contains(value)) found[0] = true;
        });
        return found[0];
    }

    /**
     * Erase an operation, whose results must not be used.
     *
     * @param op The operation.
     * @throws IllegalStateException If the operation is not in a block, or its results are used.
     */
    public void eraseOp(Operation op) {
        Block block = op.getBlock();
        if (block == null) {
            throw new IllegalStateException("Erasing " + op.getName() + " which is not in a block");
        }
        for (Value result : op.getResults()) {
            if (hasUses(result)) {
                throw new IllegalStateException("Erasing " + op.getName() + " whose result " + result + " is still used",
                        op.created);
            }
        }
        List<Operation> ops = block.getOperations();
        int index = ops.indexOf(op);
        ops.remove(index);
        undoLog.add(() -> ops.add(index, op));
    }

    /**
     * Move every block of a region to the end of another.
     *
     * @param region The region to move the blocks out of, which is left empty.
     * @param dest   The region to move them into.
     */
    public void inlineRegionBefore(Region region, Region dest) {
        List<Block> moved = new ArrayList<>(region.getBlocks());
        region.getBlocks().clear();
        dest.getBlocks().addAll(moved);
        undoLog.add(() -> {
            dest.getBlocks().removeAll(moved);
            region.getBlocks().addAll(moved);
        });
    }

    /**
     * Convert the types of the arguments of every block in a region, in place.
     *
     * @param region    The region.
     * @param converter The type converter.
     * @return Whether every argument could be converted. Arguments converted before a failure
     * stay converted until the driver rolls back.
     */
    public boolean convertRegionTypes(Region region, TypeConverter converter) {
        for (Block block : region.getBlocks()) {
            for (Value argument : block.getArguments()) {
                Type type = argument.getType();
                Type converted = converter.convertType(type);
                if (converted == null) return false;
                if (!converted.equals(type)) {
                    argument.setType(converted);
                    undoLog.add(() -> argument.setType(type));
                }
            }
        }
        return true;
    }

    /**
     * Add a procedure to the program, under a unique name.
     *
     * @param procedure The procedure.
     * @return The name it was given.
     * @see SymbolTable#insert(Procedure)
     */
    public String insertProcedure(Procedure procedure) {
        SymbolTable symbols = program.getSymbolTable();
        int counter = symbols.getUniquingCounter();
        String name = symbols.insert(procedure);
        undoLog.add(() -> {
            symbols.erase(procedure);
            symbols.setUniquingCounter(counter);
        });
        return name;
    }

    /**
     * Remove a procedure from the program.
     *
     * @param procedure The procedure.
     */
    public void eraseProcedure(Procedure procedure) {
        List<Procedure> procedures = program.getProcedures();
        int index = procedures.indexOf(procedure);
        if (index < 0) {
            throw new IllegalStateException("Erasing @" + procedure.getName() + " which is not in the program");
        }
        program.getSymbolTable().erase(procedure);
        undoLog.add(() -> procedures.add(index, procedure));
    }

    /**
     * Change the signature of a procedure.
     *
     * @param procedure The procedure.
     * @param type      The new signature.
     */
    public void setProcedureType(Procedure procedure, FunctionType type) {
        FunctionType old = procedure.getType();
        procedure.setType(type);
        undoLog.add(() -> procedure.setType(old));
    }

    /**
     * Report that a pattern did not match an operation.
     *
     * @param op     The operation.
     * @param reason Why it did not match.
     * @return false, for convenience.
     */
    public boolean notifyMatchFailure(Operation op, String reason) {
        log.debug("Failed to match {}: {}", op.getName(), reason);
        diagnostics.add(Diagnostic.remark(op, reason));
        return false;
    }

    /**
     * Report that an operation violates a constraint of the conversion.
     *
     * @param op      The operation.
     * @param message The error message.
     * @return false, for convenience.
     */
    public boolean emitError(Operation op, String message) {
        log.debug("Error on {}: {}", op.getName(), message);
        diagnostics.add(Diagnostic.error(op, message));
        return false;
    }

    /**
     * Report a diagnostic that is not about a single operation.
     *
     * @param diagnostic The diagnostic.
     */
    public void report(Diagnostic diagnostic) {
        log.debug("{}", diagnostic);
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
