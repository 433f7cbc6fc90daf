package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.ir.*;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Moves the region of an operation into a new procedure, so that it can be referred to by name.
 * <p>
 * For example, the reduction body of
 * <pre>{@code
 * %0:2 = "mhlo.all_reduce"(%a, %b) ({
 * ^bb(%x: tensor<f32>, %y: tensor<f32>):
 *   %s = "mhlo.add"(%x, %y) : (tensor<f32>, tensor<f32>) -> tensor<f32>
 *   "mhlo.return"(%s) : (tensor<f32>) -> ()
 * }) : ...
 * }</pre>
 * becomes {@code func.func @all_reduce(%x: tensor<f32>, %y: tensor<f32>) -> (tensor<f32>)}.
 */
public final class RegionExtractor {
    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    public static final String CAPTURE_ERROR = "MHLO feature serialization in StableHLO only supports regions that "
            + "do not capture SSA values from above";

    private final TypeConverter typeConverter;

    public RegionExtractor(TypeConverter typeConverter) {
        this.typeConverter = typeConverter;
    }

    /**
     * Extract the first region of an operation into a procedure in the rewriter's program.
     * <p>
     * The region must have exactly one block, ending in a terminator, and must not use any value
     * defined outside it. The procedure is named after the operation's mnemonic, made unique by the
     * symbol table. Its signature takes the (converted) argument types of the block, and returns the
     * (converted) operand types of the terminator.
     *
     * @param op       The operation, which must have a region.
     * @param rewriter The rewriter.
     * @return The procedure, or null if the region could not be extracted.
     */
    public @Nullable Procedure extract(Operation op, ConversionRewriter rewriter) {
        if (op.getNumRegions() == 0) {
            throw new IllegalArgumentException(op.getName() + " has no region to extract");
        }
        Region region = op.getRegion(0);
        if (!region.hasOneBlock()) {
            rewriter.notifyMatchFailure(op, "can only extract regions with exactly one block");
            return null;
        }
        if (!getUsedValuesDefinedAbove(region).isEmpty()) {
            rewriter.emitError(op, CAPTURE_ERROR);
            return null;
        }
        if (!rewriter.convertRegionTypes(region, typeConverter)) {
            rewriter.notifyMatchFailure(op, "failed to convert region argument types");
            return null;
        }

        Block block = region.front();
        Operation terminator = block.getTerminator();
        if (terminator == null) {
            rewriter.notifyMatchFailure(op, "region does not end in a terminator");
            return null;
        }
        List<Type> resultTypes = new ArrayList<>();
        for (Value operand : terminator.getOperands()) {
            resultTypes.add(operand.getType());
        }
        resultTypes = typeConverter.convertTypes(resultTypes);
        if (resultTypes == null) {
            rewriter.notifyMatchFailure(op, "failed to convert region result types");
            return null;
        }

        Procedure procedure = new Procedure(
                op.getKey().getStrippedName(),
                new FunctionType(block.getArgumentTypes(), resultTypes));
        String name = rewriter.insertProcedure(procedure);
        rewriter.inlineRegionBefore(region, procedure.getBody());
        log.debug("Extracted region of {} as @{}", op.getName(), name);
        return procedure;
    }

    /**
     * Find the values that are used in a region, but defined outside of it.
     *
     * @param region The region.
     * @return The values, in the order they are first used.
     */
    public static Set<Value> getUsedValuesDefinedAbove(Region region) {
        Set<Value> values = new LinkedHashSet<>();
        region.walk(op -> {
            for (Value operand : op.getOperands()) {
                Block definingBlock = operand.getParentBlock();
                if (definingBlock == null || !region.isAncestor(definingBlock.getParent())) {
                    values.add(operand);
                }
            }
        });
        return values;
    }
}
