package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An operation builder, which encapsulates a position in a block
 * where operations are being inserted.
 */
public class OpBuilder {
    private final Block block;
    private @Nullable Operation insertBefore;

    /**
     * Construct an operation builder, inserting at the end of a block.
     *
     * @param block The block.
     */
    public OpBuilder(Block block) {
        this.block = block;
    }

    /**
     * Construct an operation builder, inserting before an operation.
     *
     * @param op The operation, which must be in a block.
     * @return The builder.
     */
    public static OpBuilder before(Operation op) {
        Block block = op.getBlock();
        if (block == null) {
            throw new IllegalStateException("Operation " + op.getName() + " is not in a block");
        }
        OpBuilder builder = new OpBuilder(block);
        builder.insertBefore = op;
        return builder;
    }

    /**
     * Insert an operation at the insertion point.
     *
     * @param op The operation, which must not be in a block.
     * @return The same operation.
     */
    public Operation insert(Operation op) {
        List<Operation> ops = block.getOperations();
        if (insertBefore == null) {
            ops.add(op);
        } else {
            int index = ops.indexOf(insertBefore);
            if (index < 0) {
                throw new IllegalStateException("Insertion point " + insertBefore.getName() + " has left its block");
            }
            ops.add(index, op);
        }
        return op;
    }

    /**
     * Create an operation and insert it.
     *
     * @param key         The kind of operation.
     * @param resultTypes The types of its results.
     * @param operands    The operands.
     * @param attributes  The attributes.
     * @param numRegions  The number of empty regions it should have.
     * @return The operation.
     */
    public Operation create(OpKey key,
                            List<Type> resultTypes,
                            List<Value> operands,
                            Map<String, ? extends Attribute> attributes,
                            int numRegions) {
        return insert(new Operation(key, resultTypes, operands, attributes, numRegions));
    }

    public Operation create(OpKey key,
                            List<Type> resultTypes,
                            List<Value> operands,
                            Map<String, ? extends Attribute> attributes) {
        return create(key, resultTypes, operands, attributes, 0);
    }

    /**
     * Create and insert an operation with a single result and no attributes.
     *
     * @param key        The kind of operation.
     * @param resultType The type of the result.
     * @param operands   The operands.
     * @return The result.
     */
    public Value createValue(OpKey key, Type resultType, Value... operands) {
        return create(key,
                Collections.singletonList(resultType),
                Arrays.asList(operands),
                Collections.emptyMap())
                .getResult(0);
    }

    /**
     * Create and insert a terminator returning some values.
     *
     * @param returnKey The kind of return operation.
     * @param values    The returned values.
     * @return The terminator.
     */
    public Operation createReturn(OpKey returnKey, Value... values) {
        return create(returnKey, Collections.emptyList(), Arrays.asList(values), Collections.emptyMap());
    }
}
