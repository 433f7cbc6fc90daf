package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Objects;

/**
 * Declares that (part of) a custom call's output aliases (part of) one of its operands.
 */
public final class OutputOperandAliasAttr extends DialectAttribute {
    private final long[] outputTupleIndices;
    public final long operandIndex;
    private final long[] operandTupleIndices;

    public OutputOperandAliasAttr(Dialect dialect,
                                  long[] outputTupleIndices,
                                  long operandIndex,
                                  long[] operandTupleIndices) {
        super(dialect);
        this.outputTupleIndices = outputTupleIndices.clone();
        this.operandIndex = operandIndex;
        this.operandTupleIndices = operandTupleIndices.clone();
    }

    public long[] getOutputTupleIndices() {
        return outputTupleIndices.clone();
    }

    public long[] getOperandTupleIndices() {
        return operandTupleIndices.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof OutputOperandAliasAttr)) return false;
        OutputOperandAliasAttr that = (OutputOperandAliasAttr) o;
        return dialect == that.dialect
                && operandIndex == that.operandIndex
                && Arrays.equals(outputTupleIndices, that.outputTupleIndices)
                && Arrays.equals(operandTupleIndices, that.operandTupleIndices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect, operandIndex,
                Arrays.hashCode(outputTupleIndices),
                Arrays.hashCode(operandTupleIndices));
    }

    @Override
    public String toString() {
        return "#" + dialect + ".output_operand_alias<output_tuple_indices = " + dims(outputTupleIndices)
                + ", operand_index = " + operandIndex
                + ", operand_tuple_indices = " + dims(operandTupleIndices) + ">";
    }
}
