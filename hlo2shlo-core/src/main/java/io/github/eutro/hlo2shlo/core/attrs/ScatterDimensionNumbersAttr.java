package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Objects;

public final class ScatterDimensionNumbersAttr extends DialectAttribute {
    private final long[] updateWindowDims;
    private final long[] insertedWindowDims;
    private final long[] scatterDimsToOperandDims;
    public final long indexVectorDim;

    public ScatterDimensionNumbersAttr(Dialect dialect,
                                       long[] updateWindowDims,
                                       long[] insertedWindowDims,
                                       long[] scatterDimsToOperandDims,
                                       long indexVectorDim) {
        super(dialect);
        this.updateWindowDims = updateWindowDims.clone();
        this.insertedWindowDims = insertedWindowDims.clone();
        this.scatterDimsToOperandDims = scatterDimsToOperandDims.clone();
        this.indexVectorDim = indexVectorDim;
    }

    public long[] getUpdateWindowDims() {
        return updateWindowDims.clone();
    }

    public long[] getInsertedWindowDims() {
        return insertedWindowDims.clone();
    }

    public long[] getScatterDimsToOperandDims() {
        return scatterDimsToOperandDims.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ScatterDimensionNumbersAttr)) return false;
        ScatterDimensionNumbersAttr that = (ScatterDimensionNumbersAttr) o;
        return dialect == that.dialect
                && indexVectorDim == that.indexVectorDim
                && Arrays.equals(updateWindowDims, that.updateWindowDims)
                && Arrays.equals(insertedWindowDims, that.insertedWindowDims)
                && Arrays.equals(scatterDimsToOperandDims, that.scatterDimsToOperandDims);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect, indexVectorDim,
                Arrays.hashCode(updateWindowDims),
                Arrays.hashCode(insertedWindowDims),
                Arrays.hashCode(scatterDimsToOperandDims));
    }

    @Override
    public String toString() {
        return "#" + dialect + ".scatter<update_window_dims = " + dims(updateWindowDims)
                + ", inserted_window_dims = " + dims(insertedWindowDims)
                + ", scatter_dims_to_operand_dims = " + dims(scatterDimsToOperandDims)
                + ", index_vector_dim = " + indexVectorDim + ">";
    }
}
