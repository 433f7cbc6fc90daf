package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Objects;

public final class GatherDimensionNumbersAttr extends DialectAttribute {
    private final long[] offsetDims;
    private final long[] collapsedSliceDims;
    private final long[] startIndexMap;
    public final long indexVectorDim;

    public GatherDimensionNumbersAttr(Dialect dialect,
                                      long[] offsetDims,
                                      long[] collapsedSliceDims,
                                      long[] startIndexMap,
                                      long indexVectorDim) {
        super(dialect);
        this.offsetDims = offsetDims.clone();
        this.collapsedSliceDims = collapsedSliceDims.clone();
        this.startIndexMap = startIndexMap.clone();
        this.indexVectorDim = indexVectorDim;
    }

    public long[] getOffsetDims() {
        return offsetDims.clone();
    }

    public long[] getCollapsedSliceDims() {
        return collapsedSliceDims.clone();
    }

    public long[] getStartIndexMap() {
        return startIndexMap.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof GatherDimensionNumbersAttr)) return false;
        GatherDimensionNumbersAttr that = (GatherDimensionNumbersAttr) o;
        return dialect == that.dialect
                && indexVectorDim == that.indexVectorDim
                && Arrays.equals(offsetDims, that.offsetDims)
                && Arrays.equals(collapsedSliceDims, that.collapsedSliceDims)
                && Arrays.equals(startIndexMap, that.startIndexMap);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect, indexVectorDim,
                Arrays.hashCode(offsetDims),
                Arrays.hashCode(collapsedSliceDims),
                Arrays.hashCode(startIndexMap));
    }

    @Override
    public String toString() {
        return "#" + dialect + ".gather<offset_dims = " + dims(offsetDims)
                + ", collapsed_slice_dims = " + dims(collapsedSliceDims)
                + ", start_index_map = " + dims(startIndexMap)
                + ", index_vector_dim = " + indexVectorDim + ">";
    }
}
