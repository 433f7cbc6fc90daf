package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Objects;

public final class DotDimensionNumbersAttr extends DialectAttribute {
    private final long[] lhsBatchingDimensions;
    private final long[] rhsBatchingDimensions;
    private final long[] lhsContractingDimensions;
    private final long[] rhsContractingDimensions;

    public DotDimensionNumbersAttr(Dialect dialect,
                                   long[] lhsBatchingDimensions,
                                   long[] rhsBatchingDimensions,
                                   long[] lhsContractingDimensions,
                                   long[] rhsContractingDimensions) {
        super(dialect);
        this.lhsBatchingDimensions = lhsBatchingDimensions.clone();
        this.rhsBatchingDimensions = rhsBatchingDimensions.clone();
        this.lhsContractingDimensions = lhsContractingDimensions.clone();
        this.rhsContractingDimensions = rhsContractingDimensions.clone();
    }

    public long[] getLhsBatchingDimensions() {
        return lhsBatchingDimensions.clone();
    }

    public long[] getRhsBatchingDimensions() {
        return rhsBatchingDimensions.clone();
    }

    public long[] getLhsContractingDimensions() {
        return lhsContractingDimensions.clone();
    }

    public long[] getRhsContractingDimensions() {
        return rhsContractingDimensions.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DotDimensionNumbersAttr)) return false;
        DotDimensionNumbersAttr that = (DotDimensionNumbersAttr) o;
        return dialect == that.dialect
                && Arrays.equals(lhsBatchingDimensions, that.lhsBatchingDimensions)
                && Arrays.equals(rhsBatchingDimensions, that.rhsBatchingDimensions)
                && Arrays.equals(lhsContractingDimensions, that.lhsContractingDimensions)
                && Arrays.equals(rhsContractingDimensions, that.rhsContractingDimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect,
                Arrays.hashCode(lhsBatchingDimensions),
                Arrays.hashCode(rhsBatchingDimensions),
                Arrays.hashCode(lhsContractingDimensions),
                Arrays.hashCode(rhsContractingDimensions));
    }

    @Override
    public String toString() {
        return "#" + dialect + ".dot<lhs_batching_dimensions = " + dims(lhsBatchingDimensions)
                + ", rhs_batching_dimensions = " + dims(rhsBatchingDimensions)
                + ", lhs_contracting_dimensions = " + dims(lhsContractingDimensions)
                + ", rhs_contracting_dimensions = " + dims(rhsContractingDimensions) + ">";
    }
}
