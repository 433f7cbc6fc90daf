package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Objects;

/**
 * The dimension layout of a convolution's input, kernel and output.
 * <p>
 * Prints in the compact form {@code [b, 0, 1, f]x[0, 1, i, o]->[b, 0, 1, f]}, where
 * positions not claimed by any dimension are printed as {@code ?}. Negative dimensions and
 * dimensions too large to be a position are printed as {@code ?} too.
 */
public final class ConvDimensionNumbersAttr extends DialectAttribute {
    private static final int MAX_PRINTED_RANK = 1 << 16;

    public final long inputBatchDimension;
    public final long inputFeatureDimension;
    private final long[] inputSpatialDimensions;
    public final long kernelInputFeatureDimension;
    public final long kernelOutputFeatureDimension;
    private final long[] kernelSpatialDimensions;
    public final long outputBatchDimension;
    public final long outputFeatureDimension;
    private final long[] outputSpatialDimensions;

    public ConvDimensionNumbersAttr(Dialect dialect,
                                    long inputBatchDimension,
                                    long inputFeatureDimension,
                                    long[] inputSpatialDimensions,
                                    long kernelInputFeatureDimension,
                                    long kernelOutputFeatureDimension,
                                    long[] kernelSpatialDimensions,
                                    long outputBatchDimension,
                                    long outputFeatureDimension,
                                    long[] outputSpatialDimensions) {
        super(dialect);
        this.inputBatchDimension = inputBatchDimension;
        this.inputFeatureDimension = inputFeatureDimension;
        this.inputSpatialDimensions = inputSpatialDimensions.clone();
        this.kernelInputFeatureDimension = kernelInputFeatureDimension;
        this.kernelOutputFeatureDimension = kernelOutputFeatureDimension;
        this.kernelSpatialDimensions = kernelSpatialDimensions.clone();
        this.outputBatchDimension = outputBatchDimension;
        this.outputFeatureDimension = outputFeatureDimension;
        this.outputSpatialDimensions = outputSpatialDimensions.clone();
    }

    public long[] getInputSpatialDimensions() {
        return inputSpatialDimensions.clone();
    }

    public long[] getKernelSpatialDimensions() {
        return kernelSpatialDimensions.clone();
    }

    public long[] getOutputSpatialDimensions() {
        return outputSpatialDimensions.clone();
    }

    /**
     * Print the layout part of this attribute, without the dialect prefix.
     *
     * @return The compact layout string.
     */
    public String printLayout() {
        return printDims(inputSpatialDimensions, inputBatchDimension, 'b', inputFeatureDimension, 'f')
                + "x" + printDims(kernelSpatialDimensions, kernelInputFeatureDimension, 'i', kernelOutputFeatureDimension, 'o')
                + "->" + printDims(outputSpatialDimensions, outputBatchDimension, 'b', outputFeatureDimension, 'f');
    }

    private static String printDims(long[] spatial, long firstDim, char firstName, long secondDim, char secondName) {
        int numDims = 0;
        boolean outOfRange = false;
        long[] claimed = new long[spatial.length + 2];
        claimed[0] = firstDim;
        claimed[1] = secondDim;
        System.arraycopy(spatial, 0, claimed, 2, spatial.length);
        for (long dim : claimed) {
            if (dim >= MAX_PRINTED_RANK) {
                outOfRange = true;
            } else if (dim >= 0) {
                numDims = Math.max(numDims, (int) dim + 1);
            }
        }
        // dimensions out of range claim no slot, and leave a single trailing '?'
        String[] slots = new String[outOfRange ? numDims + 1 : numDims];
        Arrays.fill(slots, "?");
        if (inRange(firstDim)) slots[(int) firstDim] = String.valueOf(firstName);
        if (inRange(secondDim)) slots[(int) secondDim] = String.valueOf(secondName);
        for (int i = 0; i < spatial.length; i++) {
            if (inRange(spatial[i])) slots[(int) spatial[i]] = Integer.toString(i);
        }
        return "[" + String.join(", ", slots) + "]";
    }

    private static boolean inRange(long dim) {
        return dim >= 0 && dim < MAX_PRINTED_RANK;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ConvDimensionNumbersAttr)) return false;
        ConvDimensionNumbersAttr that = (ConvDimensionNumbersAttr) o;
        return dialect == that.dialect
                && inputBatchDimension == that.inputBatchDimension
                && inputFeatureDimension == that.inputFeatureDimension
                && kernelInputFeatureDimension == that.kernelInputFeatureDimension
                && kernelOutputFeatureDimension == that.kernelOutputFeatureDimension
                && outputBatchDimension == that.outputBatchDimension
                && outputFeatureDimension == that.outputFeatureDimension
                && Arrays.equals(inputSpatialDimensions, that.inputSpatialDimensions)
                && Arrays.equals(kernelSpatialDimensions, that.kernelSpatialDimensions)
                && Arrays.equals(outputSpatialDimensions, that.outputSpatialDimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialect,
                inputBatchDimension, inputFeatureDimension,
                kernelInputFeatureDimension, kernelOutputFeatureDimension,
                outputBatchDimension, outputFeatureDimension,
                Arrays.hashCode(inputSpatialDimensions),
                Arrays.hashCode(kernelSpatialDimensions),
                Arrays.hashCode(outputSpatialDimensions));
    }

    @Override
    public String toString() {
        return "#" + dialect + ".conv<" + printLayout() + ">";
    }
}
