package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The enumerated attributes of StableHLO.
 * <p>
 * StableHLO has no {@code PACKED_NIBBLE} precision, and no custom call schedules.
 */
public final class StablehloEnums {
    private StablehloEnums() {
    }

    public enum ComparisonDirection {EQ, NE, GE, GT, LE, LT}

    public enum ComparisonType {NOTYPE, FLOAT, TOTALORDER, SIGNED, UNSIGNED}

    public enum FftType {FFT, IFFT, RFFT, IRFFT}

    public enum Precision {DEFAULT, HIGH, HIGHEST}

    public enum RngAlgorithm {DEFAULT, THREE_FRY, PHILOX}

    public enum RngDistribution {UNIFORM, NORMAL}

    public enum Transpose {TRANSPOSE_INVALID, NO_TRANSPOSE, TRANSPOSE, ADJOINT}

    public static final EnumKind<ComparisonDirection> COMPARISON_DIRECTION =
            new EnumKind<>(Dialect.STABLEHLO, "comparison_direction", ComparisonDirection.class);
    public static final EnumKind<ComparisonType> COMPARISON_TYPE =
            new EnumKind<>(Dialect.STABLEHLO, "comparison_type", ComparisonType.class);
    public static final EnumKind<FftType> FFT_TYPE =
            new EnumKind<>(Dialect.STABLEHLO, "fft_type", FftType.class);
    public static final EnumKind<Precision> PRECISION =
            new EnumKind<>(Dialect.STABLEHLO, "precision", Precision.class);
    public static final EnumKind<RngAlgorithm> RNG_ALGORITHM =
            new EnumKind<>(Dialect.STABLEHLO, "rng_algorithm", RngAlgorithm.class);
    public static final EnumKind<RngDistribution> RNG_DISTRIBUTION =
            new EnumKind<>(Dialect.STABLEHLO, "rng_distribution", RngDistribution.class);
    public static final EnumKind<Transpose> TRANSPOSE =
            new EnumKind<>(Dialect.STABLEHLO, "transpose", Transpose.class);

    public static final List<EnumKind<?>> ALL = Collections.unmodifiableList(Arrays.asList(
            COMPARISON_DIRECTION,
            COMPARISON_TYPE,
            FFT_TYPE,
            PRECISION,
            RNG_ALGORITHM,
            RNG_DISTRIBUTION,
            TRANSPOSE
    ));
}
