package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The enumerated attributes of MHLO.
 */
public final class MhloEnums {
    private MhloEnums() {
    }

    public enum ComparisonDirection {EQ, NE, GE, GT, LE, LT}

    public enum ComparisonType {NOTYPE, FLOAT, TOTALORDER, SIGNED, UNSIGNED}

    public enum FftType {FFT, IFFT, RFFT, IRFFT}

    public enum Precision {DEFAULT, HIGH, HIGHEST, PACKED_NIBBLE}

    public enum RngAlgorithm {DEFAULT, THREE_FRY, PHILOX}

    public enum RngDistribution {UNIFORM, NORMAL}

    public enum Transpose {TRANSPOSE_INVALID, NO_TRANSPOSE, TRANSPOSE, ADJOINT}

    public enum CustomCallSchedule {NONE, LATEST, EARLIEST}

    /**
     * Custom call API versions. These are stored as plain {@link IntegerAttr}s
     * under {@code api_version}, not as enum attributes.
     */
    public enum CustomCallApiVersion {
        API_VERSION_UNSPECIFIED,
        API_VERSION_ORIGINAL,
        API_VERSION_STATUS_RETURNING,
        API_VERSION_STATUS_RETURNING_UNIFIED,
        API_VERSION_TYPED_FFI,
        ;

        public static @Nullable CustomCallApiVersion fromValue(long value) {
            CustomCallApiVersion[] values = values();
            if (value < 0 || value >= values.length) return null;
            return values[(int) value];
        }

        public IntegerAttr attr() {
            return IntegerAttr.i32(ordinal());
        }
    }

    public static final EnumKind<ComparisonDirection> COMPARISON_DIRECTION =
            new EnumKind<>(Dialect.MHLO, "comparison_direction", ComparisonDirection.class);
    public static final EnumKind<ComparisonType> COMPARISON_TYPE =
            new EnumKind<>(Dialect.MHLO, "comparison_type", ComparisonType.class);
    public static final EnumKind<FftType> FFT_TYPE =
            new EnumKind<>(Dialect.MHLO, "fft_type", FftType.class);
    public static final EnumKind<Precision> PRECISION =
            new EnumKind<>(Dialect.MHLO, "precision", Precision.class);
    public static final EnumKind<RngAlgorithm> RNG_ALGORITHM =
            new EnumKind<>(Dialect.MHLO, "rng_algorithm", RngAlgorithm.class);
    public static final EnumKind<RngDistribution> RNG_DISTRIBUTION =
            new EnumKind<>(Dialect.MHLO, "rng_distribution", RngDistribution.class);
    public static final EnumKind<Transpose> TRANSPOSE =
            new EnumKind<>(Dialect.MHLO, "transpose", Transpose.class);
    public static final EnumKind<CustomCallSchedule> CUSTOM_CALL_SCHEDULE =
            new EnumKind<>(Dialect.MHLO, "custom_call_schedule", CustomCallSchedule.class);

    public static final List<EnumKind<?>> ALL = Collections.unmodifiableList(Arrays.asList(
            COMPARISON_DIRECTION,
            COMPARISON_TYPE,
            FFT_TYPE,
            PRECISION,
            RNG_ALGORITHM,
            RNG_DISTRIBUTION,
            TRANSPOSE,
            CUSTOM_CALL_SCHEDULE
    ));

    public static EnumAttr<Precision> precision(Precision value) {
        return PRECISION.attr(value);
    }

    /**
     * Build a {@code precision_config} array.
     *
     * @param values The precisions, one per operand.
     * @return The array attribute.
     */
    public static ArrayAttr precisionConfig(Precision... values) {
        EnumAttr<?>[] attrs = new EnumAttr<?>[values.length];
        for (int i = 0; i < values.length; i++) {
            attrs[i] = precision(values[i]);
        }
        return ArrayAttr.of(attrs);
    }
}
