package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.attrs.EnumAttr;
import io.github.eutro.hlo2shlo.core.attrs.MhloEnums;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;

/**
 * Names of attributes that legalization treats specially.
 */
public final class HloAttrNames {
    private HloAttrNames() {
    }

    public static final String API_VERSION = "api_version";
    public static final String CUSTOM_CALL_SCHEDULE = "custom_call_schedule";
    public static final String DIMENSION_NUMBERS = "dimension_numbers";
    public static final String PRECISION_CONFIG = "precision_config";

    // custom call encoding
    public static final String CALL_TARGET_NAME = "call_target_name";
    public static final String ATTRIBUTES = "mhlo.attributes";
    public static final String CALLED_COMPUTATIONS = "called_computations";
    public static final String VERSION = "mhlo.version";

    /**
     * Check whether an attribute is a {@code custom_call_schedule} of {@code NONE} on a custom call.
     * These are private to XLA, but mean nothing, so they are dropped rather than translated.
     *
     * @param key   The kind of operation.
     * @param name  The name of the attribute.
     * @param value The attribute.
     * @return Whether the attribute should be dropped.
     */
    static boolean isNoOpSchedule(OpKey key, String name, Attribute value) {
        return key == HloOps.CUSTOM_CALL
                && name.equals(CUSTOM_CALL_SCHEDULE)
                && EnumAttr.valueOf(value, MhloEnums.CUSTOM_CALL_SCHEDULE) == MhloEnums.CustomCallSchedule.NONE;
    }
}
