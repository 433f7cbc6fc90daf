package io.github.eutro.hlo2shlo.core.ops;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.hlo2shlo.core.ext.CommonExts.markTerminator;

/**
 * MHLO operations which are referred to by name somewhere in the legalization.
 * <p>
 * This is not a complete list of MHLO; any other MHLO operation can still be
 * obtained with {@link OpKey#of(Dialect, String)}.
 */
public class HloOps {
    public static final OpKey RETURN = markTerminator(op("return"));

    // private to XLA
    public static final OpKey ADD_DEPENDENCY = op("add_dependency");
    public static final OpKey ASYNC_START = op("async_start");
    public static final OpKey ASYNC_UPDATE = op("async_update");
    public static final OpKey ASYNC_DONE = op("async_done");
    public static final OpKey BITCAST = op("bitcast");
    public static final OpKey COPY = op("copy");
    public static final OpKey DOMAIN = op("domain");
    public static final OpKey FUSION = op("fusion");
    public static final OpKey STOCHASTIC_CONVERT = op("stochastic_convert");
    public static final OpKey XLA_RNG_GET_AND_UPDATE_STATE = op("xla.rng_get_and_update_state");

    /**
     * Operations which are internal to XLA, and never leave MHLO.
     */
    public static final List<OpKey> PRIVATE_OPS = Collections.unmodifiableList(Arrays.asList(
            ADD_DEPENDENCY,
            ASYNC_START,
            ASYNC_UPDATE,
            ASYNC_DONE,
            BITCAST,
            COPY,
            DOMAIN,
            FUSION,
            STOCHASTIC_CONVERT,
            XLA_RNG_GET_AND_UPDATE_STATE
    ));

    // no StableHLO counterpart
    public static final OpKey TAN = op("tan");
    public static final OpKey TOPK = op("topk");

    public static final OpKey ADD = op("add");
    public static final OpKey ALL_REDUCE = op("all_reduce");
    public static final OpKey ALL_TO_ALL = op("all_to_all");
    public static final OpKey BROADCAST = op("broadcast");
    public static final OpKey CASE = op("case");
    public static final OpKey COMPARE = op("compare");
    public static final OpKey CONSTANT = op("constant");
    public static final OpKey CONVOLUTION = op("convolution");
    public static final OpKey CUSTOM_CALL = op("custom_call");
    public static final OpKey DOT = op("dot");
    public static final OpKey DOT_GENERAL = op("dot_general");
    public static final OpKey DYNAMIC_SLICE = op("dynamic_slice");
    public static final OpKey FFT = op("fft");
    public static final OpKey GATHER = op("gather");
    public static final OpKey IF = op("if");
    public static final OpKey MULTIPLY = op("multiply");
    public static final OpKey PAD = op("pad");
    public static final OpKey REDUCE = op("reduce");
    public static final OpKey REVERSE = op("reverse");
    public static final OpKey SCATTER = op("scatter");
    public static final OpKey SLICE = op("slice");
    public static final OpKey TRANSPOSE = op("transpose");
    public static final OpKey WHILE = op("while");

    private static OpKey op(String mnemonic) {
        return OpKey.of(Dialect.MHLO, mnemonic);
    }
}
