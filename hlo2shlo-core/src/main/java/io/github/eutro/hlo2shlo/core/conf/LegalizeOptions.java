package io.github.eutro.hlo2shlo.core.conf;

import java.util.Map;

/**
 * Options for legalizing MHLO to StableHLO.
 */
public final class LegalizeOptions {
    /**
     * The environment variable that {@link #fromEnvironment()} reads
     * {@link #allowExperimentalFeatures()} from.
     */
    public static final String ALLOW_EXPERIMENTAL_FEATURES_ENV = "HLO2SHLO_ALLOW_EXPERIMENTAL_FEATURES";

    public static final LegalizeOptions DEFAULT = new LegalizeOptions(false);

    private final boolean allowExperimentalFeatures;

    public LegalizeOptions(boolean allowExperimentalFeatures) {
        this.allowExperimentalFeatures = allowExperimentalFeatures;
    }

    /**
     * Read options from the environment of this process.
     *
     * @return The options.
     * @see #fromEnvironment(Map)
     */
    public static LegalizeOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Read options from an environment.
     * <p>
     * Experimental features are allowed if {@value #ALLOW_EXPERIMENTAL_FEATURES_ENV} is set to
     * anything other than the empty string, {@code false} or {@code 0}.
     *
     * @param env The environment variables.
     * @return The options.
     */
    public static LegalizeOptions fromEnvironment(Map<String, String> env) {
        return new LegalizeOptions(isSet(env.get(ALLOW_EXPERIMENTAL_FEATURES_ENV)));
    }

    private static boolean isSet(String value) {
        return value != null
                && !value.isEmpty()
                && !value.equalsIgnoreCase("false")
                && !value.equals("0");
    }

    /**
     * Whether operations with experimental features, which are not yet in StableHLO,
     * may be encoded as custom calls instead of failing to legalize.
     *
     * @return Whether experimental features are allowed.
     */
    public boolean allowExperimentalFeatures() {
        return allowExperimentalFeatures;
    }

    public LegalizeOptions withAllowExperimentalFeatures(boolean allowExperimentalFeatures) {
        return new LegalizeOptions(allowExperimentalFeatures);
    }

    @Override
    public String toString() {
        return "LegalizeOptions{allowExperimentalFeatures=" + allowExperimentalFeatures + "}";
    }
}
