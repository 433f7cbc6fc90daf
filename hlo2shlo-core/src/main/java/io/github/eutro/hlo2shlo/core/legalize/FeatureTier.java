package io.github.eutro.hlo2shlo.core.legalize;

import java.util.Objects;

/**
 * How well StableHLO supports an MHLO operation.
 */
public final class FeatureTier {
    public enum Kind {
        /**
         * Uses features private to XLA. Never legalized.
         */
        PRIVATE,
        /**
         * Uses features that may be proposed to StableHLO. Encoded as a custom call,
         * if experimental features are allowed.
         */
        EXPERIMENTAL,
        /**
         * Uses public features not yet in StableHLO. Always encoded as a custom call, with a version.
         */
        PUBLIC,
        /**
         * Has a StableHLO counterpart that it is translated to directly.
         */
        FULLY_SUPPORTED,
        /**
         * Has no StableHLO counterpart, and no features that allow encoding it.
         */
        UNSUPPORTED,
    }

    public static final FeatureTier PRIVATE = new FeatureTier(Kind.PRIVATE, 0);
    public static final FeatureTier EXPERIMENTAL = new FeatureTier(Kind.EXPERIMENTAL, 0);
    public static final FeatureTier FULLY_SUPPORTED = new FeatureTier(Kind.FULLY_SUPPORTED, 0);
    public static final FeatureTier UNSUPPORTED = new FeatureTier(Kind.UNSUPPORTED, 0);

    private final Kind kind;
    private final long version;

    private FeatureTier(Kind kind, long version) {
        this.kind = kind;
        this.version = version;
    }

    /**
     * Get the public tier of a feature introduced in some version of its encoding.
     *
     * @param version The version.
     * @return The tier.
     */
    public static FeatureTier publicSince(long version) {
        return new FeatureTier(Kind.PUBLIC, version);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPublic() {
        return kind == Kind.PUBLIC;
    }

    /**
     * Get the version of a public feature.
     *
     * @return The version.
     * @throws IllegalStateException If this is not the public tier.
     */
    public long getVersion() {
        if (!isPublic()) throw new IllegalStateException(kind + " features have no version");
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureTier)) return false;
        FeatureTier that = (FeatureTier) o;
        return version == that.version && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, version);
    }

    @Override
    public String toString() {
        return isPublic() ? "PUBLIC(" + version + ")" : kind.name();
    }
}
