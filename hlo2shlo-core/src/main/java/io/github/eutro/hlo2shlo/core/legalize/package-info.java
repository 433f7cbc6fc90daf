/**
 * Legalization of MHLO to StableHLO.
 * <p>
 * Each MHLO operation is {@link io.github.eutro.hlo2shlo.core.legalize.FeatureClassifier classified} by the
 * features it uses. Fully supported operations are
 * {@link io.github.eutro.hlo2shlo.core.legalize.DirectTranslator translated directly}, operations with public
 * (or allowed experimental) features are {@link io.github.eutro.hlo2shlo.core.legalize.FallbackEncoder encoded}
 * as {@code stablehlo.custom_call}s, and the rest are left as they are.
 */
package io.github.eutro.hlo2shlo.core.legalize;
