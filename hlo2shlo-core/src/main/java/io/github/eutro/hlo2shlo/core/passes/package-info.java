/**
 * Passes over programs, and the {@link io.github.eutro.hlo2shlo.core.passes.ConversionDriver} that runs
 * conversion patterns.
 */
package io.github.eutro.hlo2shlo.core.passes;
