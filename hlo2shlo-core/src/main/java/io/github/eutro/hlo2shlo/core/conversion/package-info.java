/**
 * The machinery that conversion patterns run against: a {@link io.github.eutro.hlo2shlo.core.conversion.TypeConverter},
 * and a {@link io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter} which makes every change undoable.
 */
package io.github.eutro.hlo2shlo.core.conversion;
