/**
 * A small in-memory IR, modelled on MLIR.
 * <p>
 * A {@link io.github.eutro.hlo2shlo.core.ir.Program} is a list of
 * {@link io.github.eutro.hlo2shlo.core.ir.Procedure}s, each with a body
 * {@link io.github.eutro.hlo2shlo.core.ir.Region}. A region is a list of
 * {@link io.github.eutro.hlo2shlo.core.ir.Block}s, which hold
 * {@link io.github.eutro.hlo2shlo.core.ir.Operation}s, which may themselves own regions.
 * <p>
 * Ownership is tracked with {@link io.github.eutro.hlo2shlo.core.ext.CommonExts exts},
 * which the owning lists keep up to date, so moving an object is just removing it from one list
 * and adding it to another.
 */
package io.github.eutro.hlo2shlo.core.ir;
