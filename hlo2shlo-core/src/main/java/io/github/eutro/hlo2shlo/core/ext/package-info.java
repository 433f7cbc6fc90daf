/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.hlo2shlo.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * public static final Ext<Integer> VISIT_ORDER = Ext.create(Integer.class, "VISIT_ORDER");
 *
 * op.attachExt(VISIT_ORDER, 3);
 * op.getNullable(VISIT_ORDER); // => 3
 * op.getNullable(CommonExts.OWNING_BLOCK); // => block
 * }</pre>
 * <p>
 * The IR uses exts for its ownership links ({@link io.github.eutro.hlo2shlo.core.ext.CommonExts}),
 * and op keys carry static facts about their kind (terminators, region counts) the same way.
 * Operations {@link io.github.eutro.hlo2shlo.core.ext.DelegatingExtHolder delegate} to their key,
 * so these facts can be queried from an operation directly.
 */
package io.github.eutro.hlo2shlo.core.ext;
