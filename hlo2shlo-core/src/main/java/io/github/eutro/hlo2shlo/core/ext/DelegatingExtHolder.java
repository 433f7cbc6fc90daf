package io.github.eutro.hlo2shlo.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that additionally delegates to another
 * {@link ExtContainer} if it can't find a given ext in itself.
 * <p>
 * Operations use this to see the exts of their {@link io.github.eutro.hlo2shlo.core.ops.OpKey}.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the {@link ExtContainer} to delegate to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
