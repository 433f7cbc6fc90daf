package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ext.Ext;
import io.github.eutro.hlo2shlo.core.ext.ExtHolder;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * An SSA value: either the result of an {@link Operation}, or an argument of a {@link Block}.
 */
public final class Value extends ExtHolder {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    private final int id = ID_COUNTER.getAndIncrement();
    private Type type;

    Value(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Change the type of this value in place.
     * <p>
     * This is only done by type conversion, which makes sure every user can accept the new type.
     *
     * @param type The new type.
     */
    public void setType(Type type) {
        this.type = type;
    }

    /**
     * Get the operation this value is a result of.
     *
     * @return The operation, or null if this is a block argument.
     */
    public @Nullable Operation getDefiningOp() {
        return definingOp;
    }

    /**
     * Get the block this value is defined in, whether as an argument or as a result of one of its operations.
     *
     * @return The block, or null if the value's definition is not in any block.
     */
    public @Nullable Block getParentBlock() {
        return definingOp != null ? definingOp.getBlock() : owningBlock;
    }

    @Override
    public String toString() {
        return "%" + id;
    }

    // exts
    private Operation definingOp = null;
    private Block owningBlock = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.DEFINING_OP) {
            return (T) definingOp;
        } else if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owningBlock;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.DEFINING_OP) {
            definingOp = (Operation) value;
            return;
        } else if (ext == CommonExts.OWNING_BLOCK) {
            owningBlock = (Block) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.DEFINING_OP) {
            definingOp = null;
            return;
        } else if (ext == CommonExts.OWNING_BLOCK) {
            owningBlock = null;
            return;
        }
        super.removeExt(ext);
    }
}
