package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ext.Ext;
import io.github.eutro.hlo2shlo.core.ext.ExtHolder;
import io.github.eutro.hlo2shlo.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A list of blocks owned by an {@link Operation}, or the body of a {@link Procedure}.
 * The first block is the entry block.
 */
public final class Region extends ExtHolder {
    private final List<Block> blocks = new TrackedList<Block>(new ArrayList<>()) {
        @Override
        protected void onAdded(Block elt) {
            elt.attachExt(CommonExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(Block elt) {
            elt.removeExt(CommonExts.OWNING_REGION);
        }
    };

    /**
     * Get the blocks in this region. The list can be modified, and keeps
     * the {@link CommonExts#OWNING_REGION} of its elements up to date.
     *
     * @return The blocks.
     */
    public List<Block> getBlocks() {
        return blocks;
    }

    public Block addBlock() {
        Block block = new Block();
        blocks.add(block);
        return block;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public boolean hasOneBlock() {
        return blocks.size() == 1;
    }

    public Block front() {
        return blocks.get(0);
    }

    public @Nullable Operation getParentOp() {
        return owningOp;
    }

    public @Nullable Procedure getParentProcedure() {
        return owningProcedure;
    }

    /**
     * Get the region that the operation owning this region is in.
     *
     * @return The enclosing region, or null if this region is not nested in another.
     */
    public @Nullable Region getParentRegion() {
        if (owningOp == null) return null;
        Block block = owningOp.getBlock();
        return block == null ? null : block.getParent();
    }

    /**
     * Check whether this region is {@code other}, or (transitively) contains it.
     *
     * @param other The other region.
     * @return Whether this region is an ancestor of the other.
     */
    public boolean isAncestor(@Nullable Region other) {
        for (Region r = other; r != null; r = r.getParentRegion()) {
            if (r == this) return true;
        }
        return false;
    }

    /**
     * Visit every operation in this region, and in the regions nested in them, in pre-order.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Block block : blocks) {
            // copy, so the visitor can rewrite the operation it is given
            for (Operation op : new ArrayList<>(block.getOperations())) {
                op.walk(visitor);
            }
        }
    }

    // exts
    private Operation owningOp = null;
    private Procedure owningProcedure = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_OPERATION) {
            return (T) owningOp;
        } else if (ext == CommonExts.OWNING_PROCEDURE) {
            return (T) owningProcedure;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_OPERATION) {
            owningOp = (Operation) value;
            return;
        } else if (ext == CommonExts.OWNING_PROCEDURE) {
            owningProcedure = (Procedure) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_OPERATION) {
            owningOp = null;
            return;
        } else if (ext == CommonExts.OWNING_PROCEDURE) {
            owningProcedure = null;
            return;
        }
        super.removeExt(ext);
    }
}
