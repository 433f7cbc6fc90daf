package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ext.Ext;
import io.github.eutro.hlo2shlo.core.ext.ExtHolder;
import io.github.eutro.hlo2shlo.core.ext.TrackedList;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A block of operations, taking arguments, the last of which is a terminator.
 */
public final class Block extends ExtHolder {
    private final List<Value> arguments = new ArrayList<>();
    private final List<Operation> operations = new TrackedList<Operation>(new ArrayList<>()) {
        @Override
        protected void onAdded(Operation elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, Block.this);
        }

        @Override
        protected void onRemoved(Operation elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    public Value addArgument(Type type) {
        Value arg = new Value(type);
        arg.attachExt(CommonExts.OWNING_BLOCK, this);
        arguments.add(arg);
        return arg;
    }

    public List<Value> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public List<Type> getArgumentTypes() {
        List<Type> types = new ArrayList<>(arguments.size());
        for (Value argument : arguments) {
            types.add(argument.getType());
        }
        return types;
    }

    /**
     * Get the operations in this block. The list can be modified, and keeps
     * the {@link CommonExts#OWNING_BLOCK} of its elements up to date.
     *
     * @return The operations.
     */
    public List<Operation> getOperations() {
        return operations;
    }

    /**
     * Get the terminator of this block.
     *
     * @return The last operation, or null if the block is empty or does not end in a terminator.
     */
    public @Nullable Operation getTerminator() {
        if (operations.isEmpty()) return null;
        Operation last = operations.get(operations.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public @Nullable Region getParent() {
        return owner;
    }

    public @Nullable Operation getParentOp() {
        return owner == null ? null : owner.getParentOp();
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    // exts
    private Region owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
