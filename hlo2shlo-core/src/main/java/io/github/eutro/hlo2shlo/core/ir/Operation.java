package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.ext.*;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;

/**
 * A single operation: an {@link OpKey opcode}, its operands, typed results, attributes and regions.
 * <p>
 * Operations delegate ext lookups to their key, so facts such as
 * {@link CommonExts#IS_TERMINATOR} can be queried on an operation directly.
 */
public final class Operation extends DelegatingExtHolder {
    public static boolean TRACK_OP_CREATIONS = System.getenv("HLO2SHLO_TRACK_OP_CREATIONS") != null;

    /**
     * Where this operation was constructed, if {@link #TRACK_OP_CREATIONS} is set.
     */
    public final @Nullable Throwable created = TRACK_OP_CREATIONS ? new Throwable("constructed") : null;
    private final OpKey key;
    private final List<Value> operands;
    private final List<Value> results;
    private final SortedMap<String, Attribute> attributes;
    private final List<Region> regions = new TrackedList<Region>(new ArrayList<>()) {
        @Override
        protected void onAdded(Region elt) {
            elt.attachExt(CommonExts.OWNING_OPERATION, Operation.this);
        }

        @Override
        protected void onRemoved(Region elt) {
            elt.removeExt(CommonExts.OWNING_OPERATION);
        }
    };

    /**
     * Construct a detached operation.
     *
     * @param key         The kind of operation.
     * @param resultTypes The types of its results, one fresh {@link Value} is created for each.
     * @param operands    The operands.
     * @param attributes  The attributes.
     * @param numRegions  The number of (initially empty) regions.
     */
    public Operation(OpKey key,
                     List<Type> resultTypes,
                     List<Value> operands,
                     Map<String, ? extends Attribute> attributes,
                     int numRegions) {
        this.key = key;
        this.operands = new ArrayList<>(operands);
        this.attributes = new TreeMap<>(attributes);
        List<Value> results = new ArrayList<>(resultTypes.size());
        for (Type type : resultTypes) {
            Value result = new Value(type);
            result.attachExt(CommonExts.DEFINING_OP, this);
            results.add(result);
        }
        this.results = Collections.unmodifiableList(results);
        for (int i = 0; i < numRegions; i++) {
            regions.add(new Region());
        }
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    public OpKey getKey() {
        return key;
    }

    public String getName() {
        return key.getName();
    }

    /**
     * Get the operands of this operation. The list may be modified to change them.
     *
     * @return The operands.
     */
    public List<Value> getOperands() {
        return operands;
    }

    public int getNumOperands() {
        return operands.size();
    }

    public List<Value> getResults() {
        return results;
    }

    public Value getResult(int index) {
        return results.get(index);
    }

    public List<Type> getResultTypes() {
        List<Type> types = new ArrayList<>(results.size());
        for (Value result : results) {
            types.add(result.getType());
        }
        return types;
    }

    /**
     * Get the attributes of this operation, sorted by name.
     *
     * @return An unmodifiable view of the attributes.
     */
    public SortedMap<String, Attribute> getAttributes() {
        return Collections.unmodifiableSortedMap(attributes);
    }

    public @Nullable Attribute getAttr(String name) {
        return attributes.get(name);
    }

    /**
     * Get the regions of this operation. The number of regions is fixed when the operation is constructed.
     *
     * @return An unmodifiable view of the regions.
     */
    public List<Region> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    public Region getRegion(int index) {
        return regions.get(index);
    }

    public int getNumRegions() {
        return regions.size();
    }

    public boolean isTerminator() {
        return Boolean.TRUE.equals(getNullable(CommonExts.IS_TERMINATOR));
    }

    public @Nullable Block getBlock() {
        return owner;
    }

    /**
     * Get the operation whose region this operation is (transitively) nested in.
     *
     * @return The parent operation, or null if this operation is not nested in another.
     */
    public @Nullable Operation getParentOp() {
        return owner == null ? null : owner.getParentOp();
    }

    /**
     * Get the procedure this operation is (transitively) nested in.
     *
     * @return The procedure, or null if this operation is not in one.
     */
    public @Nullable Procedure getParentProcedure() {
        Operation op = this;
        while (op.owner != null) {
            Region region = op.owner.getParent();
            if (region == null) return null;
            Procedure procedure = region.getParentProcedure();
            if (procedure != null) return procedure;
            op = region.getParentOp();
            if (op == null) return null;
        }
        return null;
    }

    public @Nullable Program getParentProgram() {
        Procedure procedure = getParentProcedure();
        return procedure == null ? null : procedure.getProgram();
    }

    /**
     * Remove this operation from its block, if it is in one.
     * <p>
     * The caller is responsible for making sure none of its results are still used.
     */
    public void erase() {
        if (owner != null) {
            owner.getOperations().remove(this);
        }
    }

    /**
     * Visit this operation, then every operation nested in its regions, in pre-order.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<Operation> visitor) {
        visitor.accept(this);
        for (Region region : regions) {
            region.walk(visitor);
        }
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    // exts
    private Block owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (Block) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
