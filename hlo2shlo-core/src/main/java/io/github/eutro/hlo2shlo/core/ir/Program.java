package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ext.ExtHolder;
import io.github.eutro.hlo2shlo.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A whole program: an ordered list of procedures, and the symbol table they are registered in.
 */
public final class Program extends ExtHolder {
    private final SymbolTable symbolTable = new SymbolTable(this);
    private final List<Procedure> procedures = new TrackedList<Procedure>(new ArrayList<>()) {
        @Override
        protected void onAdded(Procedure elt) {
            symbolTable.register(elt);
            elt.attachExt(CommonExts.OWNING_PROGRAM, Program.this);
        }

        @Override
        protected void onRemoved(Procedure elt) {
            symbolTable.unregister(elt);
            elt.removeExt(CommonExts.OWNING_PROGRAM);
        }
    };

    /**
     * Get the procedures of this program.
     * <p>
     * Adding a procedure whose name is taken throws; use {@link SymbolTable#insert(Procedure)}
     * to add one under a unique name instead.
     *
     * @return The procedures.
     */
    public List<Procedure> getProcedures() {
        return procedures;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public @Nullable Procedure lookup(String name) {
        return symbolTable.lookup(name);
    }

    /**
     * Visit every operation in every procedure of this program, in pre-order.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Procedure procedure : new ArrayList<>(procedures)) {
            procedure.getBody().walk(visitor);
        }
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
