package io.github.eutro.hlo2shlo.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * The names of the procedures in a {@link Program}.
 * <p>
 * The table is kept in sync with {@link Program#getProcedures()}. Methods are synchronized,
 * so that checking a name is free and taking it happen as one step.
 */
public final class SymbolTable {
    private final Program program;
    private final Map<String, Procedure> symbols = new HashMap<>();
    private int uniquingCounter = 0;

    SymbolTable(Program program) {
        this.program = program;
    }

    /**
     * Add a procedure to the program, renaming it if its name is already taken.
     * <p>
     * Taken names are made unique by appending {@code _0}, {@code _1}, and so on.
     *
     * @param procedure The procedure, which must not already be in a program.
     * @return The name the procedure was inserted under.
     */
    public synchronized String insert(Procedure procedure) {
        if (procedure.getProgram() != null) {
            throw new IllegalStateException("Procedure @" + procedure.getName() + " is already in a program");
        }
        String name = procedure.getName();
        if (symbols.containsKey(name)) {
            String candidate;
            do {
                candidate = name + "_" + uniquingCounter++;
            } while (symbols.containsKey(candidate));
            procedure.setName(candidate);
        }
        program.getProcedures().add(procedure);
        return procedure.getName();
    }

    /**
     * Remove a procedure from the program.
     *
     * @param procedure The procedure.
     */
    public synchronized void erase(Procedure procedure) {
        program.getProcedures().remove(procedure);
    }

    /**
     * Get the next suffix {@link #insert(Procedure)} will try when renaming.
     *
     * @return The counter.
     */
    public synchronized int getUniquingCounter() {
        return uniquingCounter;
    }

    /**
     * Reset the renaming counter, when undoing insertions.
     *
     * @param uniquingCounter The value of {@link #getUniquingCounter()} to restore.
     */
    public synchronized void setUniquingCounter(int uniquingCounter) {
        this.uniquingCounter = uniquingCounter;
    }

    public synchronized @Nullable Procedure lookup(String name) {
        return symbols.get(name);
    }

    public synchronized boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public synchronized int size() {
        return symbols.size();
    }

    synchronized void register(Procedure procedure) {
        Procedure existing = symbols.putIfAbsent(procedure.getName(), procedure);
        if (existing != null && existing != procedure) {
            throw new IllegalStateException("Duplicate symbol @" + procedure.getName());
        }
    }

    synchronized void unregister(Procedure procedure) {
        symbols.remove(procedure.getName(), procedure);
    }
}
