package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ext.Ext;
import io.github.eutro.hlo2shlo.core.ext.ExtHolder;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A named callable in a {@link Program}, with a signature and a body region.
 */
public final class Procedure extends ExtHolder {
    private String name;
    private FunctionType type;
    private final Region body = new Region();

    /**
     * Construct a procedure with an empty body.
     *
     * @param name The name it should be registered under. This may change when it is
     *             {@link SymbolTable#insert(Procedure) inserted} into a program.
     * @param type The signature.
     */
    public Procedure(String name, FunctionType type) {
        this.name = name;
        this.type = type;
        body.attachExt(CommonExts.OWNING_PROCEDURE, this);
    }

    /**
     * Construct a procedure whose body has a single entry block, with arguments matching the signature.
     *
     * @param name The name.
     * @param type The signature.
     * @return The procedure.
     */
    public static Procedure withEntryBlock(String name, FunctionType type) {
        Procedure procedure = new Procedure(name, type);
        Block entry = procedure.body.addBlock();
        for (Type input : type.inputs) {
            entry.addArgument(input);
        }
        return procedure;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public FunctionType getType() {
        return type;
    }

    public void setType(FunctionType type) {
        this.type = type;
    }

    public Region getBody() {
        return body;
    }

    public Block getEntryBlock() {
        return body.front();
    }

    public @Nullable Program getProgram() {
        return owner;
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    // exts
    private Program owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_PROGRAM) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_PROGRAM) {
            owner = (Program) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_PROGRAM) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
