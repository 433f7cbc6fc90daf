package io.github.eutro.hlo2shlo.core.ext;

import io.github.eutro.hlo2shlo.core.ir.*;

/**
 * Exts used by the IR itself, and by passes over it.
 * <p>
 * The ownership exts are stored in fields of the IR classes, and are maintained
 * by the lists that own them; they should not normally be attached by hand.
 */
public class CommonExts {
    public static final Ext<Program> OWNING_PROGRAM = Ext.create(Program.class, "OWNING_PROGRAM");
    public static final Ext<Procedure> OWNING_PROCEDURE = Ext.create(Procedure.class, "OWNING_PROCEDURE");
    public static final Ext<Operation> OWNING_OPERATION = Ext.create(Operation.class, "OWNING_OPERATION");
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");

    /**
     * The operation a result value is defined by. Block arguments have
     * {@link #OWNING_BLOCK} instead.
     */
    public static final Ext<Operation> DEFINING_OP = Ext.create(Operation.class, "DEFINING_OP");

    /**
     * Attached to op keys which end a block.
     */
    public static final Ext<Boolean> IS_TERMINATOR = Ext.create(Boolean.class, "IS_TERMINATOR");

    /**
     * Attached to op keys which always have a fixed number of regions.
     */
    public static final Ext<Integer> REGION_COUNT = Ext.create(Integer.class, "REGION_COUNT");

    /**
     * Attached to op keys which may have any number of regions.
     */
    public static final Ext<Boolean> VARIADIC_REGIONS = Ext.create(Boolean.class, "VARIADIC_REGIONS");

    public static <T extends ExtContainer> T markTerminator(T t) {
        t.attachExt(IS_TERMINATOR, true);
        return t;
    }
}
