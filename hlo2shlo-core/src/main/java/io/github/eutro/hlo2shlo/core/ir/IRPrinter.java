package io.github.eutro.hlo2shlo.core.ir;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.types.Type;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Prints the IR in a form close to MLIR's generic operation syntax, for debugging and tests.
 */
public class IRPrinter {
    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;

    public static String print(Program program) {
        IRPrinter printer = new IRPrinter();
        printer.printProgram(program);
        return printer.sb.toString();
    }

    public static String print(Procedure procedure) {
        IRPrinter printer = new IRPrinter();
        printer.printProcedure(procedure);
        return printer.sb.toString();
    }

    public static String print(Operation op) {
        IRPrinter printer = new IRPrinter();
        printer.printOp(op);
        return printer.sb.toString();
    }

    public static String print(Block block) {
        IRPrinter printer = new IRPrinter();
        printer.printBlock(block);
        return printer.sb.toString();
    }

    private void newline() {
        sb.append('\n');
        for (int i = 0; i < depth; i++) sb.append(INDENT);
    }

    private void printProgram(Program program) {
        sb.append("module {");
        depth++;
        for (Procedure procedure : program.getProcedures()) {
            newline();
            printProcedure(procedure);
        }
        depth--;
        newline();
        sb.append('}');
    }

    private void printProcedure(Procedure procedure) {
        sb.append("func.func @").append(procedure.getName());
        List<Type> results = procedure.getType().results;
        if (procedure.getBody().isEmpty()) {
            joined(procedure.getType().inputs, "(", ")");
        } else {
            sb.append('(');
            argList(procedure.getEntryBlock().getArguments());
            sb.append(')');
        }
        sb.append(" -> ");
        joined(results, "(", ")");
        if (!procedure.getBody().isEmpty()) {
            sb.append(' ');
            printRegion(procedure.getBody());
        }
    }

    private void printRegion(Region region) {
        sb.append('{');
        depth++;
        for (Block block : region.getBlocks()) {
            newline();
            printBlock(block);
        }
        depth--;
        newline();
        sb.append('}');
    }

    private void printBlock(Block block) {
        sb.append("^bb(");
        argList(block.getArguments());
        sb.append("):");
        depth++;
        for (Operation op : block.getOperations()) {
            newline();
            printOp(op);
        }
        depth--;
    }

    private void argList(List<Value> args) {
        Iterator<Value> it = args.iterator();
        while (it.hasNext()) {
            Value arg = it.next();
            sb.append(arg).append(": ").append(arg.getType());
            if (it.hasNext()) sb.append(", ");
        }
    }

    private void printOp(Operation op) {
        if (!op.getResults().isEmpty()) {
            joined(op.getResults(), "", "");
            sb.append(" = ");
        }
        sb.append('"').append(op.getName()).append('"');
        joined(op.getOperands(), "(", ")");
        if (op.getNumRegions() != 0) {
            sb.append(" (");
            Iterator<Region> it = op.getRegions().iterator();
            while (it.hasNext()) {
                printRegion(it.next());
                if (it.hasNext()) sb.append(", ");
            }
            sb.append(')');
        }
        if (!op.getAttributes().isEmpty()) {
            sb.append(" {");
            Iterator<Map.Entry<String, Attribute>> it = op.getAttributes().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Attribute> entry = it.next();
                sb.append(entry.getKey()).append(" = ").append(entry.getValue());
                if (it.hasNext()) sb.append(", ");
            }
            sb.append('}');
        }
        sb.append(" : ");
        sb.append('(');
        Iterator<Value> it = op.getOperands().iterator();
        while (it.hasNext()) {
            sb.append(it.next().getType());
            if (it.hasNext()) sb.append(", ");
        }
        sb.append(") -> ");
        joined(op.getResultTypes(), "(", ")");
    }

    private void joined(List<?> xs, String open, String close) {
        sb.append(open);
        Iterator<?> it = xs.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) sb.append(", ");
        }
        sb.append(close);
    }
}
