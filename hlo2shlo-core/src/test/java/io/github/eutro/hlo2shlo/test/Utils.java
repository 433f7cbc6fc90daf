package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.ir.*;
import io.github.eutro.hlo2shlo.core.ops.FuncOps;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import io.github.eutro.hlo2shlo.core.types.ScalarType;
import io.github.eutro.hlo2shlo.core.types.TensorType;
import io.github.eutro.hlo2shlo.core.types.Type;

import java.util.*;

public class Utils {
    public static final TensorType F32 = new TensorType(ScalarType.F32);
    public static final TensorType F32_8 = new TensorType(ScalarType.F32, 8);
    public static final TensorType F32_2X3 = new TensorType(ScalarType.F32, 2, 3);
    public static final TensorType I32 = new TensorType(ScalarType.I32);

    public static Map<String, Attribute> attrs(Object... namesAndValues) {
        Map<String, Attribute> map = new TreeMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], (Attribute) namesAndValues[i + 1]);
        }
        return map;
    }

    /**
     * Fill a region with a reduction body that adds its two arguments.
     *
     * @param region The region.
     * @param type   The type of the arguments and result.
     * @return The block.
     */
    public static Block addBody(Region region, Type type) {
        Block block = region.addBlock();
        Value x = block.addArgument(type);
        Value y = block.addArgument(type);
        OpBuilder builder = new OpBuilder(block);
        Value sum = builder.createValue(HloOps.ADD, type, x, y);
        builder.createReturn(HloOps.RETURN, sum);
        return block;
    }

    /**
     * A program with a single {@code @main} procedure, built up by tests.
     */
    public static class Fixture {
        public final Program program = new Program();
        public final Procedure main;
        public final OpBuilder builder;

        public Fixture(Type... inputs) {
            main = Procedure.withEntryBlock("main", new FunctionType(Arrays.asList(inputs), Collections.emptyList()));
            program.getProcedures().add(main);
            builder = new OpBuilder(main.getEntryBlock());
        }

        public Value arg(int index) {
            return main.getEntryBlock().getArguments().get(index);
        }

        public Operation op(OpKey key, List<Type> resultTypes, Map<String, Attribute> attrs, int numRegions, Value... operands) {
            return builder.create(key, resultTypes, Arrays.asList(operands), attrs, numRegions);
        }

        public Operation op(OpKey key, Type resultType, Map<String, Attribute> attrs, Value... operands) {
            return op(key, Collections.singletonList(resultType), attrs, 0, operands);
        }

        public Operation ret(Value... values) {
            List<Type> types = new ArrayList<>();
            for (Value value : values) {
                types.add(value.getType());
            }
            main.setType(new FunctionType(main.getType().inputs, types));
            return builder.createReturn(FuncOps.RETURN, values);
        }

        public List<Operation> ops() {
            return main.getEntryBlock().getOperations();
        }

        public ConversionRewriter rewriter() {
            return new ConversionRewriter(program);
        }
    }
}
