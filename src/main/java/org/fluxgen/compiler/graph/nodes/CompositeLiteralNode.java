package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.StructType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;

/**
 * Constructs a struct, array, slice or map value. A pointer-to-struct type produces
 * {@code &T{...}}.
 * <p>
 * Struct literals have one input per field. Array and slice literals have the given
 * number of element inputs; map literals have key and value input pairs.
 */
public final class CompositeLiteralNode extends Node {

    /**
     * How the inputs map onto literal elements.
     */
    public enum Shape {
        STRUCT,
        LIST,
        MAP
    }

    private final Type type;
    private final int elements;
    private final Shape shape;
    private PortId result;

    /**
     * @param type     The literal type.
     * @param elements Number of elements (or key/value pairs) for list and map literals.
     */
    public CompositeLiteralNode(Type type, int elements) {
        Type u = Types.underlying(Types.indirect(type).base());
        if (u instanceof StructType) {
            shape = Shape.STRUCT;
        } else if (Types.indirect(type).pointer()) {
            throw new IllegalArgumentException("Only struct literals can be taken by address: " + type);
        } else if (u instanceof ArrayType || u instanceof SliceType) {
            shape = Shape.LIST;
        } else if (u instanceof MapType) {
            shape = Shape.MAP;
        } else {
            throw new IllegalArgumentException("Not a composite type: " + type);
        }
        this.type = type;
        this.elements = Math.max(0, elements);
    }

    public CompositeLiteralNode(Type type) {
        this(type, 0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPOSITE_LITERAL;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        Type u = Types.underlying(Types.indirect(type).base());
        switch (shape) {
            case STRUCT -> {
                for (StructType.Field f : ((StructType) u).fields()) {
                    ctx.input(f.name(), f.type());
                }
            }
            case LIST -> {
                Type elem = u instanceof ArrayType a ? a.elem() : ((SliceType) u).elem();
                for (int i = 0; i < elements; i++) {
                    ctx.input("x", elem);
                }
            }
            case MAP -> {
                MapType m = (MapType) u;
                for (int i = 0; i < elements; i++) {
                    ctx.input("k", m.key());
                    ctx.input("v", m.elem());
                }
            }
        }
        result = ctx.output("", type);
    }

    public Type type() {
        return type;
    }

    public Shape shape() {
        return shape;
    }

    public PortId result() {
        return result;
    }
}
