package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;

/**
 * A literal constant. Its text is the raw value; quoting is added when emitted.
 */
public final class BasicLiteralNode extends Node {

    /**
     * Literal kinds with their default types.
     */
    public enum Kind {
        INT(Types.INT),
        FLOAT(Types.FLOAT64),
        IMAG(Types.COMPLEX128),
        CHAR(Types.RUNE),
        STRING(Types.STRING);

        private final Type defaultType;

        Kind(Type defaultType) {
            this.defaultType = defaultType;
        }

        public Type defaultType() {
            return defaultType;
        }
    }

    private final Kind literalKind;
    private final String text;
    private PortId result;

    public BasicLiteralNode(Kind kind, String text) {
        if (kind == Kind.CHAR && (text == null || text.isEmpty())) {
            throw new IllegalArgumentException("A character literal needs one character");
        }
        this.literalKind = kind;
        this.text = text == null ? "" : text;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BASIC_LITERAL;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        result = ctx.output("", literalKind.defaultType());
    }

    public Kind literalKind() {
        return literalKind;
    }

    public String text() {
        return text;
    }

    public PortId result() {
        return result;
    }
}
