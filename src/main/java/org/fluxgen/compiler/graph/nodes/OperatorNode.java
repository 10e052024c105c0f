package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.ChanType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

import java.util.Set;

/**
 * A unary or binary operator. Comparisons and logical operators yield {@code bool};
 * the others yield the type of their first connected operand.
 */
public final class OperatorNode extends Node {

    private static final Set<String> BINARY = Set.of(
            "+", "-", "*", "/", "%", "&", "|", "^", "<<", ">>", "&^",
            "==", "!=", "<", "<=", ">", ">=", "&&", "||");
    private static final Set<String> UNARY = Set.of("!", "-", "^", "<-");

    private final String operator;
    private final boolean unary;
    private PortId result;

    /**
     * @param operator The operator token.
     * @param unary    Whether the operator takes a single operand.
     */
    public OperatorNode(String operator, boolean unary) {
        if (!(unary ? UNARY : BINARY).contains(operator)) {
            throw new IllegalArgumentException("Unknown " + (unary ? "unary" : "binary") + " operator '" + operator + "'");
        }
        this.operator = operator;
        this.unary = unary;
    }

    /**
     * Creates a binary operator, or the unary {@code !}.
     */
    public OperatorNode(String operator) {
        this(operator, operator.equals("!"));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPERATOR;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        ctx.input("x", WildcardType.INSTANCE);
        if (!unary) {
            ctx.input("y", WildcardType.INSTANCE);
        }
        result = ctx.output("", Types.isBooleanOperator(operator) ? Types.BOOL : WildcardType.INSTANCE);
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        Type first = WildcardType.INSTANCE;
        for (PortId in : inputs()) {
            Type t = d.sourceType(in);
            d.setType(in, t);
            if (Types.isWildcard(first)) {
                first = t;
            }
        }
        if (Types.isBooleanOperator(operator)) {
            d.setType(result, Types.BOOL);
        } else if (operator.equals("<-")) {
            d.setType(result, Types.underlying(first) instanceof ChanType c
                    ? c.elem() : WildcardType.INSTANCE);
        } else if (operator.equals("<<") || operator.equals(">>")) {
            d.setType(result, d.sourceType(inputs().get(0)));
        } else {
            d.setType(result, first);
        }
    }

    public String operator() {
        return operator;
    }

    public boolean isUnary() {
        return unary;
    }

    public PortId result() {
        return result;
    }
}
