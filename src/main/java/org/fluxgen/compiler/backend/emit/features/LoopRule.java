package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.LoopNode;
import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;

/**
 * Writes a {@code for} statement in the form matching the input type and binds the
 * connected key and value bindings to fresh names.
 */
public class LoopRule implements INodeEmissionRule<LoopNode> {

    private static final String BLANK = "_";

    @Override
    public Class<LoopNode> nodeType() {
        return LoopNode.class;
    }

    @Override
    public void emit(LoopNode node, EmissionContext ctx) throws CodegenException {
        PortId in = node.input();
        Type t = ctx.port(in).type();
        LoopNode.Form form = ctx.isConnected(in) ? LoopNode.formFor(t) : LoopNode.Form.ENDLESS;
        String x = null;
        if (form != LoopNode.Form.ENDLESS) {
            x = ctx.binding(in);
            if (x == null) {
                ctx.omit(node, "ranged value is not available");
                return;
            }
        }
        PortId keyPort = node.keyBinding();
        PortId valuePort = node.valueBinding();
        String key = ctx.isConnected(keyPort) ? ctx.name(ctx.port(keyPort).name()) : BLANK;
        String value = valuePort != null && ctx.isConnected(valuePort) ? ctx.name("v") : BLANK;

        ctx.indent("for ");
        switch (form) {
            case COUNT -> {
                if (key.equals(BLANK)) {
                    key = ctx.name("i");
                }
                ctx.write(key + " := " + ctx.type(t) + "(0); " + key + " < " + x + "; " + key + "++ {\n");
            }
            case INDEXED_RANGE -> {
                if (!value.equals(BLANK) && key.equals(BLANK)) {
                    key = ctx.name("i");
                }
                ctx.write(key + (key.equals(BLANK) ? " =" : " :=") + " range " + x + " {\n");
                if (!value.equals(BLANK)) {
                    String amp = Types.underlying(t) instanceof ArrayType ? "" : "&";
                    ctx.indent(ctx.indentUnit() + "var " + value + " = " + amp + x + "[" + key + "]\n");
                }
            }
            case KEY_VALUE_RANGE -> {
                ctx.write(key);
                if (!value.equals(BLANK)) {
                    ctx.write(", " + value);
                }
                boolean blank = key.equals(BLANK) && value.equals(BLANK);
                ctx.write((blank ? " =" : " :=") + " range " + x + " {\n");
            }
            case ENDLESS -> {
                if (!key.equals(BLANK)) {
                    ctx.write(key + " := 0;; " + key + "++ ");
                }
                ctx.write("{\n");
            }
        }
        if (!key.equals(BLANK)) {
            ctx.bind(keyPort, key);
        }
        if (!value.equals(BLANK)) {
            ctx.bind(valuePort, value);
        }
        ctx.emitBlock(node.body());
        ctx.indent("}");
        ctx.endStatement(node);
    }
}
