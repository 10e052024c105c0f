package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.backend.emit.TypeFormatter;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.CompositeLiteralNode;
import org.fluxgen.compiler.types.Types;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code r := T{...}}, or {@code r := &T{...}} for pointers to structs. Only
 * elements whose input carries a value are listed; the rest keep their zero value.
 */
public class CompositeLiteralRule implements INodeEmissionRule<CompositeLiteralNode> {

    @Override
    public Class<CompositeLiteralNode> nodeType() {
        return CompositeLiteralNode.class;
    }

    @Override
    public void emit(CompositeLiteralNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        Types.Indirection ind = Types.indirect(node.type());
        if (!TypeFormatter.isComplete(ind.base())) {
            ctx.omit(node, "literal type is not resolved");
            return;
        }
        List<String> elements = new ArrayList<>();
        List<PortId> ins = node.inputs();
        switch (node.shape()) {
            case STRUCT -> {
                for (PortId in : ins) {
                    String v = ctx.binding(in);
                    if (v != null) {
                        elements.add(ctx.port(in).name() + ": " + v);
                    }
                }
            }
            case LIST -> {
                for (PortId in : ins) {
                    String v = ctx.binding(in);
                    if (v != null) {
                        elements.add(v);
                    }
                }
            }
            case MAP -> {
                for (int i = 0; i + 1 < ins.size(); i += 2) {
                    String k = ctx.binding(ins.get(i));
                    String v = ctx.binding(ins.get(i + 1));
                    if (k != null && v != null) {
                        elements.add(k + ": " + v);
                    }
                }
            }
        }
        String literal = ctx.type(ind.base()) + "{" + String.join(", ", elements) + "}";
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.first() + " := " + (ind.pointer() ? "&" : "") + literal);
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}
