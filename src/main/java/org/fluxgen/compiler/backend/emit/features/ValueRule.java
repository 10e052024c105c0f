package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.ValueNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes reads and writes of named values.
 * <ul>
 *   <li>{@code target = v} for writes;</li>
 *   <li>{@code const r = C} for constants;</li>
 *   <li>{@code r := name}, {@code r := x.f}, {@code r := x.M} or {@code r := *x} for
 *   reads, with the address taken when the output is addressable.</li>
 * </ul>
 */
public class ValueRule implements INodeEmissionRule<ValueNode> {

    @Override
    public Class<ValueNode> nodeType() {
        return ValueNode.class;
    }

    @Override
    public void emit(ValueNode node, EmissionContext ctx) {
        if (!node.isSet() && !ctx.hasConnectedOutput(node)) {
            return;
        }
        List<PortId> ins = new ArrayList<>();
        if (node.operand() != null) {
            ins.add(node.operand());
        }
        if (node.isSet()) {
            ins.add(node.value());
        }
        if (!ctx.resolvable(ins)) {
            ctx.omit(node, "operand or value has no known type");
            return;
        }
        String operand = node.operand() == null ? null : ctx.arg(node.operand());
        String name;
        if (node.isDereference()) {
            name = "*" + operand;
        } else if (node.isPlainName()) {
            name = ctx.qualifiedName(node.symbol());
        } else {
            name = operand + "." + node.symbol().name();
        }
        if (node.isSet()) {
            ctx.indent(name + " = " + ctx.arg(node.value()));
            ctx.endStatement(node);
            return;
        }
        EmissionContext.Results results = ctx.results(node);
        if (node.isConstant()) {
            ctx.indent("const " + results.first() + " = " + name);
        } else {
            String amp = ctx.port(node.value()).isAddressable() ? "&" : "";
            ctx.indent(results.first() + " := " + amp + name);
        }
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}
