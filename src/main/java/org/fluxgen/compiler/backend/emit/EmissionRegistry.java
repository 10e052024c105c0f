package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.backend.emit.features.AppendRule;
import org.fluxgen.compiler.backend.emit.features.BasicLiteralRule;
import org.fluxgen.compiler.backend.emit.features.BranchRule;
import org.fluxgen.compiler.backend.emit.features.CallRule;
import org.fluxgen.compiler.backend.emit.features.CompositeLiteralRule;
import org.fluxgen.compiler.backend.emit.features.ConvertRule;
import org.fluxgen.compiler.backend.emit.features.DeleteRule;
import org.fluxgen.compiler.backend.emit.features.FuncLiteralRule;
import org.fluxgen.compiler.backend.emit.features.IfRule;
import org.fluxgen.compiler.backend.emit.features.IndexRule;
import org.fluxgen.compiler.backend.emit.features.LenRule;
import org.fluxgen.compiler.backend.emit.features.LoopRule;
import org.fluxgen.compiler.backend.emit.features.MakeRule;
import org.fluxgen.compiler.backend.emit.features.OperatorRule;
import org.fluxgen.compiler.backend.emit.features.PortsRule;
import org.fluxgen.compiler.backend.emit.features.TypeAssertRule;
import org.fluxgen.compiler.backend.emit.features.ValueRule;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping node kinds to the rules that write them.
 */
public final class EmissionRegistry {

    private final Map<NodeKind, INodeEmissionRule<? extends Node>> rules = new EnumMap<>(NodeKind.class);

    /**
     * Registers the rule for a node kind, replacing any earlier one.
     *
     * @param kind The node kind.
     * @param rule The rule writing nodes of that kind.
     */
    public void register(NodeKind kind, INodeEmissionRule<? extends Node> rule) {
        rules.put(kind, rule);
    }

    /**
     * @return The kinds that have no rule yet.
     */
    public Set<NodeKind> missingKinds() {
        Set<NodeKind> missing = EnumSet.allOf(NodeKind.class);
        missing.removeAll(rules.keySet());
        return missing;
    }

    /**
     * Resolves the rule for a node.
     *
     * @param node The node to emit.
     * @return The rule, typed for the node.
     * @throws IllegalStateException if no rule accepts the node.
     */
    @SuppressWarnings("unchecked")
    public INodeEmissionRule<Node> resolve(Node node) {
        INodeEmissionRule<? extends Node> rule = rules.get(node.kind());
        if (rule == null || !rule.nodeType().isInstance(node)) {
            throw new IllegalStateException("No emission rule for " + node);
        }
        return (INodeEmissionRule<Node>) rule;
    }

    /**
     * Initializes a new emission registry with a rule for every node kind.
     * @return A new registry with default rules.
     */
    public static EmissionRegistry initializeWithDefaults() {
        EmissionRegistry reg = new EmissionRegistry();
        for (NodeKind kind : NodeKind.values()) {
            reg.register(kind, defaultRule(kind));
        }
        return reg;
    }

    private static INodeEmissionRule<? extends Node> defaultRule(NodeKind kind) {
        return switch (kind) {
            case CALL -> new CallRule();
            case INDEX -> new IndexRule();
            case LEN -> new LenRule();
            case MAKE -> new MakeRule();
            case APPEND -> new AppendRule();
            case DELETE -> new DeleteRule();
            case OPERATOR -> new OperatorRule();
            case BASIC_LITERAL -> new BasicLiteralRule();
            case COMPOSITE_LITERAL -> new CompositeLiteralRule();
            case VALUE -> new ValueRule();
            case TYPE_ASSERT -> new TypeAssertRule();
            case CONVERT -> new ConvertRule();
            case FUNC -> new FuncLiteralRule();
            case PORTS -> new PortsRule();
            case IF -> new IfRule();
            case LOOP -> new LoopRule();
            case BRANCH -> new BranchRule();
        };
    }
}
