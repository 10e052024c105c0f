package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A raw control statement passed through verbatim: {@code break}, {@code continue},
 * {@code return}, {@code fallthrough} or {@code goto Label}.
 */
public final class BranchNode extends Node {

    private static final Set<String> PLAIN = Set.of("break", "continue", "return", "fallthrough");
    private static final Pattern GOTO = Pattern.compile("goto [\\p{L}_][\\p{L}\\p{N}_]*");

    private final String text;

    public BranchNode(String text) {
        String t = text == null ? "" : text.trim();
        if (!PLAIN.contains(t) && !GOTO.matcher(t).matches()) {
            throw new IllegalArgumentException("Not a branch statement: '" + text + "'");
        }
        this.text = t;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BRANCH;
    }

    @Override
    protected void assemble(NodeContext ctx) {
    }

    public String text() {
        return text;
    }
}
