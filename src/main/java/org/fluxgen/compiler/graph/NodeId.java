package org.fluxgen.compiler.graph;

/**
 * Stable handle of a node inside a {@link Graph}. Handles are never reused.
 */
public record NodeId(int value) implements Comparable<NodeId> {

    @Override
    public int compareTo(NodeId o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "n" + value;
    }
}
