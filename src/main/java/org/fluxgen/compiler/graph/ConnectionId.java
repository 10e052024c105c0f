package org.fluxgen.compiler.graph;

/**
 * Stable handle of a connection inside a {@link Graph}. Handles are never reused.
 */
public record ConnectionId(int value) implements Comparable<ConnectionId> {

    @Override
    public int compareTo(ConnectionId o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "c" + value;
    }
}
