package org.fluxgen.compiler.graph;

/**
 * Stable handle of a port inside a {@link Graph}. Handles are never reused.
 */
public record PortId(int value) implements Comparable<PortId> {

    @Override
    public int compareTo(PortId o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "p" + value;
    }
}
