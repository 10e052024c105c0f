package org.fluxgen.compiler.graph;

/**
 * Stable handle of a block inside a {@link Graph}. Handles are never reused.
 */
public record BlockId(int value) implements Comparable<BlockId> {

    @Override
    public int compareTo(BlockId o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "b" + value;
    }
}
