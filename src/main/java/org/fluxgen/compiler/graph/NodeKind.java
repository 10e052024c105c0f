package org.fluxgen.compiler.graph;

/**
 * The closed set of node variants. Switches over this enum are exhaustive, so a new
 * variant fails to compile until every consumer handles it.
 */
public enum NodeKind {
    CALL,
    INDEX,
    LEN,
    MAKE,
    APPEND,
    DELETE,
    OPERATOR,
    BASIC_LITERAL,
    COMPOSITE_LITERAL,
    VALUE,
    TYPE_ASSERT,
    CONVERT,
    FUNC,
    PORTS,
    IF,
    LOOP,
    BRANCH;

    /**
     * @return {@code true} if nodes of this kind carry a sequence-in/sequence-out pair.
     */
    public boolean hasSequencePorts() {
        return switch (this) {
            case CALL, INDEX, LEN, APPEND, DELETE, VALUE, IF, LOOP, BRANCH -> true;
            case MAKE, OPERATOR, BASIC_LITERAL, COMPOSITE_LITERAL, TYPE_ASSERT, CONVERT, FUNC, PORTS -> false;
        };
    }
}
