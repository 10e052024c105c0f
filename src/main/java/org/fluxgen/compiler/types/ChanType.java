package org.fluxgen.compiler.types;

/**
 * Channel of {@code elem}.
 *
 * @param direction The permitted operations.
 * @param elem      The element type.
 */
public record ChanType(Direction direction, Type elem) implements Type {

    /**
     * Permitted channel operations.
     */
    public enum Direction {
        SEND_RECV,
        SEND_ONLY,
        RECV_ONLY
    }
}
