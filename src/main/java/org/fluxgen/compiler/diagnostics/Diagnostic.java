package org.fluxgen.compiler.diagnostics;

/**
 * Represents a single non-fatal finding (error, warning, info)
 * that occurs while generating a source unit.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param definition The qualified name of the definition being generated.
 * @param nodeId The id of the node the finding refers to, or -1.
 */
public record Diagnostic(
        Type type,
        String message,
        String definition,
        int nodeId
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A block could not be generated. */
        ERROR,
        /** A statement was omitted or degraded. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        if (nodeId < 0) {
            return String.format("[%s] %s: %s", type, definition, message);
        }
        return String.format("[%s] %s#%d: %s", type, definition, nodeId, message);
    }
}
