package org.fluxgen.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one emission session.
 * <p>
 * This decouples reporting from the emitter, which keeps producing text for partial graphs.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param definition The definition being generated.
     * @param nodeId     The node concerned, or -1.
     */
    public void reportError(String message, String definition, int nodeId) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, definition, nodeId));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param definition The definition being generated.
     * @param nodeId     The node concerned, or -1.
     */
    public void reportWarning(String message, String definition, int nodeId) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, definition, nodeId));
    }

    public void reportInfo(String message, String definition, int nodeId) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, definition, nodeId));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
