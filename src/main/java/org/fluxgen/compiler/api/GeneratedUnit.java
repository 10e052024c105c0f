package org.fluxgen.compiler.api;

import org.fluxgen.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * One generated source unit.
 *
 * @param fileName    The deterministic file name derived from the definition.
 * @param source      The complete unit text.
 * @param diagnostics Non-fatal findings of the emission session.
 */
public record GeneratedUnit(String fileName, String source, List<Diagnostic> diagnostics) {

    public GeneratedUnit {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if a block of this unit was skipped.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
