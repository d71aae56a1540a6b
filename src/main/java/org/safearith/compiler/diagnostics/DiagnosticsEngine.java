package org.safearith.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors found while a format program is compiled.
 * <p>
 * The lexer and parser keep going after an error, so one compilation reports every problem in the text.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param column  The 1-based column of the error.
     */
    public void reportError(String message, int column) {
        diagnostics.add(new Diagnostic(message, column));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return An unmodifiable view of the reported errors, in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All errors, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
