package org.safearith.compiler.api;

import org.safearith.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a format text is not a valid program.
 * <p>
 * It is part of the public API and carries every diagnostic the compilation reported.
 */
public class FormatCompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new exception with the specified detail message and diagnostics.
     * @param message The detail message.
     * @param diagnostics The diagnostics reported during compilation.
     */
    public FormatCompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics reported during compilation.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
