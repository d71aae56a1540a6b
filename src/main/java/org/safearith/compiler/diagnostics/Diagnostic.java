package org.safearith.compiler.diagnostics;

/**
 * A single compilation error in a format program.
 *
 * @param message The error message.
 * @param column The 1-based column in the format text where the error occurred.
 */
public record Diagnostic(String message, int column) {

    @Override
    public String toString() {
        return String.format("[ERROR] column %d: %s", column, message);
    }
}
