package org.safearith.compiler.frontend.lexer;

/**
 * Represents a single token extracted from a format program by the {@link FormatLexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param value The processed value: an {@link org.safearith.runtime.model.IntegerType} for markers,
 *              an {@link org.safearith.runtime.isa.OperationKind} for operators, {@code null} otherwise.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int column
) {
}
