package org.safearith.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link FormatLexer} can recognize.
 */
public enum TokenType {
    /** A type marker such as {@code u32} or {@code s8}. */
    TYPE_MARKER,
    /** An operator: {@code + - * / % << >>}. */
    OPERATOR,
    /** Represents the end of the format text. */
    END_OF_FORMAT
}
