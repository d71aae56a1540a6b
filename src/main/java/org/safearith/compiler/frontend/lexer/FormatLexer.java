package org.safearith.compiler.frontend.lexer;

import org.safearith.compiler.diagnostics.DiagnosticsEngine;
import org.safearith.runtime.isa.OperationKind;
import org.safearith.runtime.model.IntegerType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts the text of a format program into a sequence of tokens.
 * Whitespace separates tokens and is otherwise ignored; it may not split a token such as {@code u32} or {@code <<}.
 */
public class FormatLexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new lexer.
     * @param source The format text.
     * @param diagnostics The engine for reporting errors.
     */
    public FormatLexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire format text.
     * Unrecognized input is reported to the diagnostics engine and skipped.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FORMAT}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FORMAT, "", null, current + 1));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '+', '-', '*', '/', '%' -> addOperator();
            case '<', '>' -> {
                if (peek() == c) {
                    advance();
                    addOperator();
                } else {
                    diagnostics.reportError("Incomplete shift operator '" + c + "'", start + 1);
                }
            }
            case 'u', 's' -> typeMarker();
            case ' ', '\r', '\t', '\n' -> {
                // Ignore whitespace
            }
            default -> diagnostics.reportError("Unexpected character: " + c, start + 1);
        }
    }

    private void typeMarker() {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        Optional<IntegerType> type = IntegerType.fromMarker(text);
        if (type.isPresent()) {
            addToken(TokenType.TYPE_MARKER, type.get());
        } else {
            diagnostics.reportError("Unknown type marker: " + text, start + 1);
        }
    }

    private void addOperator() {
        String text = source.substring(start, current);
        addToken(TokenType.OPERATOR, OperationKind.fromSymbol(text).orElseThrow());
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, start + 1));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
