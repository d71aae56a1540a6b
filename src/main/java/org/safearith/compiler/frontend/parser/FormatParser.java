package org.safearith.compiler.frontend.parser;

import org.safearith.compiler.diagnostics.DiagnosticsEngine;
import org.safearith.compiler.frontend.lexer.Token;
import org.safearith.compiler.frontend.lexer.TokenType;
import org.safearith.compiler.ir.FormatProgram;
import org.safearith.compiler.ir.FormatStep;
import org.safearith.runtime.isa.OperationKind;
import org.safearith.runtime.model.IntegerType;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link FormatProgram} from the tokens of a format text.
 * Grammar: {@code Program := TypeMarker? Step+ ; Step := Operator TypeMarker?}.
 * <p>
 * An operand without a marker takes the sticky default, which is the leading type. A marker on one step
 * does not carry over to the next.
 */
public class FormatParser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final IntegerType defaultType;
    private final String source;
    private int current = 0;

    /**
     * Constructs a new parser.
     * @param tokens The tokens to parse, terminated by {@link TokenType#END_OF_FORMAT}.
     * @param diagnostics The engine for reporting errors.
     * @param defaultType The leading type used when the program does not start with a marker.
     * @param source The original format text, kept on the resulting program.
     */
    public FormatParser(List<Token> tokens, DiagnosticsEngine diagnostics, IntegerType defaultType, String source) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.defaultType = defaultType;
        this.source = source;
    }

    /**
     * Parses the token stream.
     * @return The program, or {@code null} if errors were reported.
     */
    public FormatProgram parse() {
        IntegerType leadingType = defaultType;
        if (check(TokenType.TYPE_MARKER)) {
            leadingType = (IntegerType) advance().value();
        }

        List<FormatStep> steps = new ArrayList<>();
        IntegerType stickyType = leadingType;
        while (!isAtEnd()) {
            Token operator = peek();
            if (operator.type() != TokenType.OPERATOR) {
                diagnostics.reportError("Expected an operator but found '" + operator.text() + "'", operator.column());
                advance();
                continue;
            }
            advance();
            IntegerType operandType = stickyType;
            boolean explicit = false;
            if (check(TokenType.TYPE_MARKER)) {
                operandType = (IntegerType) advance().value();
                explicit = true;
            }
            steps.add(new FormatStep((OperationKind) operator.value(), operandType, explicit, operator.column()));
            stickyType = leadingType;
        }

        if (steps.isEmpty()) {
            diagnostics.reportError("Format program contains no operation", peek().column());
        }
        if (diagnostics.hasErrors()) {
            return null;
        }
        return new FormatProgram(source, leadingType, steps);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FORMAT;
    }

    private Token peek() {
        return tokens.get(current);
    }
}
