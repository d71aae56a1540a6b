package org.safearith.runtime.isa;

import java.util.Optional;

/**
 * The binary operations supported by the checked arithmetic, with the operator symbol each one
 * is written as in a format program.
 */
public enum OperationKind {
    /** Addition, {@code +}. */
    ADD("+"),
    /** Subtraction, {@code -}. */
    SUB("-"),
    /** Multiplication, {@code *}. */
    MUL("*"),
    /** Truncating division, {@code /}. */
    DIV("/"),
    /** Remainder, {@code %}. */
    MOD("%"),
    /** Left shift, {@code <<}. */
    SHL("<<"),
    /** Right shift, {@code >>}. */
    SHR(">>");

    private final String symbol;

    OperationKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The operator symbol, e.g. {@code "<<"}.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operation by its operator symbol.
     * @param symbol The symbol text.
     * @return The operation, or empty for an unknown symbol.
     */
    public static Optional<OperationKind> fromSymbol(String symbol) {
        for (OperationKind kind : values()) {
            if (kind.symbol.equals(symbol)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
