package org.safearith.compiler.ir;

import org.safearith.runtime.model.IntegerType;

import java.util.List;
import java.util.Objects;

/**
 * A parsed format program: the type of the left-hand side followed by the steps applied to it from left to right.
 * Immutable once built.
 *
 * @param source The format text the program was compiled from.
 * @param leadingType The accumulator type and the type of the seed operand.
 * @param steps The steps, never empty.
 */
public record FormatProgram(String source, IntegerType leadingType, List<FormatStep> steps) {

    public FormatProgram {
        Objects.requireNonNull(leadingType, "leadingType");
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A format program needs at least one step.");
        }
    }

    /**
     * @return The number of operands an evaluation consumes: the seed plus one per step.
     */
    public int operandCount() {
        return steps.size() + 1;
    }

    /**
     * Returns the declared type of an operand.
     * @param index The operand index; 0 is the seed.
     * @return The type the operand is read as.
     */
    public IntegerType operandType(int index) {
        if (index == 0) {
            return leadingType;
        }
        return steps.get(index - 1).operandType();
    }
}
