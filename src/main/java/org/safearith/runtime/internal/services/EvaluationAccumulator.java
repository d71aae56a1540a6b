package org.safearith.runtime.internal.services;

import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;

/**
 * The running value of one format evaluation.
 * It starts empty, is seeded from the first operand and then replaced by the result of every step.
 * Its type never changes: it is the program's leading type throughout.
 */
public final class EvaluationAccumulator {

    private final IntegerType type;
    private TypedValue current;

    /**
     * Creates an empty accumulator.
     * @param type The leading type of the program.
     */
    public EvaluationAccumulator(IntegerType type) {
        this.type = type;
    }

    /**
     * Seeds the accumulator with the first operand.
     * @param seed The first operand; it must already carry the leading type.
     */
    public void seed(TypedValue seed) {
        if (current != null) {
            throw new IllegalStateException("Accumulator is already seeded.");
        }
        this.current = requireType(seed);
    }

    /**
     * Replaces the running value with the result of a step.
     * @param result The result of the step.
     */
    public void update(TypedValue result) {
        if (current == null) {
            throw new IllegalStateException("Accumulator is not seeded.");
        }
        this.current = requireType(result);
    }

    /**
     * @return The running value.
     */
    public TypedValue current() {
        if (current == null) {
            throw new IllegalStateException("Accumulator is not seeded.");
        }
        return current;
    }

    /**
     * @return The running value reduced to the width of the leading type.
     */
    public TypedValue finish() {
        return TypedValue.truncate(type, current().payload());
    }

    private TypedValue requireType(TypedValue value) {
        if (value.type() != type) {
            throw new IllegalStateException("Accumulator of type " + type.marker() + " cannot hold " + value);
        }
        return value;
    }
}
