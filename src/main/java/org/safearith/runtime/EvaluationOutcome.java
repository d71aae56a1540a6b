package org.safearith.runtime;

import org.safearith.runtime.api.ArithmeticFault;
import org.safearith.runtime.model.TypedValue;

import java.util.Optional;

/**
 * The result of evaluating a format program.
 * A failed evaluation has no value; nothing computed before the failing step is exposed.
 *
 * @param value The final accumulator, or {@code null} on failure.
 * @param fault The reason for failure, or {@code null} on success.
 * @param message A description of the failure, or {@code null} on success.
 * @param failedStep The 1-based index of the step that failed (for an operand error, the step that consumes it),
 *                   or 0 if the program itself or the seed was rejected.
 */
public record EvaluationOutcome(TypedValue value, ArithmeticFault fault, String message, int failedStep) {

    static EvaluationOutcome success(TypedValue value) {
        return new EvaluationOutcome(value, null, null, 0);
    }

    static EvaluationOutcome failure(ArithmeticFault fault, String message, int failedStep) {
        return new EvaluationOutcome(null, fault, message, failedStep);
    }

    /**
     * @return {@code true} if every step was safe.
     */
    public boolean isSuccess() {
        return fault == null;
    }

    /**
     * @return The final value on success, otherwise empty.
     */
    public Optional<TypedValue> toOptional() {
        return Optional.ofNullable(value);
    }
}
