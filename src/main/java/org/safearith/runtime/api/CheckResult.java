package org.safearith.runtime.api;

import org.safearith.runtime.model.TypedValue;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a single checked operation: either the exact result, or the fault that made the operation unsafe.
 *
 * @param value The result, or {@code null} if the operation was refused.
 * @param fault The reason for refusal, or {@code null} on success.
 * @param message A human-readable description of the refusal, or {@code null} on success.
 */
public record CheckResult(TypedValue value, ArithmeticFault fault, String message) {

    /**
     * Creates a successful result.
     * @param value The exact result of the operation.
     * @return The result.
     */
    public static CheckResult safe(TypedValue value) {
        return new CheckResult(Objects.requireNonNull(value, "value"), null, null);
    }

    /**
     * Creates a refused result.
     * @param fault The reason for refusal.
     * @param message A description of the refusal.
     * @return The result.
     */
    public static CheckResult unsafe(ArithmeticFault fault, String message) {
        return new CheckResult(null, Objects.requireNonNull(fault, "fault"), message);
    }

    /**
     * @return {@code true} if the operation was safe and {@link #value()} holds its result.
     */
    public boolean isSafe() {
        return fault == null;
    }

    /**
     * @return The result if the operation was safe, otherwise empty.
     */
    public Optional<TypedValue> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the result of a safe operation.
     * @return The result.
     * @throws IllegalStateException if the operation was refused.
     */
    public TypedValue getValue() {
        if (!isSafe()) {
            throw new IllegalStateException("No result for refused operation: " + fault + " (" + message + ")");
        }
        return value;
    }

    @Override
    public String toString() {
        return isSafe() ? "safe " + value : "unsafe " + fault + ": " + message;
    }
}
