package org.safearith.runtime.checks;

import org.safearith.runtime.api.ArithmeticFault;
import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.isa.IPrimitiveChecks;
import org.safearith.runtime.isa.OperationKind;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;

import java.util.Objects;

/**
 * Applies checked operations to operands of possibly different types.
 * The right operand (or every operand, for the destination-typed variants) must first pass
 * {@link CastSafety}; it is then reinterpreted as the operation type and handed to the
 * {@link IPrimitiveChecks} of that type's signedness.
 */
public final class CheckedOperations {

    private CheckedOperations() {}

    /**
     * Applies an operation in the type of the left operand.
     *
     * @param op The operation.
     * @param left The left operand; its type is the operation type and the result type.
     * @param right The right operand, of any type.
     * @return The checked result.
     */
    public static CheckResult apply(OperationKind op, TypedValue left, TypedValue right) {
        Objects.requireNonNull(op, "op");
        IntegerType type = left.type();
        if (!CastSafety.canReinterpret(right, type)) {
            return unsafeCast(right, type);
        }
        return IPrimitiveChecks.forType(type).check(op, left, right.reinterpretAs(type));
    }

    /**
     * Applies an operation in a destination type, e.g. {@code u64 = u32 * u32}.
     * Both operands must be reinterpretable as the destination type.
     *
     * @param destination The operation and result type.
     * @param op The operation.
     * @param left The left operand.
     * @param right The right operand.
     * @return The checked result.
     */
    public static CheckResult applyInto(IntegerType destination, OperationKind op, TypedValue left, TypedValue right) {
        Objects.requireNonNull(destination, "destination");
        if (!CastSafety.canReinterpret(left, destination)) {
            return unsafeCast(left, destination);
        }
        return apply(op, left.reinterpretAs(destination), right);
    }

    /**
     * Repeats one operation over several operands from left to right in a destination type,
     * so {@code fold(U32, MUL, w, h, d)} computes {@code (w * h) * d}.
     * Every operand is cast-checked before any arithmetic runs.
     *
     * @param destination The operation and result type.
     * @param op The operation.
     * @param operands At least two operands.
     * @return The checked result of the whole chain.
     */
    public static CheckResult fold(IntegerType destination, OperationKind op, TypedValue... operands) {
        Objects.requireNonNull(destination, "destination");
        if (operands == null || operands.length < 2) {
            throw new IllegalArgumentException("A fold needs at least two operands.");
        }
        for (TypedValue operand : operands) {
            if (!CastSafety.canReinterpret(operand, destination)) {
                return unsafeCast(operand, destination);
            }
        }
        TypedValue accumulator = operands[0].reinterpretAs(destination);
        for (int i = 1; i < operands.length; i++) {
            CheckResult step = apply(op, accumulator, operands[i]);
            if (!step.isSafe()) {
                return step;
            }
            accumulator = step.getValue();
        }
        return CheckResult.safe(accumulator);
    }

    /**
     * Adds one to a value in its own type.
     * @param value The value to increment.
     * @return The checked result.
     */
    public static CheckResult increment(TypedValue value) {
        return apply(OperationKind.ADD, value, TypedValue.of(value.type(), 1));
    }

    /**
     * Subtracts one from a value in its own type.
     * @param value The value to decrement.
     * @return The checked result.
     */
    public static CheckResult decrement(TypedValue value) {
        return apply(OperationKind.SUB, value, TypedValue.of(value.type(), 1));
    }

    private static CheckResult unsafeCast(TypedValue value, IntegerType target) {
        return CheckResult.unsafe(ArithmeticFault.UNSAFE_CAST, "Cannot reinterpret " + value + " as " + target.marker());
    }
}
