package org.safearith;

import org.safearith.config.ConfigLoader;
import org.safearith.config.EvaluatorOptions;
import org.safearith.runtime.FormatEvaluator;
import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.api.ResultSlot;
import org.safearith.runtime.checks.CheckedOperations;
import org.safearith.runtime.isa.OperationKind;
import org.safearith.runtime.model.TypedValue;

/**
 * Static entry points for checked integer arithmetic.
 * <p>
 * Every operation returns whether it was safe and writes the result into the given {@link ResultSlot} only
 * when it was. The slot may be {@code null} to only perform the check. Operands of different types are
 * combined in the type of the left operand after the right one passes the cast-safety check.
 * <pre>{@code
 * ResultSlot pixels = new ResultSlot();
 * if (!SafeArith.mul(pixels, TypedValue.u32(width), TypedValue.u32(height))) {
 *     throw new IllegalArgumentException("Image too large");
 * }
 * }</pre>
 */
public final class SafeArith {

    private static final class EvaluatorHolder {
        static final FormatEvaluator INSTANCE = new FormatEvaluator(EvaluatorOptions.fromConfig(ConfigLoader.load()));
    }

    private SafeArith() {}

    /**
     * Computes {@code a + b}.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean add(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.ADD, a, b));
    }

    /**
     * Computes {@code a - b}.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean sub(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.SUB, a, b));
    }

    /**
     * Computes {@code a * b}.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean mul(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.MUL, a, b));
    }

    /**
     * Computes {@code a / b}, truncating toward zero. Refuses a zero divisor and the signed minimum divided by -1.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean div(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.DIV, a, b));
    }

    /**
     * Computes {@code a % b}, with the sign of {@code a}. Refused in the same cases as {@link #div}.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean mod(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.MOD, a, b));
    }

    /**
     * Computes {@code a << b}. Refuses shift amounts outside {@code [0, width)} and negative signed values.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean shl(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.SHL, a, b));
    }

    /**
     * Computes {@code a >> b}. Refuses shift amounts outside {@code [0, width)} and negative signed values.
     * @param out The destination, or {@code null}. Left untouched if the operation is refused.
     * @param a The left operand; its type is the result type.
     * @param b The right operand, cast-checked against the type of {@code a}.
     * @return {@code true} if the operation was safe.
     */
    public static boolean shr(ResultSlot out, TypedValue a, TypedValue b) {
        return store(out, CheckedOperations.apply(OperationKind.SHR, a, b));
    }

    /**
     * Increments the value held by a slot.
     * @param inOut A slot holding a value; unchanged if the increment would overflow.
     * @return {@code true} if the increment was safe.
     */
    public static boolean inc(ResultSlot inOut) {
        return store(inOut, CheckedOperations.increment(inOut.get()));
    }

    /**
     * Decrements the value held by a slot.
     * @param inOut A slot holding a value; unchanged if the decrement would underflow.
     * @return {@code true} if the decrement was safe.
     */
    public static boolean dec(ResultSlot inOut) {
        return store(inOut, CheckedOperations.decrement(inOut.get()));
    }

    /**
     * Evaluates a format program, e.g. {@code evaluate(out, "u32*u32*u32", w, h, d)}.
     * The leading type of unmarked programs comes from the {@code safe-arith.evaluator} configuration.
     *
     * @param out The destination, or {@code null}. Left untouched on failure.
     * @param program The format text.
     * @param operands The seed followed by one operand per step.
     * @return {@code true} if every step was safe.
     * @see FormatEvaluator
     */
    public static boolean evaluate(ResultSlot out, String program, long... operands) {
        return EvaluatorHolder.INSTANCE.evaluate(out, program, operands);
    }

    private static boolean store(ResultSlot out, CheckResult result) {
        if (result.isSafe() && out != null) {
            out.set(result.getValue());
        }
        return result.isSafe();
    }
}
