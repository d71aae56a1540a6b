package org.safearith.runtime.isa;

import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.checks.SignedChecks;
import org.safearith.runtime.checks.UnsignedChecks;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;

/**
 * The same-type safety checks for one signedness.
 * Each operation takes two operands of the same {@link IntegerType} and returns the exact result
 * if the machine operation coincides with the mathematical one, otherwise the fault that prevents it.
 */
public interface IPrimitiveChecks {

    CheckResult add(TypedValue a, TypedValue b);

    CheckResult sub(TypedValue a, TypedValue b);

    CheckResult mul(TypedValue a, TypedValue b);

    CheckResult div(TypedValue a, TypedValue b);

    CheckResult mod(TypedValue a, TypedValue b);

    CheckResult shl(TypedValue a, TypedValue b);

    CheckResult shr(TypedValue a, TypedValue b);

    /**
     * Runs the check for the given operation.
     * @param op The operation.
     * @param a The left operand.
     * @param b The right operand, of the same type as {@code a}.
     * @return The checked result.
     */
    default CheckResult check(OperationKind op, TypedValue a, TypedValue b) {
        return switch (op) {
            case ADD -> add(a, b);
            case SUB -> sub(a, b);
            case MUL -> mul(a, b);
            case DIV -> div(a, b);
            case MOD -> mod(a, b);
            case SHL -> shl(a, b);
            case SHR -> shr(a, b);
        };
    }

    /**
     * Selects the checks matching the signedness of a type.
     * @param type The operand type.
     * @return The signed or unsigned checks.
     */
    static IPrimitiveChecks forType(IntegerType type) {
        return type.isSigned() ? SignedChecks.INSTANCE : UnsignedChecks.INSTANCE;
    }
}
