package org.safearith.runtime.checks;

import org.safearith.runtime.api.ArithmeticFault;
import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.isa.IPrimitiveChecks;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;

/**
 * Safety checks for the unsigned types.
 * All comparisons are unsigned so that {@link IntegerType#U64} bit patterns order correctly.
 */
public final class UnsignedChecks implements IPrimitiveChecks {

    /** The shared, stateless instance. */
    public static final UnsignedChecks INSTANCE = new UnsignedChecks();

    private UnsignedChecks() {}

    @Override
    public CheckResult add(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        // b <= MAX - a
        if (Long.compareUnsigned(b.payload(), type.unsignedMax() - a.payload()) > 0) {
            return refuse(ArithmeticFault.OVERFLOW, a, "+", b);
        }
        return CheckResult.safe(TypedValue.truncate(type, a.payload() + b.payload()));
    }

    @Override
    public CheckResult sub(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (Long.compareUnsigned(a.payload(), b.payload()) < 0) {
            return refuse(ArithmeticFault.UNDERFLOW, a, "-", b);
        }
        return CheckResult.safe(TypedValue.truncate(type, a.payload() - b.payload()));
    }

    @Override
    public CheckResult mul(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (b.payload() != 0
                && Long.compareUnsigned(a.payload(), Long.divideUnsigned(type.unsignedMax(), b.payload())) > 0) {
            return refuse(ArithmeticFault.OVERFLOW, a, "*", b);
        }
        return CheckResult.safe(TypedValue.truncate(type, a.payload() * b.payload()));
    }

    @Override
    public CheckResult div(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (b.payload() == 0) {
            return refuse(ArithmeticFault.DIVISION_BY_ZERO, a, "/", b);
        }
        return CheckResult.safe(TypedValue.of(type, Long.divideUnsigned(a.payload(), b.payload())));
    }

    @Override
    public CheckResult mod(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (b.payload() == 0) {
            return refuse(ArithmeticFault.DIVISION_BY_ZERO, a, "%", b);
        }
        return CheckResult.safe(TypedValue.of(type, Long.remainderUnsigned(a.payload(), b.payload())));
    }

    @Override
    public CheckResult shl(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (Long.compareUnsigned(b.payload(), type.width()) >= 0) {
            return refuse(ArithmeticFault.INVALID_SHIFT, a, "<<", b);
        }
        int distance = (int) b.payload();
        // a <= MAX >> b
        if (Long.compareUnsigned(a.payload(), type.unsignedMax() >>> distance) > 0) {
            return refuse(ArithmeticFault.OVERFLOW, a, "<<", b);
        }
        return CheckResult.safe(TypedValue.truncate(type, a.payload() << distance));
    }

    @Override
    public CheckResult shr(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (Long.compareUnsigned(b.payload(), type.width()) >= 0) {
            return refuse(ArithmeticFault.INVALID_SHIFT, a, ">>", b);
        }
        return CheckResult.safe(TypedValue.of(type, a.payload() >>> (int) b.payload()));
    }

    private static IntegerType requireOperands(TypedValue a, TypedValue b) {
        IntegerType type = SignedChecks.requireSameType(a, b);
        if (type.isSigned()) {
            throw new IllegalArgumentException("Unsigned checks applied to " + type.marker());
        }
        return type;
    }

    private static CheckResult refuse(ArithmeticFault fault, TypedValue a, String symbol, TypedValue b) {
        return CheckResult.unsafe(fault, a + " " + symbol + " " + b);
    }
}
