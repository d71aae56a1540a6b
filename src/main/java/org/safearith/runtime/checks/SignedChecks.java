package org.safearith.runtime.checks;

import org.safearith.runtime.api.ArithmeticFault;
import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.isa.IPrimitiveChecks;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;

/**
 * Safety checks for the signed types.
 * The bound expressions never overflow a {@code long}: every intermediate such as {@code MAX - b}
 * is only formed when the signs of the operands keep it in range.
 */
public final class SignedChecks implements IPrimitiveChecks {

    /** The shared, stateless instance. */
    public static final SignedChecks INSTANCE = new SignedChecks();

    private SignedChecks() {}

    @Override
    public CheckResult add(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        long x = a.payload();
        long y = b.payload();
        if (x > 0 && y > 0) {
            if (x > type.signedMax() - y) {
                return refuse(ArithmeticFault.OVERFLOW, a, "+", b);
            }
        } else if (x <= 0 && y <= 0) {
            if (x < type.signedMin() - y) {
                return refuse(ArithmeticFault.UNDERFLOW, a, "+", b);
            }
        }
        // Mixed signs cannot leave the range.
        return CheckResult.safe(TypedValue.of(type, x + y));
    }

    @Override
    public CheckResult sub(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        long x = a.payload();
        long y = b.payload();
        if (y <= 0 && x > type.signedMax() + y) {
            return refuse(ArithmeticFault.OVERFLOW, a, "-", b);
        }
        if (y > 0 && x < type.signedMin() + y) {
            return refuse(ArithmeticFault.UNDERFLOW, a, "-", b);
        }
        return CheckResult.safe(TypedValue.of(type, x - y));
    }

    @Override
    public CheckResult mul(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        long x = a.payload();
        long y = b.payload();
        long max = type.signedMax();
        long min = type.signedMin();
        if (x > 0) {
            if (y > 0) {
                if (x > max / y) {
                    return refuse(ArithmeticFault.OVERFLOW, a, "*", b);
                }
            } else if (y < min / x) {
                return refuse(ArithmeticFault.UNDERFLOW, a, "*", b);
            }
        } else {
            if (y > 0) {
                if (x < min / y) {
                    return refuse(ArithmeticFault.UNDERFLOW, a, "*", b);
                }
            } else if (x != 0 && y < max / x) {
                return refuse(ArithmeticFault.OVERFLOW, a, "*", b);
            }
        }
        return CheckResult.safe(TypedValue.of(type, x * y));
    }

    @Override
    public CheckResult div(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        CheckResult refused = checkDivisor(type, a, "/", b);
        if (refused != null) {
            return refused;
        }
        return CheckResult.safe(TypedValue.of(type, a.payload() / b.payload()));
    }

    @Override
    public CheckResult mod(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        CheckResult refused = checkDivisor(type, a, "%", b);
        if (refused != null) {
            return refused;
        }
        return CheckResult.safe(TypedValue.of(type, a.payload() % b.payload()));
    }

    @Override
    public CheckResult shl(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        if (!isValidShift(type, a, b)) {
            return refuse(ArithmeticFault.INVALID_SHIFT, a, "<<", b);
        }
        int distance = (int) b.payload();
        if (a.payload() > (type.signedMax() >> distance)) {
            return refuse(ArithmeticFault.OVERFLOW, a, "<<", b);
        }
        return CheckResult.safe(TypedValue.of(type, a.payload() << distance));
    }

    @Override
    public CheckResult shr(TypedValue a, TypedValue b) {
        IntegerType type = requireOperands(a, b);
        // Right-shifting a negative value is implementation-defined on the machine level, so it is refused.
        if (!isValidShift(type, a, b)) {
            return refuse(ArithmeticFault.INVALID_SHIFT, a, ">>", b);
        }
        return CheckResult.safe(TypedValue.of(type, a.payload() >> (int) b.payload()));
    }

    private static CheckResult checkDivisor(IntegerType type, TypedValue a, String symbol, TypedValue b) {
        if (b.payload() == 0) {
            return refuse(ArithmeticFault.DIVISION_BY_ZERO, a, symbol, b);
        }
        if (a.payload() == type.signedMin() && b.payload() == -1) {
            return refuse(ArithmeticFault.SIGNED_MIN_BY_MINUS_ONE, a, symbol, b);
        }
        return null;
    }

    private static boolean isValidShift(IntegerType type, TypedValue a, TypedValue b) {
        return a.payload() >= 0 && b.payload() >= 0 && b.payload() < type.width();
    }

    private static IntegerType requireOperands(TypedValue a, TypedValue b) {
        IntegerType type = requireSameType(a, b);
        if (!type.isSigned()) {
            throw new IllegalArgumentException("Signed checks applied to " + type.marker());
        }
        return type;
    }

    static IntegerType requireSameType(TypedValue a, TypedValue b) {
        if (a.type() != b.type()) {
            throw new IllegalArgumentException(
                    "Primitive checks need operands of one type, got " + a.type().marker() + " and " + b.type().marker());
        }
        return a.type();
    }

    private static CheckResult refuse(ArithmeticFault fault, TypedValue a, String symbol, TypedValue b) {
        return CheckResult.unsafe(fault, a + " " + symbol + " " + b);
    }
}
