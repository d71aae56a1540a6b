package org.safearith.runtime.checks;

import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;

/**
 * Decides whether a value can be reinterpreted as another integer type without changing the value it denotes.
 * <p>
 * The predicate does not know which operation follows. A pair such as {@code u8:10 + s8:-3} is refused even
 * though the subtraction {@code 10 - 3} would be fine; callers who mean to subtract a magnitude use
 * {@link org.safearith.runtime.isa.OperationKind#SUB} with a non-negative operand instead.
 */
public final class CastSafety {

    private CastSafety() {}

    /**
     * Checks whether {@code from} denotes the same value after reinterpretation as {@code target}.
     *
     * @param from The value to reinterpret.
     * @param target The type it would be reinterpreted as.
     * @return {@code true} if no truncation and no sign change would occur.
     */
    public static boolean canReinterpret(TypedValue from, IntegerType target) {
        IntegerType source = from.type();
        long b = from.payload();

        if (target.width() == source.width()) {
            if (target.isSigned() == source.isSigned()) {
                return true;
            }
            if (!target.isSigned()) {
                return b >= 0;
            }
            return Long.compareUnsigned(b, target.signedMax()) <= 0;
        }

        if (target.width() > source.width()) {
            if (target.isSigned() == source.isSigned()) {
                return true;
            }
            if (!target.isSigned()) {
                return b >= 0;
            }
            // Always the case on the 8/16/32/64 ladder.
            if (Long.compareUnsigned(target.signedMax(), source.unsignedMax()) >= 0) {
                return true;
            }
            return Long.compareUnsigned(b, target.signedMax()) <= 0;
        }

        // Narrowing
        if (!target.isSigned() && !source.isSigned()) {
            return Long.compareUnsigned(b, target.unsignedMax()) <= 0;
        }
        if (target.isSigned() && source.isSigned()) {
            return b >= target.signedMin() && b <= target.signedMax();
        }
        if (!target.isSigned()) {
            return b >= 0 && b <= target.unsignedMax();
        }
        return Long.compareUnsigned(b, target.signedMax()) <= 0;
    }
}
