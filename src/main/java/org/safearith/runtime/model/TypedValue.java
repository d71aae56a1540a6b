package org.safearith.runtime.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer value tagged with its {@link IntegerType}.
 * The payload is always already reduced into the type's value space (see {@link IntegerType#truncate(long)}).
 *
 * @param type The type of the value.
 * @param payload The value, or for {@link IntegerType#U64} its 64-bit pattern.
 */
public record TypedValue(IntegerType type, long payload) {

    /**
     * Creates a typed value, rejecting payloads that the type cannot hold.
     * @param type The type of the value.
     * @param payload The value.
     * @throws IllegalArgumentException if the payload lies outside the type's range.
     */
    public TypedValue {
        Objects.requireNonNull(type, "type");
        if (!type.canHold(payload)) {
            throw new IllegalArgumentException(
                    "Value " + payload + " is out of range for " + type.marker()
                            + " [" + type.minValue() + ", " + Long.toUnsignedString(type.maxValue()) + "]");
        }
    }

    /**
     * Creates a typed value from a value that must be representable in the type.
     * @param type The type of the value.
     * @param value The value.
     * @return The typed value.
     */
    public static TypedValue of(IntegerType type, long value) {
        return new TypedValue(type, value);
    }

    /**
     * Creates a typed value by reducing an arbitrary long into the type, like a C cast.
     * @param type The target type.
     * @param raw The value to reduce.
     * @return The reduced typed value.
     */
    public static TypedValue truncate(IntegerType type, long raw) {
        return new TypedValue(type, type.truncate(raw));
    }

    public static TypedValue u8(long value) { return of(IntegerType.U8, value); }
    public static TypedValue s8(long value) { return of(IntegerType.S8, value); }
    public static TypedValue u16(long value) { return of(IntegerType.U16, value); }
    public static TypedValue s16(long value) { return of(IntegerType.S16, value); }
    public static TypedValue u32(long value) { return of(IntegerType.U32, value); }
    public static TypedValue s32(long value) { return of(IntegerType.S32, value); }
    public static TypedValue u64(long bits) { return of(IntegerType.U64, bits); }
    public static TypedValue s64(long value) { return of(IntegerType.S64, value); }

    /**
     * @return {@code true} if the value is below zero. Always {@code false} for unsigned types.
     */
    public boolean isNegative() {
        return type.isSigned() && payload < 0;
    }

    /**
     * Reinterprets the payload as another type, reducing it the way a C cast would.
     * Callers check {@code CastSafety} first when the value must survive unchanged.
     *
     * @param target The type to reinterpret as.
     * @return The value in the target type.
     */
    public TypedValue reinterpretAs(IntegerType target) {
        if (target == type) {
            return this;
        }
        return truncate(target, payload);
    }

    /**
     * @return The mathematical value, reading {@link IntegerType#U64} payloads as unsigned.
     */
    public BigInteger toBigInteger() {
        if (type == IntegerType.U64) {
            return new BigInteger(Long.toUnsignedString(payload));
        }
        return BigInteger.valueOf(payload);
    }

    @Override
    public String toString() {
        String digits = type == IntegerType.U64 ? Long.toUnsignedString(payload) : Long.toString(payload);
        return type.marker() + ":" + digits;
    }
}
