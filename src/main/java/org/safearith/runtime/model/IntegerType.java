package org.safearith.runtime.model;

import java.util.Optional;

/**
 * The closed set of machine integer types the checked arithmetic operates on.
 * Each type has a bit width and a signedness; the bounds of every type are derived from those two attributes.
 * <p>
 * Values of a type are carried in a {@code long}. For every type except {@link #U64} the long holds the
 * mathematical value directly. For {@link #U64} it holds the 64-bit two's-complement pattern, so values at or
 * above 2^63 appear negative and must be compared with {@link Long#compareUnsigned(long, long)}.
 */
public enum IntegerType {
    /** Unsigned 8-bit integer. */
    U8(8, false),
    /** Signed 8-bit integer. */
    S8(8, true),
    /** Unsigned 16-bit integer. */
    U16(16, false),
    /** Signed 16-bit integer. */
    S16(16, true),
    /** Unsigned 32-bit integer. */
    U32(32, false),
    /** Signed 32-bit integer. */
    S32(32, true),
    /** Unsigned 64-bit integer. */
    U64(64, false),
    /** Signed 64-bit integer. */
    S64(64, true);

    /**
     * The type assumed for the left-hand side of a format program that carries no leading type marker.
     */
    public static final IntegerType DEFAULT = S32;

    private final int width;
    private final boolean signed;

    IntegerType(int width, boolean signed) {
        this.width = width;
        this.signed = signed;
    }

    /**
     * @return The width of the type in bits (8, 16, 32 or 64).
     */
    public int width() {
        return width;
    }

    /**
     * @return {@code true} if the type is signed.
     */
    public boolean isSigned() {
        return signed;
    }

    /**
     * @return The smallest signed value of this type's width, e.g. -128 for 8 bits.
     */
    public long signedMin() {
        return -(1L << (width - 1));
    }

    /**
     * @return The largest signed value of this type's width, e.g. 127 for 8 bits.
     */
    public long signedMax() {
        return (1L << (width - 1)) - 1;
    }

    /**
     * @return The largest unsigned value of this type's width. For 64 bits this is the bit pattern {@code -1L}.
     */
    public long unsignedMax() {
        return width == 64 ? -1L : (1L << width) - 1;
    }

    /**
     * @return The smallest value representable in this type.
     */
    public long minValue() {
        return signed ? signedMin() : 0L;
    }

    /**
     * @return The largest value representable in this type (a bit pattern for {@link #U64}).
     */
    public long maxValue() {
        return signed ? signedMax() : unsignedMax();
    }

    /**
     * Reduces an arbitrary long into this type's value space the way a C cast does:
     * unsigned types keep the low {@code width} bits, signed types additionally sign-extend them.
     *
     * @param raw The value to reduce.
     * @return The reduced value.
     */
    public long truncate(long raw) {
        if (width == 64) {
            return raw;
        }
        if (signed) {
            int shift = 64 - width;
            return (raw << shift) >> shift;
        }
        return raw & unsignedMax();
    }

    /**
     * Checks whether a long denotes a value of this type without any reduction.
     * Every long is accepted for {@link #U64}, where it is read as a bit pattern.
     *
     * @param value The candidate value.
     * @return {@code true} if {@link #truncate(long)} would leave the value unchanged.
     */
    public boolean canHold(long value) {
        return truncate(value) == value;
    }

    /**
     * @return The type marker used in format programs, e.g. {@code "u32"}.
     */
    public String marker() {
        return (signed ? "s" : "u") + width;
    }

    /**
     * Resolves a format type marker such as {@code "s16"}.
     *
     * @param marker The marker text.
     * @return The matching type, or empty if the text is not one of the eight markers.
     */
    public static Optional<IntegerType> fromMarker(String marker) {
        if (marker == null) {
            return Optional.empty();
        }
        for (IntegerType type : values()) {
            if (type.marker().equals(marker)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
