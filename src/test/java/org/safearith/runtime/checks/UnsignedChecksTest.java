package org.safearith.runtime.checks;

import org.safearith.runtime.api.ArithmeticFault;
import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Boundary tests for the unsigned primitive checks.
 */
public class UnsignedChecksTest {

    private final UnsignedChecks checks = UnsignedChecks.INSTANCE;

    private static TypedValue v(IntegerType type, long value) {
        return TypedValue.of(type, value);
    }

    // --- ADD ---
    @ParameterizedTest
    @EnumSource(value = IntegerType.class, names = {"U8", "U16", "U32", "U64"})
    @Tag("unit")
    void testAddMaxPlusOneOverflows(IntegerType type) {
        CheckResult result = checks.add(v(type, type.maxValue()), v(type, 1));

        assertThat(result.isSafe()).isFalse();
        assertThat(result.fault()).isEqualTo(ArithmeticFault.OVERFLOW);
        assertThat(result.toOptional()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = IntegerType.class, names = {"U8", "U16", "U32", "U64"})
    @Tag("unit")
    void testAddHalfMaxTwiceSucceeds(IntegerType type) {
        long half = Long.divideUnsigned(type.maxValue(), 2);

        CheckResult result = checks.add(v(type, half), v(type, half));

        assertThat(result.isSafe()).isTrue();
        assertThat(result.getValue()).isEqualTo(v(type, type.maxValue() - 1));
    }

    // --- SUB ---
    @Test
    @Tag("unit")
    void testSub() {
        assertThat(checks.sub(TypedValue.u8(5), TypedValue.u8(3)).getValue()).isEqualTo(TypedValue.u8(2));
        assertThat(checks.sub(TypedValue.u8(3), TypedValue.u8(3)).getValue()).isEqualTo(TypedValue.u8(0));
        assertThat(checks.sub(TypedValue.u8(3), TypedValue.u8(5)).fault()).isEqualTo(ArithmeticFault.UNDERFLOW);
        assertThat(checks.sub(TypedValue.u64(-1L), TypedValue.u64(1)).getValue()).isEqualTo(TypedValue.u64(-2L));
        assertThat(checks.sub(TypedValue.u64(1), TypedValue.u64(-1L)).isSafe()).isFalse();
    }

    // --- MUL ---
    @Test
    @Tag("unit")
    void testMul() {
        assertThat(checks.mul(TypedValue.u32(65535), TypedValue.u32(65537)).getValue())
                .isEqualTo(TypedValue.u32(4294967295L));
        assertThat(checks.mul(TypedValue.u32(65536), TypedValue.u32(65536)).fault()).isEqualTo(ArithmeticFault.OVERFLOW);
        assertThat(checks.mul(TypedValue.u64(1L << 32), TypedValue.u64(1L << 32)).isSafe()).isFalse();
        assertThat(checks.mul(TypedValue.u64(1L << 32), TypedValue.u64(1L << 31)).getValue())
                .isEqualTo(TypedValue.u64(Long.MIN_VALUE));
        assertThat(checks.mul(TypedValue.u8(255), TypedValue.u8(0)).getValue()).isEqualTo(TypedValue.u8(0));
        assertThat(checks.mul(TypedValue.u8(0), TypedValue.u8(255)).getValue()).isEqualTo(TypedValue.u8(0));
    }

    // --- DIV / MOD ---
    @ParameterizedTest
    @EnumSource(value = IntegerType.class, names = {"U8", "U16", "U32", "U64"})
    @Tag("unit")
    void testDivAndModByZeroAreRefused(IntegerType type) {
        assertThat(checks.div(v(type, 7), v(type, 0)).fault()).isEqualTo(ArithmeticFault.DIVISION_BY_ZERO);
        assertThat(checks.mod(v(type, 7), v(type, 0)).fault()).isEqualTo(ArithmeticFault.DIVISION_BY_ZERO);
        assertThat(checks.div(v(type, 0), v(type, 0)).isSafe()).isFalse();
    }

    @Test
    @Tag("unit")
    void testDivAndModUseUnsignedSemantics() {
        assertThat(checks.div(TypedValue.u64(-1L), TypedValue.u64(2)).getValue()).isEqualTo(TypedValue.u64(Long.MAX_VALUE));
        assertThat(checks.mod(TypedValue.u64(-1L), TypedValue.u64(10)).getValue()).isEqualTo(TypedValue.u64(5));
        assertThat(checks.div(TypedValue.u8(200), TypedValue.u8(7)).getValue()).isEqualTo(TypedValue.u8(28));
        assertThat(checks.mod(TypedValue.u8(200), TypedValue.u8(7)).getValue()).isEqualTo(TypedValue.u8(4));
    }

    // --- SHL / SHR ---
    @ParameterizedTest
    @EnumSource(value = IntegerType.class, names = {"U8", "U16", "U32", "U64"})
    @Tag("unit")
    void testShiftBounds(IntegerType type) {
        assertThat(checks.shl(v(type, 1), v(type, type.width())).fault()).isEqualTo(ArithmeticFault.INVALID_SHIFT);
        assertThat(checks.shr(v(type, 1), v(type, type.width())).fault()).isEqualTo(ArithmeticFault.INVALID_SHIFT);

        CheckResult topBit = checks.shl(v(type, 1), v(type, type.width() - 1));
        assertThat(topBit.isSafe()).isTrue();
        assertThat(topBit.getValue().toBigInteger().bitLength()).isEqualTo(type.width());
    }

    @Test
    @Tag("unit")
    void testShlRefusesLostBits() {
        assertThat(checks.shl(TypedValue.u8(0x81), TypedValue.u8(1)).fault()).isEqualTo(ArithmeticFault.OVERFLOW);
        assertThat(checks.shl(TypedValue.u8(0x40), TypedValue.u8(1)).getValue()).isEqualTo(TypedValue.u8(0x80));
        assertThat(checks.shl(TypedValue.u8(0), TypedValue.u8(7)).getValue()).isEqualTo(TypedValue.u8(0));
    }

    @Test
    @Tag("unit")
    void testShr() {
        assertThat(checks.shr(TypedValue.u64(-1L), TypedValue.u64(63)).getValue()).isEqualTo(TypedValue.u64(1));
        assertThat(checks.shr(TypedValue.u8(0), TypedValue.u8(7)).getValue()).isEqualTo(TypedValue.u8(0));
        assertThat(checks.shr(TypedValue.u16(0x8000), TypedValue.u16(15)).getValue()).isEqualTo(TypedValue.u16(1));
        assertThat(checks.shr(TypedValue.u64(1), TypedValue.u64(-1L)).fault()).isEqualTo(ArithmeticFault.INVALID_SHIFT);
    }

    @Test
    @Tag("unit")
    void testOperandsMustShareAnUnsignedType() {
        assertThatThrownBy(() -> checks.add(TypedValue.u8(1), TypedValue.u16(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> checks.add(TypedValue.s8(1), TypedValue.s8(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
