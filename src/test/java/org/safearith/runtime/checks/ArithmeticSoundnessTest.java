package org.safearith.runtime.checks;

import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.isa.IPrimitiveChecks;
import org.safearith.runtime.isa.OperationKind;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigInteger;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares the primitive checks against exact arithmetic on random operands.
 * A safe result must equal the exact value; a refused one must have an exact value outside the type
 * (or be a division by zero, or the signed minimum divided by -1).
 */
public class ArithmeticSoundnessTest {

    private static final int SAMPLES = 5_000;

    @ParameterizedTest
    @EnumSource(IntegerType.class)
    @Tag("unit")
    void testAddSubMulAgreeWithExactArithmetic(IntegerType type) {
        Random random = new Random(0x5AFEL + type.ordinal());
        IPrimitiveChecks checks = IPrimitiveChecks.forType(type);
        BigInteger min = TypedValue.of(type, type.minValue()).toBigInteger();
        BigInteger max = TypedValue.of(type, type.maxValue()).toBigInteger();

        for (int i = 0; i < SAMPLES; i++) {
            TypedValue a = sample(random, type);
            TypedValue b = sample(random, type);
            for (OperationKind op : new OperationKind[]{OperationKind.ADD, OperationKind.SUB, OperationKind.MUL}) {
                BigInteger exact = switch (op) {
                    case ADD -> a.toBigInteger().add(b.toBigInteger());
                    case SUB -> a.toBigInteger().subtract(b.toBigInteger());
                    default -> a.toBigInteger().multiply(b.toBigInteger());
                };
                boolean representable = exact.compareTo(min) >= 0 && exact.compareTo(max) <= 0;
                CheckResult result = checks.check(op, a, b);

                assertThat(result.isSafe()).as("%s %s %s", a, op.symbol(), b).isEqualTo(representable);
                if (representable) {
                    assertThat(result.getValue().toBigInteger()).as("%s %s %s", a, op.symbol(), b).isEqualTo(exact);
                    assertThat(result.getValue().type()).isEqualTo(type);
                }
            }
        }
    }

    @ParameterizedTest
    @EnumSource(IntegerType.class)
    @Tag("unit")
    void testDivModAgreeWithExactArithmetic(IntegerType type) {
        Random random = new Random(0xD1FL + type.ordinal());
        IPrimitiveChecks checks = IPrimitiveChecks.forType(type);

        for (int i = 0; i < SAMPLES; i++) {
            TypedValue a = sample(random, type);
            TypedValue b = sample(random, type);
            boolean refused = b.payload() == 0
                    || (type.isSigned() && a.payload() == type.minValue() && b.payload() == -1);

            CheckResult quotient = checks.div(a, b);
            CheckResult remainder = checks.mod(a, b);

            assertThat(quotient.isSafe()).as("%s / %s", a, b).isEqualTo(!refused);
            assertThat(remainder.isSafe()).as("%s %% %s", a, b).isEqualTo(!refused);
            if (!refused) {
                assertThat(quotient.getValue().toBigInteger()).isEqualTo(a.toBigInteger().divide(b.toBigInteger()));
                assertThat(remainder.getValue().toBigInteger()).isEqualTo(a.toBigInteger().remainder(b.toBigInteger()));
            }
        }
    }

    private static TypedValue sample(Random random, IntegerType type) {
        // Mix full-range values with small ones and the type's bounds so every branch is reached.
        return switch (random.nextInt(4)) {
            case 0 -> TypedValue.truncate(type, random.nextLong());
            case 1 -> TypedValue.truncate(type, random.nextInt(33) - 16);
            case 2 -> TypedValue.truncate(type, random.nextLong() >> random.nextInt(64));
            default -> TypedValue.of(type, random.nextBoolean() ? type.minValue() : type.maxValue());
        };
    }
}
