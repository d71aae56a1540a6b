package org.safearith.runtime.api;

/**
 * Classifies why a checked operation or a format evaluation was refused.
 * Every fault is an expected, recoverable outcome; none of them is raised as an exception.
 */
public enum ArithmeticFault {
    // region Primitive checks
    /** The exact result is above the largest value of the type. */
    OVERFLOW,
    /** The exact result is below the smallest value of the type. */
    UNDERFLOW,
    /** Division or remainder by zero. */
    DIVISION_BY_ZERO,
    /** The smallest signed value divided (or reduced modulo) by -1. */
    SIGNED_MIN_BY_MINUS_ONE,
    /** A negative shift amount, a shift amount not below the bit width, or a shift of a negative signed value. */
    INVALID_SHIFT,
    // endregion

    // region Operand handling
    /** The right operand cannot be reinterpreted as the left operand's type without changing its value. */
    UNSAFE_CAST,
    /** A raw operand does not fit the type the format program declares for it. */
    OPERAND_OUT_OF_RANGE,
    /** A typed operand does not carry the type the format program declares for it. */
    OPERAND_TYPE_MISMATCH,
    // endregion

    // region Format programs
    /** The format text is not a valid program. */
    MALFORMED_PROGRAM,
    /** The number of operands differs from the number the program requires. */
    ARGUMENT_COUNT_MISMATCH
    // endregion
}
