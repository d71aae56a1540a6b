package org.safearith.compiler.ir;

import org.safearith.runtime.isa.OperationKind;
import org.safearith.runtime.model.IntegerType;

/**
 * One step of a format program: an operation and the declared type of its right-hand operand.
 *
 * @param operation The operation applied to the accumulator.
 * @param operandType The type of the operand consumed by this step.
 * @param explicitType {@code true} if the type came from a marker rather than the sticky default.
 * @param column The column of the operator in the format text.
 */
public record FormatStep(OperationKind operation, IntegerType operandType, boolean explicitType, int column) {
}
