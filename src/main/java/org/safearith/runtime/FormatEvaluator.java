package org.safearith.runtime;

import org.safearith.compiler.api.FormatCompilationException;
import org.safearith.compiler.api.FormatCompiler;
import org.safearith.compiler.ir.FormatProgram;
import org.safearith.compiler.ir.FormatStep;
import org.safearith.config.EvaluatorOptions;
import org.safearith.runtime.api.ArithmeticFault;
import org.safearith.runtime.api.CheckResult;
import org.safearith.runtime.api.ResultSlot;
import org.safearith.runtime.checks.CheckedOperations;
import org.safearith.runtime.internal.services.EvaluationAccumulator;
import org.safearith.runtime.model.IntegerType;
import org.safearith.runtime.model.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates format programs such as {@code "u32*u32*u32"} over a list of operands.
 * <p>
 * The steps are applied strictly from left to right with no precedence: {@code "+*"} over {@code (a, b, c)}
 * computes {@code (a + b) * c}. Each step goes through {@link CheckedOperations#apply}, with the accumulator as
 * the left operand. The first unsafe step aborts the evaluation and no partial result is exposed.
 * <p>
 * An evaluator is immutable and may be shared between threads; every evaluation uses its own accumulator.
 */
public class FormatEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(FormatEvaluator.class);

    private final FormatCompiler compiler;
    private final EvaluatorOptions options;

    /**
     * Creates an evaluator with the built-in settings.
     */
    public FormatEvaluator() {
        this(EvaluatorOptions.defaults());
    }

    /**
     * Creates an evaluator with explicit settings.
     * @param options The evaluator settings.
     */
    public FormatEvaluator(EvaluatorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.compiler = new FormatCompiler(options.defaultType());
    }

    /**
     * Evaluates a program over raw operands. Each operand is read as the type the program declares for it
     * and must be representable in that type ({@code u64} operands are taken as bit patterns).
     *
     * @param program The format text.
     * @param operands The seed followed by one operand per step.
     * @return The outcome.
     */
    public EvaluationOutcome evaluate(String program, long... operands) {
        Objects.requireNonNull(operands, "operands");
        FormatProgram compiled;
        try {
            compiled = compiler.compile(program);
        } catch (FormatCompilationException e) {
            return malformed(program, e);
        }
        EvaluationOutcome countMismatch = checkOperandCount(compiled, operands.length);
        if (countMismatch != null) {
            return countMismatch;
        }

        List<TypedValue> typed = new ArrayList<>(operands.length);
        for (int i = 0; i < operands.length; i++) {
            IntegerType type = compiled.operandType(i);
            if (!type.canHold(operands[i])) {
                String message = "Operand " + i + " (" + operands[i] + ") does not fit " + type.marker();
                LOG.debug("Format '{}' rejected: {}", program, message);
                return EvaluationOutcome.failure(ArithmeticFault.OPERAND_OUT_OF_RANGE, message, i);
            }
            typed.add(TypedValue.of(type, operands[i]));
        }
        return run(compiled, typed);
    }

    /**
     * Evaluates a program over operands that carry their types. Each operand's type must equal the type
     * the program declares for it.
     *
     * @param program The format text.
     * @param operands The seed followed by one operand per step.
     * @return The outcome.
     */
    public EvaluationOutcome evaluateTyped(String program, TypedValue... operands) {
        Objects.requireNonNull(operands, "operands");
        FormatProgram compiled;
        try {
            compiled = compiler.compile(program);
        } catch (FormatCompilationException e) {
            return malformed(program, e);
        }
        return run(compiled, List.of(operands));
    }

    /**
     * Evaluates a program and writes the final value into a slot, in the manner of the C interface
     * {@code bool evaluate(out_or_null, program, ...)}. The operands are read before the slot is written,
     * so the slot's previous content may itself be passed as an operand.
     *
     * @param out The destination, or {@code null} to only check the program. Left untouched on failure.
     * @param program The format text.
     * @param operands The seed followed by one operand per step.
     * @return {@code true} if every step was safe.
     */
    public boolean evaluate(ResultSlot out, String program, long... operands) {
        EvaluationOutcome outcome = evaluate(program, operands);
        if (outcome.isSuccess() && out != null) {
            out.set(outcome.value());
        }
        return outcome.isSuccess();
    }

    /**
     * Runs a compiled program over typed operands.
     *
     * @param program The compiled program.
     * @param operands Exactly {@link FormatProgram#operandCount()} operands, each of the type the program
     *                 declares for it.
     * @return The outcome; {@link ArithmeticFault#OPERAND_TYPE_MISMATCH} if an operand carries another type.
     */
    public EvaluationOutcome run(FormatProgram program, List<TypedValue> operands) {
        EvaluationOutcome countMismatch = checkOperandCount(program, operands.size());
        if (countMismatch != null) {
            return countMismatch;
        }
        EvaluationOutcome typeMismatch = checkOperandTypes(program, operands);
        if (typeMismatch != null) {
            return typeMismatch;
        }
        EvaluationAccumulator accumulator = new EvaluationAccumulator(program.leadingType());
        accumulator.seed(operands.get(0));

        List<FormatStep> steps = program.steps();
        for (int i = 0; i < steps.size(); i++) {
            FormatStep step = steps.get(i);
            TypedValue operand = operands.get(i + 1);
            CheckResult result = CheckedOperations.apply(step.operation(), accumulator.current(), operand);
            if (!result.isSafe()) {
                LOG.debug("Format '{}' aborted at step {} ({}): {} - {}",
                        program.source(), i + 1, step.operation().symbol(), result.fault(), result.message());
                return EvaluationOutcome.failure(result.fault(), result.message(), i + 1);
            }
            if (options.traceSteps()) {
                LOG.trace("Step {}: {} {} {} = {}",
                        i + 1, accumulator.current(), step.operation().symbol(), operand, result.getValue());
            }
            accumulator.update(result.getValue());
        }
        return EvaluationOutcome.success(accumulator.finish());
    }

    /**
     * @return The settings of this evaluator.
     */
    public EvaluatorOptions getOptions() {
        return options;
    }

    private EvaluationOutcome checkOperandCount(FormatProgram program, int supplied) {
        if (supplied == program.operandCount()) {
            return null;
        }
        String message = "Format '" + program.source() + "' needs " + program.operandCount()
                + " operand(s) but " + supplied + " were supplied";
        LOG.debug(message);
        return EvaluationOutcome.failure(ArithmeticFault.ARGUMENT_COUNT_MISMATCH, message, 0);
    }

    private EvaluationOutcome checkOperandTypes(FormatProgram program, List<TypedValue> operands) {
        for (int i = 0; i < operands.size(); i++) {
            IntegerType declared = program.operandType(i);
            if (operands.get(i).type() != declared) {
                String message = "Operand " + i + " is " + operands.get(i) + " but the format declares " + declared.marker();
                LOG.debug("Format '{}' rejected: {}", program.source(), message);
                return EvaluationOutcome.failure(ArithmeticFault.OPERAND_TYPE_MISMATCH, message, i);
            }
        }
        return null;
    }

    private EvaluationOutcome malformed(String program, FormatCompilationException e) {
        LOG.debug("Format '{}' rejected: {}", program, e.getMessage());
        return EvaluationOutcome.failure(ArithmeticFault.MALFORMED_PROGRAM, e.getMessage(), 0);
    }
}
