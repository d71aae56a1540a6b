package org.safearith.compiler.api;

import org.safearith.compiler.diagnostics.DiagnosticsEngine;
import org.safearith.compiler.frontend.lexer.FormatLexer;
import org.safearith.compiler.frontend.lexer.Token;
import org.safearith.compiler.frontend.parser.FormatParser;
import org.safearith.compiler.ir.FormatProgram;
import org.safearith.runtime.model.IntegerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Compiles format texts such as {@code "u32*u32+u16"} into {@link FormatProgram}s.
 * A compiler holds no per-compilation state and may be shared between threads.
 */
public class FormatCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(FormatCompiler.class);

    private final IntegerType defaultType;

    /**
     * Creates a compiler that uses {@link IntegerType#DEFAULT} for programs without a leading marker.
     */
    public FormatCompiler() {
        this(IntegerType.DEFAULT);
    }

    /**
     * Creates a compiler with a custom leading type.
     * @param defaultType The type used for programs without a leading marker.
     */
    public FormatCompiler(IntegerType defaultType) {
        this.defaultType = Objects.requireNonNull(defaultType, "defaultType");
    }

    /**
     * Compiles a format text.
     *
     * @param source The format text.
     * @return The compiled program.
     * @throws FormatCompilationException if the text is empty or not a valid program.
     */
    public FormatProgram compile(String source) throws FormatCompilationException {
        Objects.requireNonNull(source, "source");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        if (source.isBlank()) {
            diagnostics.reportError("Format program is empty", 1);
            throw new FormatCompilationException("Empty format program", diagnostics.getDiagnostics());
        }

        List<Token> tokens = new FormatLexer(source, diagnostics).scanTokens();
        FormatProgram program = new FormatParser(tokens, diagnostics, defaultType, source).parse();
        if (diagnostics.hasErrors() || program == null) {
            throw new FormatCompilationException(
                    "Invalid format program '" + source + "':\n" + diagnostics.summary(), diagnostics.getDiagnostics());
        }
        LOG.debug("Compiled format '{}' into {} step(s) on {}", source, program.steps().size(), program.leadingType().marker());
        return program;
    }

    /**
     * @return The leading type used for programs without a leading marker.
     */
    public IntegerType getDefaultType() {
        return defaultType;
    }
}
