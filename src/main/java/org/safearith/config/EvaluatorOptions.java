package org.safearith.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.safearith.runtime.model.IntegerType;

import java.util.Objects;

/**
 * Settings of the format evaluator, read from the {@code safe-arith.evaluator} section.
 *
 * @param defaultType The leading type of programs without a leading marker.
 * @param traceSteps Whether every applied step is logged at TRACE level.
 */
public record EvaluatorOptions(IntegerType defaultType, boolean traceSteps) {

    /** The configuration path of the evaluator section. */
    public static final String PATH = "safe-arith.evaluator";

    public EvaluatorOptions {
        Objects.requireNonNull(defaultType, "defaultType");
    }

    /**
     * @return The built-in settings: {@code s32} leading type, no step tracing.
     */
    public static EvaluatorOptions defaults() {
        return new EvaluatorOptions(IntegerType.DEFAULT, false);
    }

    /**
     * Maps a loaded configuration to evaluator settings.
     *
     * @param config The configuration, usually from {@link ConfigLoader#load()}.
     * @return The settings.
     * @throws ConfigException.Missing if a key is absent.
     * @throws ConfigException.BadValue if {@code default-type} is not a type marker.
     */
    public static EvaluatorOptions fromConfig(Config config) {
        Config section = config.getConfig(PATH);
        String marker = section.getString("default-type");
        IntegerType defaultType = IntegerType.fromMarker(marker)
                .orElseThrow(() -> new ConfigException.BadValue(PATH + ".default-type",
                        "'" + marker + "' is not one of u8, s8, u16, s16, u32, s32, u64, s64"));
        return new EvaluatorOptions(defaultType, section.getBoolean("trace-steps"));
    }
}
