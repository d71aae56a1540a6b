package org.safearith.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Captures log events during each test and fails the test on events at or above the {@link FailOnLog} level
 * (WARN by default) that no {@link AllowLog} or {@link ExpectLog} covers, and on {@link ExpectLog}s that were not met.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String CAPTURE_KEY = "capture";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(CAPTURE_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(CAPTURE_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        FailOnLog failOn = findFailOnLog(context);
        List<AllowLog> allows = collect(context, AllowLog.class);
        List<ExpectLog> expects = collect(context, ExpectLog.class);

        List<String> problems = new ArrayList<>();
        if (failOn == null || !failOn.disabled()) {
            Level threshold = toLogback(failOn == null ? LogLevel.WARN : failOn.level());
            for (CapturedEvent event : filter.events) {
                boolean covered = allows.stream().anyMatch(a -> event.matches(a.level(), a.loggerPattern(), a.messagePattern()))
                        || expects.stream().anyMatch(e -> event.matches(e.level(), e.loggerPattern(), e.messagePattern()));
                if (event.level.isGreaterOrEqual(threshold) && !covered) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : expects) {
            long seen = filter.events.stream()
                    .filter(e -> e.matches(expect.level(), expect.loggerPattern(), expect.messagePattern()))
                    .count();
            if (seen < expect.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), seen));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static FailOnLog findFailOnLog(ExtensionContext context) {
        return context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
    }

    private static <A extends java.lang.annotation.Annotation> List<A> collect(ExtensionContext context, Class<A> type) {
        Stream<AnnotatedElement> elements = Stream.concat(context.getTestClass().stream(), context.getElement().stream());
        return elements.flatMap(el -> Arrays.stream(el.getAnnotationsByType(type))).toList();
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // Level probes such as isDebugEnabled() arrive without a format.
            if (format != null) {
                String message = MessageFormatter.arrayFormat(format, params).getMessage();
                events.add(new CapturedEvent(logger.getName(), level, message));
            }
            return FilterReply.NEUTRAL;
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {

        boolean matches(LogLevel minLevel, String loggerPattern, String messagePattern) {
            return level.isGreaterOrEqual(toLogback(minLevel))
                    && Pattern.matches(loggerPattern, loggerName)
                    && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(message).matches();
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
