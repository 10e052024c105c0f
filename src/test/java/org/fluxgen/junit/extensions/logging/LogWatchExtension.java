package org.fluxgen.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at or above the watched level without announcing it.
 * <p>
 * Announced events ({@link AllowLog}, {@link ExpectLog}) are kept off the console. Every
 * {@link ExpectLog} must be met by at least its number of occurrences, otherwise the test
 * fails as well. Class-level and method-level annotations are merged.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create("org.fluxgen.junit.extensions.logging.LogWatchExtension");
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(rulesFor(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.clear();
            filter.rules = rulesFor(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Captured> events = filter.drain();
        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (Captured e : events) {
                if (!rules.announces(e)) {
                    problems.add("Unexpected log: [" + e.level() + "] " + e.logger() + " - " + e.message());
                }
            }
        }
        for (ExpectLog exp : rules.expects()) {
            long count = events.stream().filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())).count();
            if (count < exp.occurrences()) {
                problems.add(String.format("Missing log: expected %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules rulesFor(ExtensionContext context) {
        List<AnnotatedElement> sources = new ArrayList<>();
        context.getTestClass().ifPresent(sources::add);
        context.getTestMethod().ifPresent(sources::add);

        FailOnLog fail = null;
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        for (AnnotatedElement source : sources) {
            FailOnLog f = source.getAnnotation(FailOnLog.class);
            if (f != null) {
                fail = f;
            }
            allows.addAll(List.of(source.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(source.getAnnotationsByType(ExpectLog.class)));
        }
        LogLevel min = fail != null ? fail.level() : LogLevel.WARN;
        return new Rules(toLogback(min), fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(Captured e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level().isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.logger())
                && Pattern.matches(messagePattern, e.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Captured(String logger, Level level, String message) {
    }

    private record Rules(Level minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean announces(Captured e) {
            for (AllowLog a : allows) {
                if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog x : expects) {
                if (matches(e, x.level(), x.loggerPattern(), x.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingFilter extends TurboFilter {

        private final List<Captured> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            // isXxxEnabled() checks arrive without a format
            if (format == null || !level.isGreaterOrEqual(current.minLevel())) {
                return FilterReply.NEUTRAL;
            }
            Captured e = new Captured(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(e);
            return current.announces(e) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Captured> drain() {
            List<Captured> copy = new ArrayList<>(events);
            events.clear();
            return copy;
        }

        void clear() {
            events.clear();
        }
    }
}
