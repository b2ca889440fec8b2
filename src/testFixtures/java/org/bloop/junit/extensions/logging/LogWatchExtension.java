package org.bloop.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at or above the watched level (WARN by default) unless the event
 * is covered by {@link AllowLog} or {@link ExpectLog}, and when an {@link ExpectLog} is not met.
 * <p>
 * A Logback {@link TurboFilter} captures events for the duration of each test. Allowed and
 * expected events are swallowed so they do not clutter the build output.
 * </p>
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        Rules rules = filter.rules;
        if (!rules.disabled) {
            for (Event event : filter.events) {
                if (!rules.isTolerated(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = filter.events.stream().filter(e -> e.matches(expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        private Rules(Level minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        static Rules resolve(ExtensionContext context) {
            FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                    .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            for (AnnotatedElement element : annotatedElements(context)) {
                allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
            }
            LogLevel level = fail != null ? fail.level() : LogLevel.WARN;
            return new Rules(level.toLogback(), fail != null && fail.disabled(), allows, expects);
        }

        private static List<AnnotatedElement> annotatedElements(ExtensionContext context) {
            List<AnnotatedElement> elements = new ArrayList<>();
            context.getTestClass().ifPresent(elements::add);
            context.getTestMethod().ifPresent(elements::add);
            return elements;
        }

        boolean isTolerated(Event event) {
            return allows.stream().anyMatch(a -> event.matches(a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> event.matches(e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        final Rules rules;
        final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(rules.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.isTolerated(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private static final class Event {
        final String loggerName;
        final Level level;
        final String message;

        Event(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        boolean matches(LogLevel minLevel, String loggerPattern, String messagePattern) {
            return level.isGreaterOrEqual(minLevel.toLogback())
                    && Pattern.matches(loggerPattern, loggerName)
                    && Pattern.matches(messagePattern, message);
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
