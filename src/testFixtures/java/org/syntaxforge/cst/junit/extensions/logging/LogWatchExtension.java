package org.syntaxforge.cst.junit.extensions.logging;

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
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is allowed with {@link AllowLog}
 * or expected with {@link ExpectLog}. Expected events that never happen fail the test too.
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

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (Event e : filter.events) {
                if (!rules.isAllowed(e) && !rules.isExpected(e)) {
                    problems.add("Unexpected log: " + e);
                }
            }
        }
        for (ExpectLog expect : rules.expects()) {
            long count = filter.events.stream().filter(e -> Rules.matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
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

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules resolve(ExtensionContext context) {
            Optional<FailOnLog> fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                    .or(() -> context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)));
            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            context.getTestClass().ifPresent(c -> collect(c, allows, expects));
            context.getElement().ifPresent(el -> collect(el, allows, expects));
            return new Rules(
                    fail.map(FailOnLog::level).orElse(LogLevel.WARN),
                    fail.map(FailOnLog::disabled).orElse(false),
                    allows,
                    expects);
        }

        private static void collect(AnnotatedElement element, List<AllowLog> allows, List<ExpectLog> expects) {
            allows.addAll(Arrays.asList(element.getAnnotationsByType(AllowLog.class)));
            expects.addAll(Arrays.asList(element.getAnnotationsByType(ExpectLog.class)));
        }

        boolean isAllowed(Event e) {
            return allows.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()));
        }

        boolean isExpected(Event e) {
            return expects.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }

        static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
            return e.level().isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, e.loggerName())
                    && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(e.message()).matches();
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (level == null || !level.isGreaterOrEqual(toLogback(rules.minLevel()))) {
                return FilterReply.NEUTRAL;
            }
            // isXxxEnabled() probes reach turbo filters without a format; only record real events.
            if (format == null) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message);
            events.add(event);
            return rules.isAllowed(event) || rules.isExpected(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
