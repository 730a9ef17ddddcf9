package org.monkeylang.cli;

import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter behind {@code %levelColor(...)} in the COLOR log format.
 * <p>
 * Wraps the enclosed text in an ANSI color chosen by the event's level. When the
 * {@code NO_COLOR} environment variable is set to a non-empty value, the text is passed
 * through unchanged (see no-color.org).
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";

    private static final Map<Level, String> COLORS = Map.of(
            Level.ERROR, "\u001B[1;31m",
            Level.WARN, "\u001B[33m",
            Level.INFO, "\u001B[34m",
            Level.DEBUG, "\u001B[36m",
            Level.TRACE, "\u001B[2m"
    );

    private boolean enabled = true;

    @Override
    public void start() {
        String noColor = System.getenv("NO_COLOR");
        enabled = noColor == null || noColor.isEmpty();
        super.start();
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return enabled ? colorize(event.getLevel(), in) : in;
    }

    static String colorize(Level level, String text) {
        String color = COLORS.get(level);
        return color == null ? text : color + text + RESET;
    }
}
