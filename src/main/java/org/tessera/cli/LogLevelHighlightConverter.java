package org.tessera.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter for log level colouring in terminal output.
 *
 * <p>Colours:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow (skipped scenes and resolutions)</li>
 *   <li>INFO - Cyan</li>
 *   <li>DEBUG/TRACE - Dim</li>
 * </ul>
 *
 * <p>A non-empty {@code NO_COLOR} environment variable turns colouring off.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String CYAN = "\u001B[36m";
    private static final String DIM = "\u001B[2m";

    private final boolean colourEnabled;

    public LogLevelHighlightConverter() {
        this(isColourWanted(System.getenv("NO_COLOR")));
    }

    LogLevelHighlightConverter(boolean colourEnabled) {
        this.colourEnabled = colourEnabled;
    }

    static boolean isColourWanted(String noColor) {
        return noColor == null || noColor.isEmpty();
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!colourEnabled) {
            return in;
        }
        String colour = colourFor(event.getLevel());
        return colour == null ? in : colour + in + RESET;
    }

    private static String colourFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> RED;
            case Level.WARN_INT -> YELLOW;
            case Level.INFO_INT -> CYAN;
            case Level.DEBUG_INT, Level.TRACE_INT -> DIM;
            default -> null;
        };
    }
}
