package com.tyron.nanovim.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output of the interpreter packages via system property:
 * - nanovim.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE|OFF
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "nanovim.test.logLevel";

    private static final String ROOT_PACKAGE = "com.tyron.nanovim";

    // Held strongly; LogManager only keeps weak references to configured loggers.
    private static Logger packageLogger;

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY));

        Handler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new KeyTraceFormatter());

        packageLogger = Logger.getLogger(ROOT_PACKAGE);
        packageLogger.setLevel(level);
        packageLogger.setUseParentHandlers(false);
        packageLogger.addHandler(console);

        packageLogger.log(Level.CONFIG, "test logging level=" + level.getName());
    }

    static Level parseLevel(String raw) {
        if (raw == null || raw.isBlank()) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    /**
     * One line per record: {@code 12:00:00.000 FINE    VimInterpreter  Mode NORMAL -> INSERT}.
     */
    private static final class KeyTraceFormatter extends Formatter {

        private static final DateTimeFormatter TIME = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(96);
            out.append(TIME.format(Instant.ofEpochMilli(record.getMillis()))).append(' ');
            out.append(String.format(Locale.ROOT, "%-7s %-15s ", record.getLevel().getName(),
                    simpleName(record.getLoggerName())));
            out.append(formatMessage(record)).append('\n');

            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                out.append(trace);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isEmpty()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
