package work.forge.scaffold.api;

import java.util.Locale;

/**
 * CLI log levels, mapped onto the simple logger's level names.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("error");

    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    private final String simpleLoggerLevel;

    LogLevel(String simpleLoggerLevel) {
        this.simpleLoggerLevel = simpleLoggerLevel;
    }

    public String simpleLoggerLevel() {
        return simpleLoggerLevel;
    }

    /**
     * Sets the default level of the simple logger. Only loggers created afterwards pick it up.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_LEVEL, simpleLoggerLevel);
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
