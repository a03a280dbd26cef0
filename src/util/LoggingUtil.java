package util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single access point for SLF4J loggers.
 *
 * <p>Output format, levels and the log file location are owned by the binding's own
 * configuration ({@code logback.xml} on the classpath). The log file path can be moved
 * with the {@code location.log.file} system property, which {@link #useLogFile(String)}
 * sets before the first logger is created.</p>
 */
public final class LoggingUtil {

    /** System property read by {@code logback.xml} for the file appender. */
    public static final String LOG_FILE_PROPERTY = "location.log.file";

    private LoggingUtil() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param clazz the class the messages originate from
     * @return the logger named after {@code clazz}
     */
    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }

    /**
     * Points the file appender at {@code logFile} unless the property was already given
     * on the command line. Only effective when called before logging starts.
     */
    public static void useLogFile(String logFile) {
        if (logFile != null && !logFile.isBlank() && System.getProperty(LOG_FILE_PROPERTY) == null) {
            System.setProperty(LOG_FILE_PROPERTY, logFile);
        }
    }
}
