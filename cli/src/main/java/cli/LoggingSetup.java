package cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * java.util.logging configuration for the command line.
 */
final class LoggingSetup {
    private static final Logger logger = Logger.getLogger(LoggingSetup.class.getName());

    // Strong references so level changes are not lost to garbage collection
    private static final List<Logger> APPLICATION_LOGGERS = List.of(
        Logger.getLogger("probe"),
        Logger.getLogger("report"),
        Logger.getLogger("util"),
        Logger.getLogger("cli"));

    private LoggingSetup() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Load {@code logging.properties} from the classpath, if present.
     */
    static void configure() {
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.warning("Cannot load logging.properties: " + e.getMessage());
        }
    }

    /**
     * Lower application loggers and root handlers to FINE.
     */
    static void enableVerbose() {
        for (Logger applicationLogger : APPLICATION_LOGGERS) {
            applicationLogger.setLevel(Level.FINE);
        }
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }
}
