package pipeline;

import config.ConfigLoader;
import util.LoggingUtil;
import org.slf4j.Logger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: {@code Main [config.properties] [log file]}.
 */
public class Main {

    static final String DEFAULT_CONFIG_FILE = "location-check.properties";

    public static void main(String[] args) {
        // must run before the first logger is created
        if (args.length > 1) {
            LoggingUtil.useLogFile(args[1]);
        }
        Logger logger = LoggingUtil.getLogger(Main.class);
        logger.info("Starting location check...");
        logger.info("Java Version: {}", System.getProperty("java.version"));
        logger.info("Working Directory: {}", Paths.get(".").toAbsolutePath().normalize());

        String configArg = (args.length > 0) ? args[0] : DEFAULT_CONFIG_FILE;
        Path configFilePath = null;
        try {
            configFilePath = Paths.get(configArg).toAbsolutePath();
            logger.info("Attempting to use configuration file path: {}", configFilePath);

            ConfigLoader config = new ConfigLoader(configFilePath);
            Pipeline pipeline = Pipeline.fromConfig(config);
            pipeline.run();

            logger.info("Location check finished normally.");
            System.exit(0);

        } catch (InvalidPathException e) {
            logger.error("FATAL: Invalid configuration file path provided: '{}'. Error: {}", configArg, e.getMessage());
            System.err.println("FATAL: Invalid configuration file path: " + e.getMessage());
            System.exit(2);
        } catch (IllegalArgumentException e) {
            logger.error("FATAL: Invalid configuration: {}", e.getMessage(), e);
            System.err.println("FATAL: Invalid configuration: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            logger.error("FATAL: Location check failed due to an unhandled exception: {}", e.getMessage(), e);
            System.err.println("\nFATAL: An unexpected error occurred. Check logs for details.");
            System.err.println("Error Type: " + e.getClass().getName());
            System.err.println("Error Message: " + e.getMessage());
            System.err.println("Config file used: " + (configFilePath != null ? configFilePath : configArg));
            System.exit(1);
        }
    }
}
