package gitclone.cli.mixins;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

/**
 * Options shared by every command: how chatty logging should be.
 */
public class GlobalOptionsMixin {

    @Option(names = { "-v", "--verbose" }, description = "Enable verbose output")
    private boolean verbose;

    @Option(names = { "-q", "--quiet" }, description = "Suppress all output except errors")
    private boolean quiet;

    @Option(names = { "--debug" }, description = "Enable debug output (implies --verbose)")
    private boolean debug;

    /**
     * Configures the root logging level based on the provided options.
     */
    public void configureLogging() {
        Logger rootLogger = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (debug) {
            rootLogger.setLevel(Level.DEBUG);
        } else if (verbose) {
            rootLogger.setLevel(Level.INFO);
        } else if (quiet) {
            rootLogger.setLevel(Level.ERROR);
        } else {
            rootLogger.setLevel(Level.WARN);
        }
    }

    public boolean isVerbose() {
        return verbose || debug;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean isDebug() {
        return debug;
    }
}
