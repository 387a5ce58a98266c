package io.symdiff.cli;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code symdiff} command.
 *
 * <p>Delegates to {@link CliApp#run(String[])} and exits with its code. An unexpected failure
 * is logged and exits with status 1.
 */
public final class SymdiffMain {

    private static final Logger LOG = LoggerFactory.getLogger(SymdiffMain.class);

    private SymdiffMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --diff "x^2" --by x})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code;
        try {
            code = new CliApp(System.out, System.err, System::getenv, Path.of("").toAbsolutePath()).run(args);
        } catch (RuntimeException e) {
            LOG.error("symdiff failed: {}", e.getMessage(), e);
            code = CliApp.EXIT_EXPRESSION_ERROR;
        }
        System.exit(code);
    }
}
