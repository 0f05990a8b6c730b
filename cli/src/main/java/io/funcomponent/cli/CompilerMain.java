package io.funcomponent.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the component compiler.
 *
 * <p>Delegates to {@link CompilerApp#run(String[])}. On failure, logs the error and exits with a
 * non-zero status code.
 */
public final class CompilerMain {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerMain.class);

    private CompilerMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --function fn.yaml --output component.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CompilerApp.run(args);
        } catch (Exception e) {
            LOG.error("Compilation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
