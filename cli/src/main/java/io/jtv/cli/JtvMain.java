package io.jtv.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code jtv} command. Delegates to {@link CliApp} and exits with its status.
 */
public final class JtvMain {

    private static final Logger LOG = LoggerFactory.getLogger(JtvMain.class);

    private JtvMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new CliApp(System.out, System.err, System::getenv).run(args);
        } catch (Exception e) {
            LOG.error("Unexpected failure: {}", e.getMessage(), e);
            status = 1;
        }
        System.exit(status);
    }
}
