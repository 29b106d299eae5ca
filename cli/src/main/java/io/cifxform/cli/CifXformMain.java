package io.cifxform.cli;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the cif-xform command line.
 *
 * <p>Delegates to {@link CifXformCli}. On an unexpected failure, logs the error and exits with a
 * non-zero status code.
 */
public final class CifXformMain {

    private static final Logger LOG = LoggerFactory.getLogger(CifXformMain.class);

    private CifXformMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command and options, e.g. {@code convert --to cif2 structure.cif}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code;
        try {
            code = new CifXformCli(System.out, System.err, System::getenv, Path.of("").toAbsolutePath(), true)
                    .run(args);
        } catch (Exception e) {
            LOG.error("cif-xform failed: {}", e.getMessage(), e);
            code = CifXformCli.EXIT_ERROR;
        }
        System.exit(code);
    }
}
