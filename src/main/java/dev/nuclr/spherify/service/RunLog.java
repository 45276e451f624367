package dev.nuclr.spherify.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logging sink for one batch run. Progress messages go out at INFO when the
 * run is verbose and at DEBUG otherwise; warnings and errors always keep
 * their level. Nothing here touches global logger configuration.
 */
public final class RunLog {

    private final Logger log;
    private final boolean verbose;

    public RunLog(Logger log, boolean verbose) {
        this.log = log;
        this.verbose = verbose;
    }

    public static RunLog forClass(Class<?> owner, boolean verbose) {
        return new RunLog(LoggerFactory.getLogger(owner), verbose);
    }

    public void progress(String format, Object... args) {
        if (verbose) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    public void warn(String format, Object... args) {
        log.warn(format, args);
    }

    public void error(String format, Object... args) {
        log.error(format, args);
    }
}
