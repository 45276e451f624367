package dev.nuclr.spherify.service;

/**
 * Why a target produced no image.
 */
public enum FailureReason {
    /** Missing file or no read permission. */
    UNREADABLE,
    /** Not an image any decoder recognises. */
    UNRECOGNIZED,
    /** The engine executable could not be launched. */
    ENGINE_NOT_FOUND,
    /** The engine wrote to stderr. */
    ENGINE_STDERR,
    /** Non-zero exit status while strict checking is on. */
    ENGINE_EXIT_STATUS,
    /** The engine ran past the configured timeout and was killed. */
    ENGINE_TIMEOUT,
    /** Pipe or process I/O broke during the exchange. */
    ENGINE_IO,
    /** stdout did not hold a raster of the expected size. */
    MALFORMED_OUTPUT
}
