package dev.nuclr.spherify.service;

/**
 * The user declined to start a batch at the pre-flight check.
 */
public class AbortedException extends Exception {

    private static final long serialVersionUID = 1L;

    public AbortedException(String message) {
        super(message);
    }
}
