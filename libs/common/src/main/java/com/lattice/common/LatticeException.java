package com.lattice.common;

/**
 * Unchecked carrier for a {@link LatticeError}.
 *
 * <p>Callers dispatch on {@link #kind()}, not on subclasses.
 */
public class LatticeException extends RuntimeException {

    private final LatticeError error;

    public LatticeException(LatticeError error) {
        super(error.message());
        this.error = error;
    }

    public LatticeException(LatticeError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public LatticeError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }

    /**
     * Wraps any storage or transport failure so that the caller never sees the raw exception type.
     */
    public static LatticeException backend(String operation, String details, Throwable cause) {
        return new LatticeException(
                LatticeError.of(
                        ErrorKind.BACKEND_ERROR,
                        operation,
                        details,
                        "Check graph backend connectivity and configuration"),
                cause);
    }

    /** Shorthand for a malformed-request failure. */
    public static LatticeException invalidInput(String operation, String details) {
        return new LatticeException(
                LatticeError.of(ErrorKind.INVALID_NODE_INPUT, operation, details, ""));
    }
}
