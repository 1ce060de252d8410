package com.lattice.gateway.backend;

/** The graph backend answered with a server error. */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }
}
