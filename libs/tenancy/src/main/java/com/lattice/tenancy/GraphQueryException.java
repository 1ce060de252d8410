package com.lattice.tenancy;

import java.util.List;

/** The backend answered a GraphQL operation with errors. */
public class GraphQueryException extends RuntimeException {

    private final List<String> errors;

    public GraphQueryException(List<String> errors) {
        super("GraphQL errors: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
