package com.lattice.tenancy.guard;

import com.lattice.common.LatticeError;
import com.lattice.common.LatticeException;
import java.util.Optional;

/**
 * Outcome of a guard: allowed, or a structured error.
 *
 * @param error the failure (null when allowed)
 */
public record GuardResult(LatticeError error) {

    private static final GuardResult ALLOWED = new GuardResult(null);

    public static GuardResult allow() {
        return ALLOWED;
    }

    public static GuardResult deny(LatticeError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new GuardResult(error);
    }

    public boolean allowed() {
        return error == null;
    }

    public Optional<LatticeError> failure() {
        return Optional.ofNullable(error);
    }

    /**
     * Throws the failure as a {@link LatticeException}; returns normally when allowed.
     */
    public void orThrow() {
        if (error != null) {
            throw new LatticeException(error);
        }
    }
}
