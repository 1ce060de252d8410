package com.lattice.tenancy.guard;

/**
 * A pure capability check. Guards never call the backend and never throw for a denied operation;
 * they return a {@link GuardResult}.
 */
@FunctionalInterface
public interface Guard {

    GuardResult check(GuardContext context);

    /**
     * This guard followed by {@code next}; {@code next} only runs when this guard allows.
     */
    default Guard andThen(Guard next) {
        return context -> {
            GuardResult result = check(context);
            return result.allowed() ? next.check(context) : result;
        };
    }
}
