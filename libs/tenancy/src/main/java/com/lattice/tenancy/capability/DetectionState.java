package com.lattice.tenancy.capability;

/**
 * Lifecycle of {@link CapabilityCache}: {@code UNINITIALIZED -> DETECTING -> DETECTED | FAILED}.
 * {@code FAILED} ends an attempt; only {@link CapabilityCache#reinitialize()} starts another.
 */
public enum DetectionState {
    UNINITIALIZED,
    DETECTING,
    DETECTED,
    FAILED
}
