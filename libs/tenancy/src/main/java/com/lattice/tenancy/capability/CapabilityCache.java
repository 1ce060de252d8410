package com.lattice.tenancy.capability;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeError;
import com.lattice.common.LatticeException;
import com.lattice.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide, single-flight memo of {@link TenantCapabilities}.
 *
 * <p>The first caller of {@link #ensureDetected()} runs the probe on its own thread; callers that
 * arrive while it runs wait on the same future instead of probing again. The state is derived from
 * the current attempt:
 *
 * <ul>
 *   <li>no attempt: {@link DetectionState#UNINITIALIZED}
 *   <li>attempt running: {@link DetectionState#DETECTING}
 *   <li>attempt finished without error: {@link DetectionState#DETECTED}
 *   <li>attempt finished with a fail-closed result: {@link DetectionState#FAILED}
 * </ul>
 *
 * <p>A failed attempt is not retried implicitly. {@link #reinitialize()} starts a new attempt, or
 * joins the running one.
 */
public final class CapabilityCache {

    private static final Logger log = LoggerFactory.getLogger(CapabilityCache.class);

    static final String PROBES_METRIC = "lattice.capability.probes";
    static final String DETECTION_METRIC = "lattice.capability.detection";

    private final CapabilityProbe probe;
    private final Clock clock;
    private final MetricFactory metrics;
    private final AtomicReference<CompletableFuture<TenantCapabilities>> attempt = new AtomicReference<>();

    public CapabilityCache(CapabilityProbe probe, Clock clock, MetricFactory metrics) {
        if (probe == null) {
            throw new IllegalArgumentException("probe must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.probe = probe;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = metrics;
    }

    /**
     * Returns the detected capabilities, detecting them first if nobody has yet.
     *
     * <p>Never throws for backend failures: a failed detection yields fail-closed OSS capabilities
     * carrying the error.
     */
    public TenantCapabilities ensureDetected() {
        CompletableFuture<TenantCapabilities> current = attempt.get();
        if (current == null) {
            CompletableFuture<TenantCapabilities> mine = new CompletableFuture<>();
            if (attempt.compareAndSet(null, mine)) {
                runDetection(mine);
                return mine.join();
            }
            current = attempt.get();
        }
        return current.join();
    }

    /**
     * Like {@link #ensureDetected()}, but reports a failed attempt as
     * {@link ErrorKind#CAPABILITY_DETECTION_FAILED}. The fail-closed capabilities stay in place for
     * every other caller.
     *
     * @throws LatticeException if the current attempt failed
     */
    public TenantCapabilities ensureCapabilitiesDetected() {
        TenantCapabilities capabilities = ensureDetected();
        if (capabilities.failed()) {
            throw new LatticeException(LatticeError.of(
                    ErrorKind.CAPABILITY_DETECTION_FAILED,
                    "ensureCapabilitiesDetected",
                    "Could not detect graph backend capabilities: " + capabilities.error(),
                    "Check backend connectivity, then re-run capability detection"));
        }
        return capabilities;
    }

    /**
     * Discards the finished attempt and detects again. If an attempt is still running, waits for it
     * instead of starting a second probe.
     */
    public TenantCapabilities reinitialize() {
        while (true) {
            CompletableFuture<TenantCapabilities> current = attempt.get();
            if (current != null && !current.isDone()) {
                return current.join();
            }
            CompletableFuture<TenantCapabilities> mine = new CompletableFuture<>();
            if (attempt.compareAndSet(current, mine)) {
                log.info("Re-initializing capability detection");
                runDetection(mine);
                return mine.join();
            }
        }
    }

    public DetectionState state() {
        CompletableFuture<TenantCapabilities> current = attempt.get();
        if (current == null) {
            return DetectionState.UNINITIALIZED;
        }
        if (!current.isDone()) {
            return DetectionState.DETECTING;
        }
        return current.join().failed() ? DetectionState.FAILED : DetectionState.DETECTED;
    }

    /** Finished capabilities, without triggering detection. */
    public Optional<TenantCapabilities> current() {
        CompletableFuture<TenantCapabilities> current = attempt.get();
        if (current == null || !current.isDone()) {
            return Optional.empty();
        }
        return Optional.of(current.join());
    }

    /** Summary of the current state, without triggering detection. */
    public CapabilitySummary summary() {
        DetectionState state = state();
        return current()
                .map(capabilities -> CapabilitySummary.of(capabilities, state))
                .orElseGet(() -> CapabilitySummary.undetected(state));
    }

    private void runDetection(CompletableFuture<TenantCapabilities> target) {
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            TenantCapabilities result;
            try {
                result = probe.detect();
                if (result == null) {
                    throw new IllegalStateException("capability probe returned no result");
                }
            } catch (RuntimeException e) {
                log.error("Capability probe threw unexpectedly; failing closed", e);
                result = TenantCapabilities.failClosed(e.getMessage(), clock.instant());
            }
            metrics.counter(PROBES_METRIC, "Capability probe runs",
                    "outcome", result.failed() ? "failed" : "detected").increment();
            log.info("Capability detection finished: mode={}, license={}, error={}",
                    result.mode().wireName(), result.licenseType().wireName(), result.error());
            target.complete(result);
        } finally {
            sample.stop(metrics.timer(DETECTION_METRIC, "Capability detection duration"));
            if (!target.isDone()) {
                target.completeExceptionally(new IllegalStateException("capability detection aborted"));
            }
        }
    }
}
