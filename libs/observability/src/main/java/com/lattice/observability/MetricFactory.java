package com.lattice.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters with the service tag and, when requested, the tenant tag of the
 * current {@link CorrelationContext}.
 *
 * <p>Micrometer deduplicates meters by name and tags, so calling {@link #counter} repeatedly with
 * the same arguments returns the same underlying counter.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Counter tagged with the service name plus {@code tags} (key-value pairs).
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Counter that additionally carries the tenant of the current correlation context
     * ({@code "none"} when no tenant is resolved).
     */
    public Counter tenantCounter(String name, String description, String... tags) {
        String tenant = CorrelationContextHolder.get()
                .map(CorrelationContext::tenantId)
                .orElse("none");
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags).and(TAG_TENANT, tenant))
                .register(registry);
    }

    /** Timer tagged with the service name plus {@code tags}. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by the returned {@link AtomicLong}.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
