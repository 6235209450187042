package com.tempodemo.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Registers Micrometer meters that always carry a {@value #TAG_SERVICE} tag.
 * <p>
 * Extra tags are given as alternating key/value strings. The registry deduplicates by name and
 * tags, so repeated lookups hit the same meter.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }
}
