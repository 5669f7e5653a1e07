package com.ringside.roster.metrics;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Transition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code roster.transition.duration} - Timer (tags: entityType, transition)</li>
 *   <li>{@code roster.transition.applied} - Counter (tags: entityType, transition)</li>
 *   <li>{@code roster.transition.rejected} - Counter (tags: entityType, transition)</li>
 *   <li>{@code roster.cascade.applied} - Counter (tag: cascade)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordTransitionDuration(EntityType type, Transition transition, Duration duration) {
        String key = type.name() + ":" + transition.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("roster.transition.duration")
                        .description("Duration of lifecycle transitions including cascades")
                        .tag("entityType", type.name())
                        .tag("transition", transition.getLabel())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTransitionApplied(EntityType type, Transition transition) {
        transitionCounter("roster.transition.applied", "Number of lifecycle transitions applied",
                type, transition).increment();
    }

    @Override
    public void incrementTransitionRejected(EntityType type, Transition transition) {
        transitionCounter("roster.transition.rejected", "Number of lifecycle transitions rejected",
                type, transition).increment();
    }

    @Override
    public void incrementCascadeApplied(String cascade) {
        String key = "cascade:" + cascade;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("roster.cascade.applied")
                        .description("Number of cascades fired by lifecycle transitions")
                        .tag("cascade", cascade)
                        .register(registry));
        counter.increment();
    }

    private Counter transitionCounter(String name, String description, EntityType type, Transition transition) {
        String key = name + ":" + type.name() + ":" + transition.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .tag("transition", transition.getLabel())
                        .register(registry));
    }
}
