package com.ringside.roster.metrics;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Transition;

import java.time.Duration;

/**
 * Interface for recording roster lifecycle metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry configured.
 */
public interface MetricsService {

    void recordTransitionDuration(EntityType type, Transition transition, Duration duration);

    void incrementTransitionApplied(EntityType type, Transition transition);

    void incrementTransitionRejected(EntityType type, Transition transition);

    void incrementCascadeApplied(String cascade);
}
