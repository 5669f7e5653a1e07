package com.ringside.roster.metrics;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Transition;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordTransitionDuration(EntityType type, Transition transition, Duration duration) {
    }

    @Override
    public void incrementTransitionApplied(EntityType type, Transition transition) {
    }

    @Override
    public void incrementTransitionRejected(EntityType type, Transition transition) {
    }

    @Override
    public void incrementCascadeApplied(String cascade) {
    }
}
