package com.ringside.roster.cascade;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the cascades registered for an applied transition, in registration order.
 * Cascades write through the primary transition's transaction, so a failing
 * cascade rolls the primary transition back with it.
 */
public class CascadeEngine {
    private static final Logger log = LoggerFactory.getLogger(CascadeEngine.class);

    private final Map<Transition, List<CascadeStrategy>> byTrigger = new EnumMap<>(Transition.class);
    private final MetricsService metricsService;

    public CascadeEngine(List<CascadeStrategy> strategies, MetricsService metricsService) {
        this.metricsService = metricsService;
        for (CascadeStrategy strategy : strategies) {
            for (Transition trigger : strategy.triggers()) {
                byTrigger.computeIfAbsent(trigger, t -> new ArrayList<>()).add(strategy);
            }
        }
    }

    public List<CascadeStrategy> strategiesFor(Transition transition) {
        return List.copyOf(byTrigger.getOrDefault(transition, List.of()));
    }

    /**
     * Fires every cascade that applies to the context's subject type and transition.
     *
     * @return total number of related changes
     */
    public int fire(CascadeContext context) {
        int total = 0;
        for (CascadeStrategy strategy : byTrigger.getOrDefault(context.transition(), List.of())) {
            if (!strategy.appliesTo(context.subject().type(), context.transition())) {
                continue;
            }
            int affected = strategy.apply(context);
            if (affected > 0) {
                total += affected;
                metricsService.incrementCascadeApplied(strategy.name());
                context.unit().audit(AuditAction.CASCADE_APPLIED, context.subject(), context.now(), Map.of(
                        "cascade", strategy.name(),
                        "transition", context.transition().getLabel(),
                        "affected", affected,
                        "effectiveDate", context.effectiveDate().toString()));
                log.info("cascade.applied cascade={} subject={} transition={} affected={}",
                        strategy.name(), context.subject(), context.transition().getLabel(), affected);
            }
        }
        return total;
    }
}
