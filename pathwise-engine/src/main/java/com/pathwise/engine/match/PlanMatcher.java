package com.pathwise.engine.match;

import com.pathwise.planlibrary.config.PlanDefinition;
import com.pathwise.planlibrary.config.PlanLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the plan to activate for a user message by trigger hits. Stateless.
 * <p>
 * A plan is eligible when it has a graph, is allowed by the access list (if any), matches the
 * current domain (or declares none) and has at least {@code trigger_threshold} trigger hits.
 * The highest score wins; on a tie the plan listed first in the library wins.
 */
public final class PlanMatcher {

    private static final Logger log = LoggerFactory.getLogger(PlanMatcher.class);

    private static final double DOMAIN_BONUS = 1.0;

    public Optional<PlanMatch> match(PlanLibrary library, String domain, String message,
                                     Optional<Set<String>> allowedPlanIds) {
        if (library == null || library.isEmpty() || message == null || message.isBlank()) {
            return Optional.empty();
        }
        String text = message.toLowerCase(Locale.ROOT);
        PlanMatch best = null;
        for (Map.Entry<String, PlanDefinition> entry : library.getPlans().entrySet()) {
            String planId = entry.getKey();
            PlanDefinition plan = entry.getValue();
            if (!plan.hasGraph()) {
                continue;
            }
            if (allowedPlanIds.isPresent() && !allowedPlanIds.get().contains(planId)) {
                continue;
            }
            boolean hasDomains = !plan.getDomains().isEmpty();
            if (hasDomains && !plan.getDomains().contains(domain)) {
                continue;
            }
            int hits = countHits(plan, text);
            if (hits < plan.getTriggerThreshold()) {
                continue;
            }
            double score = hits + (hasDomains ? DOMAIN_BONUS : 0.0);
            if (best == null || score > best.score()) {
                best = new PlanMatch(planId, plan, hits, score);
            }
        }
        if (best != null) {
            log.debug("Plan matched | planId={} | hits={} | score={}", best.planId(), best.hits(), best.score());
        }
        return Optional.ofNullable(best);
    }

    private static int countHits(PlanDefinition plan, String text) {
        int hits = 0;
        for (String trigger : plan.getTriggers()) {
            if (trigger != null && !trigger.isEmpty() && text.contains(trigger.toLowerCase(Locale.ROOT))) {
                hits++;
            }
        }
        return hits;
    }
}
