package com.pathwise.engine.match;

import com.pathwise.planlibrary.config.PlanDefinition;

/**
 * Winning plan for a message.
 *
 * @param planId plan id in the library
 * @param plan   plan definition
 * @param hits   distinct triggers found in the message
 * @param score  hits, plus one when the plan declares domains
 */
public record PlanMatch(String planId, PlanDefinition plan, int hits, double score) {
}
