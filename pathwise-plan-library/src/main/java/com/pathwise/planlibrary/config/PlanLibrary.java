package com.pathwise.planlibrary.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the plan library document: version and plans keyed by plan id.
 * Plan order follows the document; the matcher relies on it to break score ties.
 */
public final class PlanLibrary {

    private final String version;
    private final Map<String, PlanDefinition> plans;

    @JsonCreator
    public PlanLibrary(
            @JsonProperty("version") String version,
            @JsonProperty("plans") Map<String, PlanDefinition> plans) {
        this.version = version;
        this.plans = plans != null ? Collections.unmodifiableMap(new LinkedHashMap<>(plans)) : Map.of();
    }

    /** Empty library: no plan can be selected. */
    public static PlanLibrary empty() {
        return new PlanLibrary(null, Map.of());
    }

    public String getVersion() {
        return version;
    }

    /** Plans by id, in document order. */
    public Map<String, PlanDefinition> getPlans() {
        return plans;
    }

    /** Returns the plan with the given id, or null. */
    public PlanDefinition getPlan(String planId) {
        return planId != null ? plans.get(planId) : null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return plans.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanLibrary that = (PlanLibrary) o;
        return Objects.equals(version, that.version) && Objects.equals(plans, that.plans);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, plans);
    }
}
