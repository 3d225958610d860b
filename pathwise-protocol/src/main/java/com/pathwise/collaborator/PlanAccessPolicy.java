package com.pathwise.collaborator;

import java.util.Optional;
import java.util.Set;

/**
 * Access-control collaborator that may restrict which plans a session can activate.
 */
@FunctionalInterface
public interface PlanAccessPolicy {

    /** No restriction. */
    PlanAccessPolicy UNRESTRICTED = Optional::empty;

    /** Allowed plan ids; empty Optional means every plan is allowed. */
    Optional<Set<String>> allowedPlanIds();

    static PlanAccessPolicy allowOnly(Set<String> planIds) {
        Set<String> copy = Set.copyOf(planIds);
        return () -> Optional.of(copy);
    }
}
