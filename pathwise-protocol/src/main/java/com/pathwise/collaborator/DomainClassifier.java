package com.pathwise.collaborator;

/**
 * Supplies the domain tag of the current conversation (e.g. "coding", "devops").
 * Used only to filter plans at selection time.
 */
@FunctionalInterface
public interface DomainClassifier {

    /** Classifier that never knows the domain; only tagless plans can match. */
    DomainClassifier UNKNOWN = () -> "";

    /** Current domain tag; empty string when unknown. */
    String currentDomain();
}
