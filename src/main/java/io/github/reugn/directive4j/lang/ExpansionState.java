package io.github.reugn.directive4j.lang;

/**
 * Lifecycle of one {@link Annotation} instance.
 * <pre>
 * PARSED -> TYPE_CHECKED -> VALIDATED -> BOUND -> EXPANDED
 *                               |           |
 *                               +-> FAILED <+
 * </pre>
 */
public enum ExpansionState {
    /**
     * Created from a directive and holding its parameters.
     */
    PARSED,
    /**
     * Target kind checked against the kind's applicability.
     */
    TYPE_CHECKED,
    /**
     * Kind-specific rules ran and found nothing wrong.
     */
    VALIDATED,
    /**
     * Parameters copied onto the instance and released.
     */
    BOUND,
    /**
     * The descriptor was mutated.
     */
    EXPANDED,
    /**
     * Errors were found; the instance never reaches expansion.
     */
    FAILED
}
