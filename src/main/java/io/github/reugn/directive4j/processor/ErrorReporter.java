package io.github.reugn.directive4j.processor;

import io.github.reugn.directive4j.lang.AnnotationException;

import javax.lang.model.element.Element;

/**
 * Interface for reporting compilation errors.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports an error on the given element.
     *
     * @param element the element the failing directive is attached to
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * Reports a directive failure and every failure suppressed by it, one error each.
     *
     * @param element the element whose comment held the directives
     * @param failure the failure thrown by expansion
     */
    default void error(Element element, AnnotationException failure) {
        error(element, failure.getMessage());
        for (Throwable suppressed : failure.getSuppressed()) {
            error(element, suppressed.getMessage());
        }
    }
}
