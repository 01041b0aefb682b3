package io.github.reugn.directive4j.lang;

import java.util.List;

/**
 * Batched report of everything wrong with one directive instance.
 * <p>
 * The message has the form:
 * <pre>
 * Invalid RouteAnnotation on method "show". Expected usage:
 * !Route METHOD, path [, name: routeName]
 *  == Errors ==
 *  * RouteAnnotation takes at least 2 parameters.
 *  * Invalid parameter: "nme".
 * </pre>
 * The usage block is left out when the directive was attached to the wrong kind of
 * element, since usage describes parameters rather than placement.
 */
public class AnnotationValidationException extends AnnotationException {

    private final List<String> errors;
    private final boolean typeError;

    public AnnotationValidationException(String annotationName, Target target, String usage,
                                         List<String> errors, boolean typeError) {
        super(annotationName, compose(annotationName, target, usage, errors, typeError),
                target.filePath(), target.lineNumber());
        this.errors = List.copyOf(errors);
        this.typeError = typeError;
    }

    private static String compose(String annotationName, Target target, String usage,
                                  List<String> errors, boolean typeError) {
        StringBuilder message = new StringBuilder();
        message.append("Invalid ").append(annotationName).append(" on ").append(target.describe()).append(". ");
        if (!typeError) {
            message.append("Expected usage: \n").append(usage);
        }
        message.append("\n == Errors == \n * ");
        message.append(String.join("\n * ", errors));
        return message.toString();
    }

    /**
     * Every error collected for the instance, in the order they were found.
     */
    public List<String> errors() {
        return errors;
    }

    /**
     * Whether the directive was placed on a kind of element it does not apply to.
     */
    public boolean isTypeError() {
        return typeError;
    }

    @Override
    AnnotationValidationException locatedAt(Target target) {
        return this;
    }
}
