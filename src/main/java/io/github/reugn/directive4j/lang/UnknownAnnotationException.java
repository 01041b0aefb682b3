package io.github.reugn.directive4j.lang;

/**
 * Thrown when a directive names a kind that was never registered.
 */
public class UnknownAnnotationException extends AnnotationException {

    public UnknownAnnotationException(String annotationName) {
        this(annotationName, Target.UNKNOWN_FILE, -1);
    }

    public UnknownAnnotationException(String annotationName, String filePath, long lineNumber) {
        super(annotationName, "Unknown annotation: \"" + annotationName + "\". It must be registered as \""
                + annotationName + AnnotationKind.SUFFIX + "\" before it can be used.", filePath, lineNumber);
    }

    @Override
    UnknownAnnotationException locatedAt(Target target) {
        UnknownAnnotationException located =
                new UnknownAnnotationException(annotationName(), target.filePath(), target.lineNumber());
        located.initCause(this);
        return located;
    }
}
