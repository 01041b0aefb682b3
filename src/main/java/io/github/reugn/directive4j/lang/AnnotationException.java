package io.github.reugn.directive4j.lang;

/**
 * Base class for every failure raised while processing a directive.
 * <p>
 * Carries the directive name and the source location of the element it was attached to,
 * so a host can report the failure without parsing the message.
 *
 * @see AnnotationParseException
 * @see UnknownAnnotationException
 * @see AnnotationValidationException
 */
public class AnnotationException extends RuntimeException {

    private final String annotationName;
    private final String filePath;
    private final long lineNumber;

    public AnnotationException(String annotationName, String message, String filePath, long lineNumber) {
        this(annotationName, message, filePath, lineNumber, null);
    }

    public AnnotationException(String annotationName, String message, String filePath, long lineNumber,
                               Throwable cause) {
        super(message, cause);
        this.annotationName = annotationName;
        this.filePath = filePath == null ? Target.UNKNOWN_FILE : filePath;
        this.lineNumber = lineNumber;
    }

    /**
     * Name of the directive that failed, as written after the {@code !} or as the kind's
     * class name once the kind is known.
     */
    public String annotationName() {
        return annotationName;
    }

    public String filePath() {
        return filePath;
    }

    /**
     * @return the line of the annotated element, or {@code -1} when unknown
     */
    public long lineNumber() {
        return lineNumber;
    }

    /**
     * Returns a copy of this failure located at {@code target}.
     *
     * @param target the element the failing directive was attached to
     * @return an exception of the same type carrying the target's file and line
     */
    AnnotationException locatedAt(Target target) {
        return new AnnotationException(annotationName, getMessage(), target.filePath(), target.lineNumber(), this);
    }
}
