package io.github.reugn.directive4j.lang;

/**
 * Thrown when directive argument text does not reduce to a valid literal list.
 */
public class AnnotationParseException extends AnnotationException {

    private final String argumentText;

    public AnnotationParseException(String annotationName, String argumentText, String reason) {
        this(annotationName, argumentText, reason, Target.UNKNOWN_FILE, -1);
    }

    public AnnotationParseException(String annotationName, String argumentText, String reason,
                                    String filePath, long lineNumber) {
        super(annotationName, compose(annotationName, argumentText, reason), filePath, lineNumber);
        this.argumentText = argumentText;
    }

    private AnnotationParseException(AnnotationParseException source, Target target) {
        super(source.annotationName(), source.getMessage(), target.filePath(), target.lineNumber(), source);
        this.argumentText = source.argumentText;
    }

    private static String compose(String annotationName, String argumentText, String reason) {
        String directive = annotationName == null ? argumentText : "!" + annotationName + " " + argumentText;
        return "There is an unparseable annotation value: \"" + directive + "\" (" + reason + ")";
    }

    public String argumentText() {
        return argumentText;
    }

    @Override
    AnnotationParseException locatedAt(Target target) {
        return new AnnotationParseException(this, target);
    }
}
