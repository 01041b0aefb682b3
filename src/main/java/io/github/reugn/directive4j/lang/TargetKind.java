package io.github.reugn.directive4j.lang;

/**
 * The kind of program element a directive is attached to.
 * <p>
 * Supplied by the reflection collaborator that describes the element; the core never
 * inspects program constructs to derive it.
 */
public enum TargetKind {
    CLASS("class", "Classes"),
    METHOD("method", "Methods"),
    PROPERTY("property", "Properties");

    private final String label;
    private final String pluralLabel;

    TargetKind(String label, String pluralLabel) {
        this.label = label;
        this.pluralLabel = pluralLabel;
    }

    /**
     * Returns the singular label used when naming an element in diagnostics.
     *
     * @return e.g. {@code "method"}
     */
    public String label() {
        return label;
    }

    /**
     * Returns the plural label used when listing the kinds a directive is valid on.
     *
     * @return e.g. {@code "Methods"}
     */
    public String pluralLabel() {
        return pluralLabel;
    }
}
