package io.github.reugn.directive4j.lang;

import java.util.Objects;
import java.util.Set;

/**
 * Reflection metadata for the program element a comment belongs to.
 * <p>
 * Instances are produced by the host's reflection layer (for example
 * {@link io.github.reugn.directive4j.processor.DirectiveProcessor} at compile time) and are
 * read-only inputs to expansion.
 *
 * @param kind               what the element is
 * @param declaringClassName qualified name of the class that declares the element
 *                           (the class itself for {@link TargetKind#CLASS})
 * @param elementName        simple name of the method or property, or the qualified class name
 * @param filePath           source file of the element, for diagnostics
 * @param lineNumber         line of the element in {@code filePath}, or {@code -1} when unknown
 * @param supertypes         qualified names of every supertype of the declaring class
 */
public record Target(TargetKind kind, String declaringClassName, String elementName,
                     String filePath, long lineNumber, Set<String> supertypes) {

    /**
     * Placeholder used when the reflection layer cannot tell where an element was declared.
     */
    public static final String UNKNOWN_FILE = "<unknown>";

    public Target {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(declaringClassName, "declaringClassName");
        Objects.requireNonNull(elementName, "elementName");
        filePath = filePath == null ? UNKNOWN_FILE : filePath;
        supertypes = supertypes == null ? Set.of() : Set.copyOf(supertypes);
    }

    /**
     * Describes a class.
     */
    public static Target forClass(String className, String filePath, long lineNumber, Set<String> supertypes) {
        return new Target(TargetKind.CLASS, className, className, filePath, lineNumber, supertypes);
    }

    /**
     * Describes a method of {@code declaringClassName}.
     */
    public static Target forMethod(String declaringClassName, String methodName, String filePath,
                                   long lineNumber, Set<String> supertypes) {
        return new Target(TargetKind.METHOD, declaringClassName, methodName, filePath, lineNumber, supertypes);
    }

    /**
     * Describes a property (field) of {@code declaringClassName}.
     */
    public static Target forProperty(String declaringClassName, String propertyName, String filePath,
                                     long lineNumber, Set<String> supertypes) {
        return new Target(TargetKind.PROPERTY, declaringClassName, propertyName, filePath, lineNumber, supertypes);
    }

    /**
     * Returns the simple name of the declaring class.
     *
     * @return the part of {@link #declaringClassName()} after the last dot
     */
    public String declaringSimpleName() {
        int lastDot = declaringClassName.lastIndexOf('.');
        return lastDot >= 0 ? declaringClassName.substring(lastDot + 1) : declaringClassName;
    }

    /**
     * Checks whether the declaring class extends or implements {@code baseClassName}.
     *
     * @param baseClassName qualified name of the supertype
     * @return {@code true} if it is a proper supertype of the declaring class
     */
    public boolean isSubclassOf(String baseClassName) {
        return !declaringClassName.equals(baseClassName) && supertypes.contains(baseClassName);
    }

    /**
     * Names the element the way diagnostics refer to it.
     * <p>
     * Properties are resolved against their declaring class:
     * {@code property "title" of class "app.Post"}.
     *
     * @return a human-readable description of the element
     */
    public String describe() {
        if (kind == TargetKind.PROPERTY) {
            return kind.label() + " \"" + elementName + "\" of class \"" + declaringClassName + "\"";
        }
        return kind.label() + " \"" + elementName + "\"";
    }
}
