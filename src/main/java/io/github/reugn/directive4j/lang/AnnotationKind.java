package io.github.reugn.directive4j.lang;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A registered directive kind: its canonical name and a factory for fresh instances.
 *
 * @param name    canonical name, the simple class name ending in {@value #SUFFIX}
 * @param type    the implementing class
 * @param factory creates one new, uninitialized instance per directive occurrence
 */
public record AnnotationKind(String name, Class<? extends Annotation> type, Supplier<? extends Annotation> factory) {

    /**
     * Suffix every kind's class name carries; {@code !Route} resolves to {@code RouteAnnotation}.
     */
    public static final String SUFFIX = "Annotation";

    public AnnotationKind {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
    }

    /**
     * Derives the kind from its implementing class.
     *
     * @param type    class whose simple name ends in {@value #SUFFIX}
     * @param factory instance factory
     * @return the kind
     * @throws IllegalArgumentException if the class name lacks the suffix
     */
    public static <T extends Annotation> AnnotationKind of(Class<T> type, Supplier<? extends T> factory) {
        String name = type.getSimpleName();
        if (!name.endsWith(SUFFIX) || name.length() == SUFFIX.length()) {
            throw new IllegalArgumentException("Annotation class '" + type.getName()
                    + "' must be named <Directive>" + SUFFIX + " to be registered.");
        }
        return new AnnotationKind(name, type, factory);
    }

    /**
     * The identifier written after {@code !} in comments.
     *
     * @return e.g. {@code "Route"} for {@code RouteAnnotation}
     */
    public String directiveName() {
        return name.substring(0, name.length() - SUFFIX.length());
    }

    /**
     * Creates a new instance of this kind.
     *
     * @return a fresh instance in the {@link ExpansionState#PARSED} state
     */
    public Annotation newInstance() {
        return factory.get();
    }
}
