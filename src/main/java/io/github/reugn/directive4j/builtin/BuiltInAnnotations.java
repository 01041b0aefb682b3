package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.lang.AnnotationRegistry;

/**
 * The directives shipped with directive4j.
 * <p>
 * <table border="1">
 *   <caption>Built-in directives</caption>
 *   <tr><th>Directive</th><th>Valid on</th><th>Contributes</th></tr>
 *   <tr><td>{@code !Route}</td><td>Methods</td><td>route definitions</td></tr>
 *   <tr><td>{@code !Prefix}</td><td>Classes</td><td>route prefix</td></tr>
 *   <tr><td>{@code !Column}</td><td>Properties</td><td>column definitions</td></tr>
 *   <tr><td>{@code !Table}</td><td>Classes</td><td>table name</td></tr>
 *   <tr><td>{@code !Source}</td><td>Classes</td><td>data source name</td></tr>
 *   <tr><td>{@code !HasMany}</td><td>Classes</td><td>one-to-many relationships</td></tr>
 *   <tr><td>{@code !BelongsTo}</td><td>Classes</td><td>owning relationships</td></tr>
 * </table>
 */
public final class BuiltInAnnotations {

    private BuiltInAnnotations() {
    }

    /**
     * Registers every built-in directive on {@code builder}.
     *
     * @param builder the registry under construction
     * @return {@code builder}
     */
    public static AnnotationRegistry.Builder registerAll(AnnotationRegistry.Builder builder) {
        return builder
                .register(RouteAnnotation.class, RouteAnnotation::new)
                .register(PrefixAnnotation.class, PrefixAnnotation::new)
                .register(ColumnAnnotation.class, ColumnAnnotation::new)
                .register(TableAnnotation.class, TableAnnotation::new)
                .register(SourceAnnotation.class, SourceAnnotation::new)
                .register(HasManyAnnotation.class, HasManyAnnotation::new)
                .register(BelongsToAnnotation.class, BelongsToAnnotation::new);
    }
}
