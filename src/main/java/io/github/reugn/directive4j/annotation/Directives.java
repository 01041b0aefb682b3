package io.github.reugn.directive4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class whose Javadoc directives are expanded at compile time.
 * <p>
 * The processor reads the Javadoc of the class, then of each of its methods and fields in
 * declaration order, and applies every {@code !Name ...} directive it finds to one
 * descriptor.
 *
 * <p><b>Example:</b>
 * <pre>
 * /**
 *  * !Table users
 *  * !HasMany posts
 *  *&#47;
 * &#64;Directives
 * public class User {
 *     /** !Column integer, PrimaryKey, AutoIncrement *&#47;
 *     long id;
 *
 *     /** !Column string, nullable: false *&#47;
 *     String name;
 * }
 * </pre>
 * Generates {@code UserDirectives} with a static {@code descriptor()} method returning the
 * expanded {@link io.github.reugn.directive4j.descriptor.ClassDescriptor}.
 * <p>
 * Invalid directives fail the compilation with the full list of problems for each one.
 *
 * @see io.github.reugn.directive4j.processor.DirectiveProcessor
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface Directives {

    /**
     * Whether to generate the {@code {ClassName}Directives} class. When {@code false}
     * directives are still validated.
     *
     * @return {@code true} to generate the descriptor class
     */
    boolean generate() default true;
}
