/**
 * Annotation processor implementation for directive4j.
 * <p>
 * This package contains the compile-time processor that expands the Javadoc directives of
 * {@link io.github.reugn.directive4j.annotation.Directives} classes and generates their
 * descriptor companions.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * DirectiveProcessor (entry point)
 *     ├── ElementTargets      - Elements to directive targets
 *     ├── AnnotationExpander  - Directive expansion (lang package)
 *     └── DescriptorGenerator - {ClassName}Directives companions
 *
 * Support:
 *     └── ErrorReporter       - Error reporting interface
 * </pre>
 *
 * @see io.github.reugn.directive4j.annotation
 * @see io.github.reugn.directive4j.lang
 */
package io.github.reugn.directive4j.processor;
