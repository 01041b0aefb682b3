/**
 * The directive language: extraction, parameter evaluation, kind registry and the
 * validation and expansion framework.
 *
 * <p><b>Pipeline:</b>
 * <pre>
 * comment text
 *     → DirectiveParser      - "!Name args" lines to RawInvocation
 *     → ParameterEvaluator   - argument text to ParameterList
 *     → AnnotationRegistry   - Name to AnnotationKind
 *     → Annotation           - type check, validate, bind, expand
 *     → ClassDescriptor
 * </pre>
 * {@link io.github.reugn.directive4j.lang.AnnotationExpander} drives the pipeline for one
 * comment.
 *
 * <p><b>Errors:</b>
 * All failures extend {@link io.github.reugn.directive4j.lang.AnnotationException} and carry
 * the directive name, file and line.
 */
package io.github.reugn.directive4j.lang;
