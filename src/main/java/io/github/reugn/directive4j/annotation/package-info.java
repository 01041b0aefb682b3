/**
 * Java annotations that opt classes into compile-time directive processing.
 * <ul>
 *   <li>{@link io.github.reugn.directive4j.annotation.Directives} - expand the Javadoc directives of a class</li>
 * </ul>
 *
 * @see io.github.reugn.directive4j.processor.DirectiveProcessor
 */
package io.github.reugn.directive4j.annotation;
