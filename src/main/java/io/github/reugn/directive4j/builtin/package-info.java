/**
 * Built-in directive kinds for routing and model mapping.
 *
 * @see io.github.reugn.directive4j.builtin.BuiltInAnnotations
 */
package io.github.reugn.directive4j.builtin;
