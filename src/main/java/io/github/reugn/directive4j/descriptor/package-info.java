/**
 * Class metadata produced by directive expansion.
 */
package io.github.reugn.directive4j.descriptor;
