package io.github.reugn.directive4j.descriptor;

import java.util.Objects;

/**
 * One route contributed by a {@code !Route} directive.
 *
 * @param method  HTTP method, upper case
 * @param path    full path including any class-level prefix
 * @param name    optional route name, {@code null} when not given
 * @param handler name of the method that handles the route
 */
public record RouteDefinition(String method, String path, String name, String handler) {

    public RouteDefinition {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(handler, "handler");
    }
}
