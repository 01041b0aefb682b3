package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.descriptor.RouteDefinition;
import io.github.reugn.directive4j.lang.Annotation;
import io.github.reugn.directive4j.lang.Target;
import io.github.reugn.directive4j.lang.TargetKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Maps an HTTP method and path to the annotated handler method.
 * <pre>
 * !Route GET, '/users/:id', name: 'users.show'
 * </pre>
 * The path is joined to the class-level {@code !Prefix}, when one was expanded first.
 */
public class RouteAnnotation extends Annotation {

    static final String[] METHODS = {"GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS"};

    private String routeName;

    public RouteAnnotation() {
        bindText("name", name -> this.routeName = name);
    }

    @Override
    public String usage() {
        return "!Route METHOD, path [, name: routeName]";
    }

    @Override
    public Set<TargetKind> isFor() {
        return EnumSet.of(TargetKind.METHOD);
    }

    @Override
    protected void validate(Target target) {
        minimumParameterCount(2);
        maximumParameterCount(3);
        acceptedKeys("name");
        acceptedIndexedValues(0, METHODS);
        acceptsNoGroupedValues();
        if (parameters().positional().size() != 2) {
            error(name() + " requires a METHOD and a path.");
        }
    }

    @Override
    protected void expand(Target target, ClassDescriptor descriptor) {
        String method = values().get(0).asText();
        String path = values().get(1).asText();
        String prefix = descriptor.property(ClassDescriptor.ROUTE_PREFIX).orElse("");
        descriptor.addRoute(new RouteDefinition(method, joinPath(prefix, path), routeName, target.elementName()));
    }

    static String joinPath(String prefix, String path) {
        if (prefix.isEmpty()) {
            return path;
        }
        String head = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        if (path.isEmpty() || path.equals("/")) {
            return head.isEmpty() ? "/" : head;
        }
        return head + (path.startsWith("/") ? path : "/" + path);
    }
}
