package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.lang.Annotation;
import io.github.reugn.directive4j.lang.Target;
import io.github.reugn.directive4j.lang.TargetKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sets the path prepended to every {@code !Route} of a controller class.
 */
public class PrefixAnnotation extends Annotation {

    @Override
    public String usage() {
        return "!Prefix path";
    }

    @Override
    public Set<TargetKind> isFor() {
        return EnumSet.of(TargetKind.CLASS);
    }

    @Override
    protected void validate(Target target) {
        exactParameterCount(1);
        acceptsNoKeyedValues();
        acceptsNoGroupedValues();
    }

    @Override
    protected void expand(Target target, ClassDescriptor descriptor) {
        descriptor.setProperty(ClassDescriptor.ROUTE_PREFIX, values().get(0).asText());
    }
}
