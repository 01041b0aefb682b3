package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.lang.Annotation;
import io.github.reugn.directive4j.lang.Target;
import io.github.reugn.directive4j.lang.TargetKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Names the data source a model class is stored in.
 *
 * @see ClassDescriptor#source()
 */
public class SourceAnnotation extends Annotation {

    @Override
    public String usage() {
        return "!Source sourceName";
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
        descriptor.setProperty(ClassDescriptor.SOURCE, values().get(0).asText());
    }
}
