package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.descriptor.RelationshipDefinition;
import io.github.reugn.directive4j.lang.Annotation;
import io.github.reugn.directive4j.lang.Target;
import io.github.reugn.directive4j.lang.TargetKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Shared parameters of model relationships: one positional relationship name plus the
 * optional {@code class} and {@code key} overrides.
 */
abstract class RelationshipAnnotation extends Annotation {

    protected String relatedClass;
    protected String foreignKey;

    RelationshipAnnotation() {
        bindText("class", value -> this.relatedClass = value);
        bindText("key", value -> this.foreignKey = value);
    }

    @Override
    public Set<TargetKind> isFor() {
        return EnumSet.of(TargetKind.CLASS);
    }

    @Override
    protected void validate(Target target) {
        if (parameters().positional().size() != 1) {
            error(name() + " requires exactly one relationship name.");
        }
        acceptsNoGroupedValues();
    }

    @Override
    protected void expand(Target target, ClassDescriptor descriptor) {
        String relationName = values().get(0).asText();
        descriptor.addRelationship(define(target, relationName,
                relatedClass != null ? relatedClass : defaultRelatedClass(relationName)));
    }

    /**
     * Builds the relationship once the name and related class are known.
     */
    protected abstract RelationshipDefinition define(Target target, String relationName, String related);

    protected abstract String defaultRelatedClass(String relationName);
}
