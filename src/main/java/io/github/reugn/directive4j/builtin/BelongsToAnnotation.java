package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.RelationshipDefinition;
import io.github.reugn.directive4j.lang.Target;

/**
 * Declares the owning side of a relationship.
 * <pre>
 * !BelongsTo author
 * !BelongsTo writer, class: Author, key: authorId
 * </pre>
 * Defaults: {@code author} relates to {@code Author} through the {@code authorId} key.
 */
public class BelongsToAnnotation extends RelationshipAnnotation {

    @Override
    public String usage() {
        return "!BelongsTo relationName [, class: RelatedClass] [, key: foreignKey]";
    }

    @Override
    protected void validate(Target target) {
        super.validate(target);
        acceptedKeys("class", "key");
    }

    @Override
    protected String defaultRelatedClass(String relationName) {
        return Inflector.capitalize(relationName);
    }

    @Override
    protected RelationshipDefinition define(Target target, String relationName, String related) {
        String key = foreignKey != null ? foreignKey : relationName + "Id";
        return new RelationshipDefinition(RelationshipDefinition.Type.BELONGS_TO, relationName, related, key,
                null, null);
    }
}
