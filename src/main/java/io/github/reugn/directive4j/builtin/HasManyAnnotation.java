package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.RelationshipDefinition;
import io.github.reugn.directive4j.lang.Target;

/**
 * Declares a one-to-many (or, with {@code through}, many-to-many) relationship.
 * <pre>
 * !HasMany books
 * !HasMany books, class: Novel, key: writerId, ondelete: Nullify
 * !HasMany tags, through: PostTags
 * </pre>
 * Defaults: {@code books} relates to {@code Book}, keyed by {@code <declaringClass>Id}
 * ({@code authorId} on {@code Author}), deleting with {@value #DEFAULT_ON_DELETE}.
 */
public class HasManyAnnotation extends RelationshipAnnotation {

    static final String[] ON_DELETE = {"Cascade", "Delete", "Nullify"};
    static final String DEFAULT_ON_DELETE = "Cascade";

    private String through;
    private String onDelete;

    public HasManyAnnotation() {
        bindText("through", value -> this.through = value);
        bindText("ondelete", value -> this.onDelete = value);
    }

    @Override
    public String usage() {
        return "!HasMany relationName [, class: RelatedClass] [, key: foreignKey] [, through: JoinClass]"
                + " [, ondelete: Cascade|Delete|Nullify]";
    }

    @Override
    protected void validate(Target target) {
        super.validate(target);
        acceptedKeys("class", "key", "through", "ondelete");
        acceptedValuesForKey("ondelete", ON_DELETE);
    }

    @Override
    protected String defaultRelatedClass(String relationName) {
        return Inflector.capitalize(Inflector.singular(relationName));
    }

    @Override
    protected RelationshipDefinition define(Target target, String relationName, String related) {
        String key = foreignKey != null ? foreignKey : Inflector.decapitalize(target.declaringSimpleName()) + "Id";
        return new RelationshipDefinition(RelationshipDefinition.Type.HAS_MANY, relationName, related, key,
                through, onDelete != null ? onDelete : DEFAULT_ON_DELETE);
    }
}
