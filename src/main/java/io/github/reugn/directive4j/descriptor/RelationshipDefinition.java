package io.github.reugn.directive4j.descriptor;

import java.util.Objects;

/**
 * A relationship between models contributed by {@code !HasMany} or {@code !BelongsTo}.
 *
 * @param type         relationship cardinality
 * @param name         relationship name, e.g. {@code books}
 * @param relatedClass simple name of the related model
 * @param foreignKey   foreign key column
 * @param through      joining model for many-to-many relations, {@code null} otherwise
 * @param onDelete     delete policy ({@code Cascade}, {@code Delete} or {@code Nullify}),
 *                     {@code null} for belongs-to relations
 */
public record RelationshipDefinition(Type type, String name, String relatedClass, String foreignKey,
                                     String through, String onDelete) {

    public RelationshipDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(relatedClass, "relatedClass");
        Objects.requireNonNull(foreignKey, "foreignKey");
    }

    public enum Type {
        HAS_MANY,
        BELONGS_TO
    }
}
