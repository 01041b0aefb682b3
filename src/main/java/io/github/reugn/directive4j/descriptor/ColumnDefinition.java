package io.github.reugn.directive4j.descriptor;

import java.util.Objects;

/**
 * A property-to-column mapping contributed by a {@code !Column} directive.
 *
 * @param property      name of the mapped property
 * @param type          column type, e.g. {@code integer} or {@code string}
 * @param nullable      whether the column accepts {@code NULL}
 * @param primaryKey    whether the column is (part of) the primary key
 * @param autoIncrement whether the database assigns values
 * @param defaultValue  default value as text, {@code null} when not given
 */
public record ColumnDefinition(String property, String type, boolean nullable, boolean primaryKey,
                               boolean autoIncrement, String defaultValue) {

    public ColumnDefinition {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(type, "type");
    }
}
