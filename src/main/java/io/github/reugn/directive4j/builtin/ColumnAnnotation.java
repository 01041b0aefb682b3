package io.github.reugn.directive4j.builtin;

import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.descriptor.ColumnDefinition;
import io.github.reugn.directive4j.lang.Annotation;
import io.github.reugn.directive4j.lang.CaseNormalization;
import io.github.reugn.directive4j.lang.Target;
import io.github.reugn.directive4j.lang.TargetKind;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Maps a property to a table column.
 * <pre>
 * !Column integer, PrimaryKey, AutoIncrement
 * !Column string, nullable: false, default: 'guest'
 * </pre>
 * Exactly one positional value is the column type; the others are modifier flags.
 * Columns are nullable unless they are primary keys or say {@code nullable: false}.
 */
public class ColumnAnnotation extends Annotation {

    static final String[] TYPES = {
            "string", "text", "integer", "decimal", "float", "time",
            "timestamp", "date", "datetime", "blob", "boolean"
    };

    static final String PRIMARY_KEY = "PrimaryKey";
    static final String AUTO_INCREMENT = "AutoIncrement";

    private Boolean nullable;
    private String defaultValue;

    public ColumnAnnotation() {
        bindBoolean("nullable", value -> this.nullable = value);
        bindText("default", value -> this.defaultValue = value);
    }

    @Override
    public String usage() {
        return "!Column type [, PrimaryKey] [, AutoIncrement] [, nullable: true|false] [, default: value]\n"
                + "Types: " + String.join(", ", TYPES);
    }

    @Override
    public Set<TargetKind> isFor() {
        return EnumSet.of(TargetKind.PROPERTY);
    }

    @Override
    protected void validate(Target target) {
        minimumParameterCount(1);
        acceptedKeys("nullable", "default");
        acceptedKeylessValues(Stream.concat(Arrays.stream(TYPES), Stream.of(PRIMARY_KEY, AUTO_INCREMENT))
                .toArray(String[]::new));
        acceptedValuesForKey("nullable", CaseNormalization.LOWER, "true", "false");
        acceptsNoGroupedValues();

        long types = Arrays.stream(TYPES).filter(this::isAValue).count();
        if (types == 0) {
            error(name() + " requires a column type. Valid types: " + String.join(", ", TYPES) + ".");
        } else if (types > 1) {
            error(name() + " takes a single column type.");
        }
        if (isAValue(PRIMARY_KEY) && parameters().get("nullable").map(v -> "true".equalsIgnoreCase(v.toString()))
                .orElse(false)) {
            error("A " + PRIMARY_KEY + " column cannot be nullable.");
        }
    }

    @Override
    protected void expand(Target target, ClassDescriptor descriptor) {
        String type = valueNotIn(PRIMARY_KEY, AUTO_INCREMENT).orElseThrow().asText();
        boolean primaryKey = isAValue(PRIMARY_KEY);
        boolean columnNullable = nullable != null ? nullable : !primaryKey;
        descriptor.addColumn(new ColumnDefinition(target.elementName(), type, columnNullable, primaryKey,
                isAValue(AUTO_INCREMENT), defaultValue));
    }
}
