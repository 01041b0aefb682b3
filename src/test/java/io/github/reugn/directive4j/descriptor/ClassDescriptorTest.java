package io.github.reugn.directive4j.descriptor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Class Descriptor Tests")
class ClassDescriptorTest {

    private static ClassDescriptor sample() {
        return new ClassDescriptor("app.Author")
                .setProperty(ClassDescriptor.TABLE, "authors")
                .addColumn(new ColumnDefinition("id", "integer", false, true, true, null))
                .addRoute(new RouteDefinition("GET", "/authors", null, "index"))
                .addRelationship(new RelationshipDefinition(RelationshipDefinition.Type.HAS_MANY, "books", "Book",
                        "authorId", null, "Cascade"));
    }

    @Test
    @DisplayName("Descriptors with the same content are equal")
    void equality() {
        assertThat(sample()).isEqualTo(sample()).hasSameHashCodeAs(sample());
        assertThat(sample().setProperty(ClassDescriptor.SOURCE, "Archive")).isNotEqualTo(sample());
    }

    @Test
    @DisplayName("Collections are read-only views")
    void readOnlyViews() {
        ClassDescriptor descriptor = sample();

        assertThatThrownBy(() -> descriptor.columns().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> descriptor.properties().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Finds columns by property")
    void columnLookup() {
        assertThat(sample().column("id")).map(ColumnDefinition::primaryKey).contains(true);
        assertThat(sample().column("name")).isEmpty();
    }

    @Test
    @DisplayName("Empty until something is added")
    void empty() {
        ClassDescriptor descriptor = new ClassDescriptor("app.Author");

        assertThat(descriptor.isEmpty()).isTrue();
        assertThat(descriptor.source()).isEqualTo("Default");
        assertThat(sample().isEmpty()).isFalse();
    }
}
