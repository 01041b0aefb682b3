package io.github.reugn.directive4j.lang;

import io.github.reugn.directive4j.builtin.BuiltInAnnotations;
import io.github.reugn.directive4j.builtin.RouteAnnotation;
import io.github.reugn.directive4j.descriptor.ClassDescriptor;
import io.github.reugn.directive4j.fixture.AuditedAnnotation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Annotation Registry Tests")
class AnnotationRegistryTest {

    private static AnnotationRegistry builtIns() {
        return BuiltInAnnotations.registerAll(AnnotationRegistry.builder()).build();
    }

    abstract static class NoOpAnnotation extends Annotation {
        @Override
        public String usage() {
            return "";
        }

        @Override
        public Set<TargetKind> isFor() {
            return EnumSet.allOf(TargetKind.class);
        }

        @Override
        protected void validate(Target target) {
        }

        @Override
        protected void expand(Target target, ClassDescriptor descriptor) {
        }
    }

    static class Marker extends NoOpAnnotation {
    }

    /**
     * Shares its simple name with the built-in kind.
     */
    static class TableAnnotation extends NoOpAnnotation {
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Resolves a directive name to its kind")
        void resolves() {
            AnnotationKind kind = builtIns().lookup("Route");

            assertThat(kind.name()).isEqualTo("RouteAnnotation");
            assertThat(kind.directiveName()).isEqualTo("Route");
            assertThat(kind.type()).isEqualTo(RouteAnnotation.class);
            assertThat(kind.newInstance()).isInstanceOf(RouteAnnotation.class)
                    .isNotSameAs(kind.newInstance());
        }

        @Test
        @DisplayName("Unknown directive names the missing kind")
        void unknown() {
            assertThatThrownBy(() -> builtIns().lookup("Bogus"))
                    .isInstanceOf(UnknownAnnotationException.class)
                    .hasMessage("Unknown annotation: \"Bogus\". It must be registered as \"BogusAnnotation\""
                            + " before it can be used.")
                    .satisfies(e -> assertThat(((UnknownAnnotationException) e).annotationName()).isEqualTo("Bogus"));
        }

        @Test
        @DisplayName("Lookup is case-sensitive")
        void caseSensitive() {
            AnnotationRegistry registry = builtIns();

            assertThat(registry.contains("Table")).isTrue();
            assertThat(registry.contains("table")).isFalse();
        }

        @Test
        @DisplayName("Names keep registration order")
        void names() {
            assertThat(builtIns().names()).containsExactly(
                    "RouteAnnotation", "PrefixAnnotation", "ColumnAnnotation", "TableAnnotation",
                    "SourceAnnotation", "HasManyAnnotation", "BelongsToAnnotation");
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Class name must end in Annotation")
        void suffixRequired() {
            assertThatThrownBy(() -> AnnotationRegistry.builder().register(Marker.class, Marker::new))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must be named <Directive>Annotation");
        }

        @Test
        @DisplayName("Later registration of the same name wins")
        void overwrite() {
            AnnotationRegistry registry = BuiltInAnnotations.registerAll(AnnotationRegistry.builder())
                    .register(TableAnnotation.class, TableAnnotation::new)
                    .build();

            assertThat(registry.lookup("Table").type()).isEqualTo(TableAnnotation.class);
            assertThat(registry.names()).hasSize(7);
        }

        @Test
        @DisplayName("Standard registry adds installed kinds to the built-ins")
        void standard() {
            AnnotationRegistry registry = AnnotationRegistry.standard(getClass().getClassLoader());

            assertThat(registry.contains("Route")).isTrue();
            assertThat(registry.lookup("Audited").type()).isEqualTo(AuditedAnnotation.class);
        }

        @Test
        @DisplayName("Built registry is not affected by later builder changes")
        void frozen() {
            AnnotationRegistry.Builder builder = AnnotationRegistry.builder();
            AnnotationRegistry registry = builder.build();
            BuiltInAnnotations.registerAll(builder);

            assertThat(registry.names()).isEmpty();
            assertThatThrownBy(() -> registry.names().add("X")).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    @DisplayName("Global registry is published once")
    void globalRegistry() {
        AnnotationRegistry registry = builtIns();

        AnnotationRegistry.initialize(registry);

        assertThat(AnnotationRegistry.global()).isSameAs(registry);
        assertThatThrownBy(() -> AnnotationRegistry.initialize(builtIns()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already initialized");
        assertThat(AnnotationRegistry.global()).isSameAs(registry);
    }
}
