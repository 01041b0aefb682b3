package io.github.reugn.directive4j.builtin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Route Path Tests")
class RouteAnnotationTest {

    @Test
    @DisplayName("No prefix keeps the path")
    void noPrefix() {
        assertThat(RouteAnnotation.joinPath("", "/users")).isEqualTo("/users");
        assertThat(RouteAnnotation.joinPath("", "users")).isEqualTo("users");
    }

    @Test
    @DisplayName("Joins with exactly one slash")
    void joins() {
        assertThat(RouteAnnotation.joinPath("/api", "/users")).isEqualTo("/api/users");
        assertThat(RouteAnnotation.joinPath("/api/", "users")).isEqualTo("/api/users");
        assertThat(RouteAnnotation.joinPath("/api/", "/users")).isEqualTo("/api/users");
    }

    @Test
    @DisplayName("Root path maps to the prefix")
    void rootPath() {
        assertThat(RouteAnnotation.joinPath("/api", "/")).isEqualTo("/api");
        assertThat(RouteAnnotation.joinPath("/", "/")).isEqualTo("/");
        assertThat(RouteAnnotation.joinPath("/", "users")).isEqualTo("/users");
    }
}
