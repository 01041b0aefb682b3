package io.github.reugn.directive4j.lang;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Value Tests")
class ValueTest {

    @Test
    @DisplayName("Strings convert to booleans case-insensitively")
    void stringAsBoolean() {
        assertThat(Value.of("TRUE").asBoolean()).isTrue();
        assertThat(Value.of("false").asBoolean()).isFalse();
        assertThatThrownBy(() -> Value.of("yes").asBoolean())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("expected a boolean but got 'yes'");
    }

    @Test
    @DisplayName("Integers must be integral")
    void asInt() {
        assertThat(Value.of("17").asInt()).isEqualTo(17);
        assertThat(Value.of(new BigDecimal("3.0")).asInt()).isEqualTo(3);
        assertThatThrownBy(() -> Value.of(new BigDecimal("3.5")).asInt())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("expected an integer but got 3.5");
        assertThatThrownBy(() -> Value.of("ten").asInt())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Scalars share a text form")
    void textForm() {
        assertThat(Value.of(true).asText()).isEqualTo("true");
        assertThat(Value.of(-4).asText()).isEqualTo("-4");
        assertThat(Value.of("GET").asText()).isEqualTo("GET");
    }

    @Test
    @DisplayName("Lists have no text form")
    void listAsText() {
        Value list = Value.ListValue.of(Value.of("a"), Value.of(1));

        assertThat(list.render()).isEqualTo("('a', 1)");
        assertThatThrownBy(list::asText)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("('a', 1)");
    }

    @Test
    @DisplayName("Rendering escapes single quotes")
    void renderEscapes() {
        assertThat(Value.of("it's").render()).isEqualTo("'it\\'s'");
    }
}
