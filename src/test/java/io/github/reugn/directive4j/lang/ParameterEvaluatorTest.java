package io.github.reugn.directive4j.lang;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Parameter Evaluator Tests")
class ParameterEvaluatorTest {

    @Nested
    @DisplayName("Positional and Keyed Values")
    class Entries {

        @Test
        @DisplayName("Route directive splits into positional and keyed values")
        void routeExample() {
            ParameterList parameters = ParameterEvaluator.evaluate("GET, '/users', name: 'users.index'");

            assertThat(parameters.positional()).containsExactly(Value.of("GET"), Value.of("/users"));
            assertThat(parameters.keyed()).containsExactly(Map.entry("name", Value.of("users.index")));
        }

        @Test
        @DisplayName("Quoted path with a colon stays one value")
        void quotedColon() {
            ParameterList parameters = ParameterEvaluator.evaluate("GET, '/users/:id', name: 'users.show'");

            assertThat(parameters.positional()).extracting(Value::asText).containsExactly("GET", "/users/:id");
            assertThat(parameters.get("name")).contains(Value.of("users.show"));
        }

        @Test
        @DisplayName("Column directive reads nullable as a boolean")
        void columnExample() {
            ParameterList parameters = ParameterEvaluator.evaluate("integer, nullable: true");

            assertThat(parameters.positional()).containsExactly(Value.of("integer"));
            assertThat(parameters.keyed()).containsExactly(Map.entry("nullable", Value.of(true)));
        }

        @Test
        @DisplayName("Keys are lower-cased and the last duplicate wins")
        void keyNormalization() {
            ParameterList parameters = ParameterEvaluator.evaluate("Name: first, NAME: second");

            assertThat(parameters.keyed()).containsOnlyKeys("name");
            assertThat(parameters.get("Name")).contains(Value.of("second"));
            assertThat(parameters.has("nAmE")).isTrue();
        }

        @Test
        @DisplayName("Size counts positional and keyed values")
        void size() {
            assertThat(ParameterEvaluator.evaluate("a, b, c: d").size()).isEqualTo(3);
        }

        @Test
        @DisplayName("Trailing comma is allowed")
        void trailingComma() {
            assertThat(ParameterEvaluator.evaluate("a, b,").positional())
                    .containsExactly(Value.of("a"), Value.of("b"));
        }

        @Test
        @DisplayName("Empty and null text evaluate to an empty list")
        void empty() {
            assertThat(ParameterEvaluator.evaluate("")).isEqualTo(ParameterList.empty());
            assertThat(ParameterEvaluator.evaluate("   ").isEmpty()).isTrue();
            assertThat(ParameterEvaluator.evaluate((String) null).isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Barewords are strings with inner whitespace kept")
        void barewords() {
            ParameterList parameters = ParameterEvaluator.evaluate("  hello   world , x");

            assertThat(parameters.positional()).containsExactly(Value.of("hello   world"), Value.of("x"));
        }

        @Test
        @DisplayName("Boolean barewords in any case")
        void booleans() {
            ParameterList parameters = ParameterEvaluator.evaluate("true, FALSE, True");

            assertThat(parameters.positional()).containsExactly(Value.of(true), Value.of(false), Value.of(true));
        }

        @Test
        @DisplayName("Numeric barewords are numbers")
        void numbers() {
            ParameterList parameters = ParameterEvaluator.evaluate("42, -0.5, 3.14");

            assertThat(parameters.positional()).containsExactly(
                    Value.of(42),
                    Value.of(new BigDecimal("-0.5")),
                    Value.of(new BigDecimal("3.14")));
            assertThat(parameters.positional(0).orElseThrow().asInt()).isEqualTo(42);
        }

        @Test
        @DisplayName("Numeric barewords keep their source text")
        void numbersKeepSourceText() {
            ParameterList parameters = ParameterEvaluator.evaluate("007, 1.50, 00100: x");

            assertThat(parameters.positional(0).orElseThrow().asText()).isEqualTo("007");
            assertThat(parameters.positional(0).orElseThrow().asInt()).isEqualTo(7);
            assertThat(parameters.positional(1).orElseThrow().render()).isEqualTo("1.50");
            assertThat(parameters.keyed()).containsOnlyKeys("00100");
        }

        @Test
        @DisplayName("Quoted literals are always strings")
        void quotedStrings() {
            ParameterList parameters = ParameterEvaluator.evaluate("'true', \"42\"");

            assertThat(parameters.positional()).containsExactly(Value.of("true"), Value.of("42"));
            assertThat(parameters.positional(0).orElseThrow()).isInstanceOf(Value.StringValue.class);
        }

        @Test
        @DisplayName("Quoted literals keep punctuation and outer whitespace")
        void quotedPunctuation() {
            ParameterList parameters = ParameterEvaluator.evaluate("' a, (b): c '");

            assertThat(parameters.positional()).containsExactly(Value.of(" a, (b): c "));
        }

        @Test
        @DisplayName("Backslash escapes the enclosing quote only")
        void escapes() {
            ParameterList parameters = ParameterEvaluator.evaluate("'it\\'s', \"say \\\"hi\\\"\", 'C:\\dir'");

            assertThat(parameters.positional()).extracting(Value::asText)
                    .containsExactly("it's", "say \"hi\"", "C:\\dir");
        }

        @Test
        @DisplayName("Single quotes inside double quotes need no escape")
        void mixedQuotes() {
            assertThat(ParameterEvaluator.evaluate("\"it's\"").positional()).containsExactly(Value.of("it's"));
        }
    }

    @Nested
    @DisplayName("Groups")
    class Groups {

        @Test
        @DisplayName("One level of grouping is allowed")
        void oneLevel() {
            ParameterList parameters = ParameterEvaluator.evaluate("(a, 'b'), keys: (id, Type: x)");

            assertThat(parameters.positional()).containsExactly(Value.ListValue.of(Value.of("a"), Value.of("b")));
            assertThat(parameters.get("keys")).contains(
                    new Value.ListValue(List.of(Value.of("id")), Map.of("type", Value.of("x"))));
        }

        @Test
        @DisplayName("Empty group")
        void emptyGroup() {
            assertThat(ParameterEvaluator.evaluate("()").positional())
                    .containsExactly(new Value.ListValue(List.of(), Map.of()));
        }

        @Test
        @DisplayName("Nested groups are rejected")
        void nestingLimit() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("(a, (b, c))"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("groups cannot be nested more than 1 level deep");
        }

        @Test
        @DisplayName("A group cannot be a key")
        void groupAsKey() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("(a): b"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("a group cannot be used as a key");
        }
    }

    @Nested
    @DisplayName("Malformed Text")
    class Malformed {

        @Test
        @DisplayName("Unterminated string")
        void unterminated() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("GET, '/users"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("unterminated string starting with '");
        }

        @Test
        @DisplayName("Empty entry between commas")
        void emptyEntry() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("a,,b"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("expected a value but found ','");
        }

        @Test
        @DisplayName("Adjacent values without a comma")
        void missingComma() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("'a' 'b'"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("expected ',' or ')' but found the string 'b'");
        }

        @Test
        @DisplayName("Unbalanced closing parenthesis")
        void unbalancedClose() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("a), (b"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("after the closing ')'");
        }

        @Test
        @DisplayName("Unbalanced opening parenthesis")
        void unbalancedOpen() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("(a, b"))
                    .isInstanceOf(AnnotationParseException.class);
        }

        @Test
        @DisplayName("Empty and chained keys")
        void badKeys() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("'': x"))
                    .hasMessageContaining("empty key");
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("a: b: c"))
                    .hasMessageContaining("unexpected ':' after the value of 'a'");
        }

        @Test
        @DisplayName("Message quotes the directive and its argument text")
        void messageQuotesDirective() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate(new RawInvocation("Route", "GET,,x")))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageStartingWith("There is an unparseable annotation value: \"!Route GET,,x\"")
                    .satisfies(e -> assertThat(((AnnotationParseException) e).argumentText()).isEqualTo("GET,,x"));
        }

        @Test
        @DisplayName("Code-like text is rejected, never executed")
        void noCodeEvaluation() {
            assertThatThrownBy(() -> ParameterEvaluator.evaluate("System.exit(1)"))
                    .isInstanceOf(AnnotationParseException.class)
                    .hasMessageContaining("expected ',' or ')' but found '('");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Evaluation is deterministic")
        void deterministic() {
            String text = "GET, '/users', name: 'users.index', tags: (a, b)";

            assertThat(ParameterEvaluator.evaluate(text)).isEqualTo(ParameterEvaluator.evaluate(text));
        }

        @Test
        @DisplayName("Rendered text evaluates back to an equal list")
        void roundTrip() {
            for (String text : List.of(
                    "GET, '/users/:id', name: 'users.show'",
                    "integer, PrimaryKey, nullable: false, default: 'it\\'s'",
                    "'true', true, -12.50, ' padded '",
                    "(a, 'k': v), Group: ('x', 1)")) {
                ParameterList parameters = ParameterEvaluator.evaluate(text);

                assertThat(ParameterEvaluator.evaluate(parameters.render()))
                        .as("round trip of %s", text)
                        .isEqualTo(parameters);
            }
        }

        @Test
        @DisplayName("Canonical form quotes strings and keys")
        void canonicalForm() {
            assertThat(ParameterEvaluator.evaluate("GET, /users, Name: idx, n: 1").render())
                    .isEqualTo("'GET', '/users', 'name': 'idx', 'n': 1");
        }
    }
}
