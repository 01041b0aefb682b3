package io.github.reugn.directive4j.lang;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Directive Parser Tests")
class DirectiveParserTest {

    @Nested
    @DisplayName("Raw Comment Blocks")
    class RawComments {

        @Test
        @DisplayName("Extracts directives in source order")
        void extractsInOrder() {
            String comment = """
                    /**
                     * Lists users.
                     * !Route GET, /users
                     * !Route POST, /users, name: 'users.create'
                     */""";

            List<RawInvocation> invocations = DirectiveParser.parse(comment);

            assertThat(invocations).containsExactly(
                    new RawInvocation("Route", "GET, /users"),
                    new RawInvocation("Route", "POST, /users, name: 'users.create'"));
        }

        @Test
        @DisplayName("Stops argument text at the comment terminator")
        void stopsAtTerminator() {
            List<RawInvocation> invocations = DirectiveParser.parse("/** !Column integer, PrimaryKey */");

            assertThat(invocations).containsExactly(new RawInvocation("Column", "integer, PrimaryKey"));
        }

        @Test
        @DisplayName("Directive directly after the asterisk")
        void directiveAfterAsterisk() {
            List<RawInvocation> invocations = DirectiveParser.parse("/**\n *!Table users\n */");

            assertThat(invocations).containsExactly(new RawInvocation("Table", "users"));
        }
    }

    @Nested
    @DisplayName("Stripped Javadoc")
    class StrippedComments {

        @Test
        @DisplayName("Directive at the start of a line")
        void lineStart() {
            List<RawInvocation> invocations = DirectiveParser.parse(" Model of a user.\n!Table users\n!HasMany posts\n");

            assertThat(invocations).extracting(RawInvocation::name).containsExactly("Table", "HasMany");
        }

        @Test
        @DisplayName("Directive without arguments has empty argument text")
        void noArguments() {
            List<RawInvocation> invocations = DirectiveParser.parse("!Audited\n");

            assertThat(invocations).containsExactly(new RawInvocation("Audited", ""));
        }

        @Test
        @DisplayName("Handles Windows line endings")
        void windowsLineEndings() {
            List<RawInvocation> invocations = DirectiveParser.parse("!Table users\r\n!Source Archive\r\n");

            assertThat(invocations).containsExactly(
                    new RawInvocation("Table", "users"),
                    new RawInvocation("Source", "Archive"));
        }
    }

    @Nested
    @DisplayName("Prose")
    class Prose {

        @Test
        @DisplayName("Ignores inequality operators and exclamations")
        void ignoresProse() {
            String comment = "Returns true if a != b. Wow!Really\nNothing here!";

            assertThat(DirectiveParser.parse(comment)).isEmpty();
        }

        @Test
        @DisplayName("Ignores a bang not followed by an identifier")
        void bangWithoutIdentifier() {
            assertThat(DirectiveParser.parse("! Table users\n!1Table")).isEmpty();
        }

        @Test
        @DisplayName("Null and empty comments have no directives")
        void nullAndEmpty() {
            assertThat(DirectiveParser.parse(null)).isEmpty();
            assertThat(DirectiveParser.parse("")).isEmpty();
        }
    }
}
