package io.github.reugn.directive4j.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns directive argument text into a {@link ParameterList}.
 * <p>
 * The argument text is read as the inside of one implicit group, so
 * {@code GET, '/users', name: 'users.index'} is evaluated as
 * {@code (GET, '/users', name: 'users.index')}. Evaluation is a closed recursive descent
 * over this grammar; no host code is ever executed:
 * <pre>
 * list  := '(' [ entry { ',' entry } [ ',' ] ] ')'
 * entry := item [ ':' item ]
 * item  := quoted-string | bareword | list
 * </pre>
 *
 * <p><b>Literal Rules:</b>
 * <ul>
 *   <li>Quoted literals use single or double quotes and are always strings. A backslash
 *       directly before the matching quote escapes it; other backslashes are kept.</li>
 *   <li>Whitespace around {@code ( ) , :} is insignificant; whitespace inside a bareword is kept.</li>
 *   <li>Barewords {@code true} and {@code false} (any case) are booleans, numerals such as
 *       {@code 42} or {@code -0.5} are numbers, and every other bareword is a string equal
 *       to its quoted form ({@code GET} reads as {@code 'GET'}). Numbers keep their
 *       source text, so {@code 007} reads as {@code "007"}.</li>
 *   <li>Groups may nest one level below the implicit outer group.</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ParameterEvaluator.evaluate("integer, nullable: true")
 * // positional = ["integer"], keyed = {nullable=true}
 * }</pre>
 */
public final class ParameterEvaluator {

    /**
     * Deepest group level accepted, counting the implicit outer group as level zero.
     */
    public static final int MAX_NESTING = 1;

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private ParameterEvaluator() {
    }

    /**
     * Evaluates the argument text of {@code invocation}.
     *
     * @param invocation the raw directive
     * @return the evaluated parameters
     * @throws AnnotationParseException if the text is not a valid literal list
     */
    public static ParameterList evaluate(RawInvocation invocation) {
        return new Reader(invocation.name(), invocation.argumentText()).read();
    }

    /**
     * Evaluates a bare argument text.
     *
     * @param argumentText text following a directive name
     * @return the evaluated parameters
     * @throws AnnotationParseException if the text is not a valid literal list
     */
    public static ParameterList evaluate(String argumentText) {
        return new Reader(null, argumentText).read();
    }

    /**
     * Converts an unquoted token into its literal value.
     *
     * @param bareword the trimmed token
     * @return a boolean, number or string value
     */
    static Value bareword(String bareword) {
        if ("true".equalsIgnoreCase(bareword)) {
            return Value.of(true);
        }
        if ("false".equalsIgnoreCase(bareword)) {
            return Value.of(false);
        }
        if (NUMBER.matcher(bareword).matches()) {
            return new Value.NumberValue(bareword);
        }
        return Value.of(bareword);
    }

    private enum TokenType {
        OPEN("'('"),
        CLOSE("')'"),
        COMMA("','"),
        COLON("':'"),
        QUOTED("a quoted string"),
        BAREWORD("a bareword"),
        END("the end of the text");

        private final String description;

        TokenType(String description) {
            this.description = description;
        }
    }

    private record Token(TokenType type, String text) {
    }

    /**
     * Single-use lexer and parser for one argument text.
     */
    private static final class Reader {

        private final String annotationName;
        private final String argumentText;
        private final List<Token> tokens;
        private int position;

        Reader(String annotationName, String argumentText) {
            this.annotationName = annotationName;
            this.argumentText = argumentText == null ? "" : argumentText;
            this.tokens = tokenize("(" + this.argumentText + ")");
        }

        ParameterList read() {
            ParameterList.Builder builder = ParameterList.builder();
            expect(TokenType.OPEN);
            readEntries(builder, 0);
            expect(TokenType.CLOSE);
            if (peek().type() != TokenType.END) {
                throw failure("unexpected " + describe(peek()) + " after the closing ')'");
            }
            return builder.build();
        }

        // ==================== PARSING ====================

        private void readEntries(ParameterList.Builder builder, int depth) {
            if (peek().type() == TokenType.CLOSE) {
                return;
            }
            while (true) {
                readEntry(builder, depth);
                TokenType next = peek().type();
                if (next == TokenType.COMMA) {
                    position++;
                    if (peek().type() == TokenType.CLOSE) {
                        return; // trailing comma
                    }
                } else if (next == TokenType.CLOSE) {
                    return;
                } else {
                    throw failure("expected ',' or ')' but found " + describe(peek()));
                }
            }
        }

        private void readEntry(ParameterList.Builder builder, int depth) {
            Value first = readItem(depth);
            if (peek().type() != TokenType.COLON) {
                builder.add(first);
                return;
            }
            position++;
            if (first instanceof Value.ListValue) {
                throw failure("a group cannot be used as a key");
            }
            String key = first.asText();
            if (key.isEmpty()) {
                throw failure("empty key");
            }
            Value value = readItem(depth);
            if (peek().type() == TokenType.COLON) {
                throw failure("unexpected ':' after the value of '" + key + "'");
            }
            builder.put(key, value);
        }

        private Value readItem(int depth) {
            Token token = tokens.get(position++);
            switch (token.type()) {
                case QUOTED -> {
                    return Value.of(token.text());
                }
                case BAREWORD -> {
                    return bareword(token.text());
                }
                case OPEN -> {
                    if (depth + 1 > MAX_NESTING) {
                        throw failure("groups cannot be nested more than " + MAX_NESTING + " level deep");
                    }
                    ParameterList.Builder nested = ParameterList.builder();
                    readEntries(nested, depth + 1);
                    expect(TokenType.CLOSE);
                    return nested.buildList();
                }
                default -> throw failure("expected a value but found " + describe(token));
            }
        }

        private void expect(TokenType type) {
            Token token = tokens.get(position);
            if (token.type() != type) {
                throw failure("expected " + type.description + " but found " + describe(token));
            }
            position++;
        }

        private Token peek() {
            return tokens.get(position);
        }

        private static String describe(Token token) {
            return switch (token.type()) {
                case QUOTED -> "the string '" + token.text() + "'";
                case BAREWORD -> "'" + token.text() + "'";
                default -> token.type().description;
            };
        }

        private AnnotationParseException failure(String reason) {
            return new AnnotationParseException(annotationName, argumentText, reason);
        }

        // ==================== LEXING ====================

        private List<Token> tokenize(String text) {
            List<Token> result = new ArrayList<>();
            int i = 0;
            int length = text.length();
            while (i < length) {
                char c = text.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (isPunctuation(c)) {
                    result.add(new Token(punctuation(c), String.valueOf(c)));
                    i++;
                } else if (isQuote(c)) {
                    i = readQuoted(text, i, result);
                } else {
                    int start = i;
                    while (i < length && !isPunctuation(text.charAt(i)) && !isQuote(text.charAt(i))) {
                        i++;
                    }
                    result.add(new Token(TokenType.BAREWORD, text.substring(start, i).trim()));
                }
            }
            result.add(new Token(TokenType.END, ""));
            return result;
        }

        private int readQuoted(String text, int open, List<Token> result) {
            char quote = text.charAt(open);
            StringBuilder literal = new StringBuilder();
            int i = open + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    literal.append(quote);
                    i += 2;
                } else if (c == quote) {
                    result.add(new Token(TokenType.QUOTED, literal.toString()));
                    return i + 1;
                } else {
                    literal.append(c);
                    i++;
                }
            }
            throw failure("unterminated string starting with " + quote);
        }

        private static boolean isPunctuation(char c) {
            return c == '(' || c == ')' || c == ',' || c == ':';
        }

        private static boolean isQuote(char c) {
            return c == '\'' || c == '"';
        }

        private static TokenType punctuation(char c) {
            return switch (c) {
                case '(' -> TokenType.OPEN;
                case ')' -> TokenType.CLOSE;
                case ',' -> TokenType.COMMA;
                default -> TokenType.COLON;
            };
        }
    }
}
