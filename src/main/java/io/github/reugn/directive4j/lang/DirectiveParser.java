package io.github.reugn.directive4j.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code !Name arguments} directives from a documentation comment.
 * <p>
 * A directive starts with {@code !} followed by an identifier. The {@code !} must open the
 * line or follow whitespace or {@code *}, so prose such as {@code a != b} is never picked
 * up. Its argument text runs to the end of the line or to the closing {@code *}{@code /},
 * whichever comes first.
 * <p>
 * Works on raw comment blocks ({@code /** ... *}{@code /}) as well as on the stripped text
 * returned by {@link javax.lang.model.util.Elements#getDocComment}.
 */
public final class DirectiveParser {

    private static final Pattern DIRECTIVE = Pattern.compile(
            "(?:^|(?<=[\\s*]))!([A-Za-z_][A-Za-z0-9_]*)([^\\r\\n]*)", Pattern.MULTILINE);

    private static final String COMMENT_END = "*/";

    private DirectiveParser() {
    }

    /**
     * Scans {@code comment} for directives.
     *
     * @param comment comment text, may be {@code null}
     * @return the directives in source order; empty when there are none
     */
    public static List<RawInvocation> parse(String comment) {
        if (comment == null || comment.isEmpty()) {
            return List.of();
        }

        List<RawInvocation> invocations = new ArrayList<>();
        Matcher matcher = DIRECTIVE.matcher(comment);
        while (matcher.find()) {
            String arguments = matcher.group(2);
            int end = arguments.indexOf(COMMENT_END);
            if (end >= 0) {
                arguments = arguments.substring(0, end);
            }
            invocations.add(new RawInvocation(matcher.group(1), arguments.trim()));
        }
        return invocations;
    }
}
