package io.github.reugn.directive4j.lang;

import java.util.Objects;

/**
 * One {@code !Name ...} directive as extracted from a comment, before evaluation.
 *
 * @param name         the directive identifier, without the leading {@code !}
 * @param argumentText the raw text following the identifier, trimmed
 */
public record RawInvocation(String name, String argumentText) {

    public RawInvocation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(argumentText, "argumentText");
    }
}
