package io.github.reugn.directive4j.lang;

import java.util.Locale;

/**
 * Case folding applied to a keyed value before it is compared with accepted values.
 */
public enum CaseNormalization {
    NONE {
        @Override
        String apply(String text) {
            return text;
        }
    },
    LOWER {
        @Override
        String apply(String text) {
            return text.toLowerCase(Locale.ROOT);
        }
    },
    UPPER {
        @Override
        String apply(String text) {
            return text.toUpperCase(Locale.ROOT);
        }
    };

    abstract String apply(String text);
}
