/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import io.kroxylicious.spiffe.config.IllegalConfigurationException;
import io.kroxylicious.spiffe.config.StringMatcherDefinition;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Matches a string value.
 */
@FunctionalInterface
public interface StringMatcher {

    boolean matches(@NonNull String value);

    /**
     * Builds the matcher a definition describes.
     *
     * @param definition definition
     * @return matcher
     * @throws IllegalConfigurationException if the regular expression does not compile
     */
    static StringMatcher of(@NonNull StringMatcherDefinition definition) {
        boolean ignoreCase = definition.ignoreCase();
        if (definition.exact() != null) {
            return new Exact(definition.exact(), ignoreCase);
        }
        else if (definition.prefix() != null) {
            return new Prefix(definition.prefix(), ignoreCase);
        }
        else if (definition.suffix() != null) {
            return new Suffix(definition.suffix(), ignoreCase);
        }
        else if (definition.contains() != null) {
            return new Contains(definition.contains(), ignoreCase);
        }
        try {
            return new Regex(Pattern.compile(definition.safeRegex()));
        }
        catch (PatternSyntaxException e) {
            throw new IllegalConfigurationException("Invalid safeRegex '" + definition.safeRegex() + "'", e);
        }
    }

    private static String fold(String value, boolean ignoreCase) {
        return ignoreCase ? value.toLowerCase(Locale.ROOT) : value;
    }

    record Exact(String expected, boolean ignoreCase) implements StringMatcher {
        @Override
        public boolean matches(@NonNull String value) {
            return ignoreCase ? expected.equalsIgnoreCase(value) : expected.equals(value);
        }
    }

    record Prefix(String prefix, boolean ignoreCase) implements StringMatcher {
        @Override
        public boolean matches(@NonNull String value) {
            return fold(value, ignoreCase).startsWith(fold(prefix, ignoreCase));
        }
    }

    record Suffix(String suffix, boolean ignoreCase) implements StringMatcher {
        @Override
        public boolean matches(@NonNull String value) {
            return fold(value, ignoreCase).endsWith(fold(suffix, ignoreCase));
        }
    }

    record Contains(String substring, boolean ignoreCase) implements StringMatcher {
        @Override
        public boolean matches(@NonNull String value) {
            return fold(value, ignoreCase).contains(fold(substring, ignoreCase));
        }
    }

    record Regex(Pattern pattern) implements StringMatcher {
        @Override
        public boolean matches(@NonNull String value) {
            return pattern.matcher(value).matches();
        }
    }
}
