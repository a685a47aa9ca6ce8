/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import java.util.Objects;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Describes how a string is matched. Exactly one of the pattern properties must be given.
 *
 * @param exact the string must equal this value.
 * @param prefix the string must start with this value.
 * @param suffix the string must end with this value.
 * @param contains the string must contain this value.
 * @param safeRegex the whole string must match this regular expression.
 * @param ignoreCase compare case-insensitively. Not applicable to {@code safeRegex}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StringMatcherDefinition(@JsonProperty("exact") @Nullable String exact,
                                      @JsonProperty("prefix") @Nullable String prefix,
                                      @JsonProperty("suffix") @Nullable String suffix,
                                      @JsonProperty("contains") @Nullable String contains,
                                      @JsonProperty("safeRegex") @Nullable String safeRegex,
                                      @JsonProperty("ignoreCase") boolean ignoreCase) {

    @JsonCreator
    public StringMatcherDefinition {
        long specified = Stream.of(exact, prefix, suffix, contains, safeRegex).filter(Objects::nonNull).count();
        if (specified != 1) {
            throw new IllegalConfigurationException("A string matcher requires exactly one of exact, prefix, suffix, contains or safeRegex");
        }
        if (safeRegex != null && ignoreCase) {
            throw new IllegalConfigurationException("ignoreCase cannot be combined with safeRegex");
        }
    }

    public static StringMatcherDefinition exact(String value) {
        return new StringMatcherDefinition(value, null, null, null, null, false);
    }

    public static StringMatcherDefinition prefix(String value) {
        return new StringMatcherDefinition(null, value, null, null, null, false);
    }

    public static StringMatcherDefinition suffix(String value) {
        return new StringMatcherDefinition(null, null, value, null, null, false);
    }

    public static StringMatcherDefinition contains(String value) {
        return new StringMatcherDefinition(null, null, null, value, null, false);
    }

    public static StringMatcherDefinition safeRegex(String regex) {
        return new StringMatcherDefinition(null, null, null, null, regex, false);
    }
}
