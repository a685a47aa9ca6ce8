/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Matches a Subject Alternative Name of a given type against a string matcher.
 *
 * @param sanType the type of SAN entries this matcher applies to.
 * @param matcher how the SAN value is matched.
 */
public record SanMatcherDefinition(@JsonProperty(value = "sanType", required = true) SanType sanType,
                                   @JsonProperty(value = "matcher", required = true) StringMatcherDefinition matcher) {

    @JsonCreator
    public SanMatcherDefinition {
        if (sanType == null) {
            throw new IllegalConfigurationException("subjectAltNameMatcher requires a sanType");
        }
        if (matcher == null) {
            throw new IllegalConfigurationException("subjectAltNameMatcher requires a matcher");
        }
    }

    public static SanMatcherDefinition uri(StringMatcherDefinition matcher) {
        return new SanMatcherDefinition(SanType.URI, matcher);
    }
}
