/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kroxylicious.spiffe.cert.SubjectAltName;
import io.kroxylicious.spiffe.config.SanMatcherDefinition;
import io.kroxylicious.spiffe.config.SanType;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Matches SAN entries of one type with a {@link StringMatcher}.
 *
 * @param sanType the only SAN type this matcher accepts
 * @param matcher applied to the entry's value
 */
public record StringSanMatcher(@NonNull SanType sanType, @NonNull StringMatcher matcher) implements SanMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(StringSanMatcher.class);

    public StringSanMatcher {
        Objects.requireNonNull(sanType);
        Objects.requireNonNull(matcher);
    }

    @Override
    public boolean match(SubjectAltName san) {
        return san.type() == sanType && matcher.matches(san.value());
    }

    /**
     * Builds the matchers of a SPIFFE validator. Only URI matchers are kept: SPIFFE places no
     * restriction on the other SAN types, so matching them would not identify a workload.
     *
     * @param definitions configured matchers, in order
     * @return URI matchers, in configuration order
     */
    @NonNull
    public static List<SanMatcher> forSpiffe(@NonNull List<SanMatcherDefinition> definitions) {
        var matchers = new ArrayList<SanMatcher>(definitions.size());
        for (SanMatcherDefinition definition : definitions) {
            if (definition.sanType() != SanType.URI) {
                LOGGER.warn("Ignoring subject alt name matcher of type {}: only URI matchers apply to SPIFFE identities", definition.sanType());
                continue;
            }
            matchers.add(new StringSanMatcher(SanType.URI, StringMatcher.of(definition.matcher())));
        }
        return List.copyOf(matchers);
    }
}
