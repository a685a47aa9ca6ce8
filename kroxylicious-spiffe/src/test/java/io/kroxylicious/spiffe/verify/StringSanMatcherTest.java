/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.kroxylicious.spiffe.cert.SubjectAltName;
import io.kroxylicious.spiffe.config.SanMatcherDefinition;
import io.kroxylicious.spiffe.config.SanType;
import io.kroxylicious.spiffe.config.StringMatcherDefinition;

import static org.assertj.core.api.Assertions.assertThat;

class StringSanMatcherTest {

    @Test
    void matchesOnlyItsSanType() {
        var matcher = new StringSanMatcher(SanType.URI, StringMatcher.of(StringMatcherDefinition.suffix("example.org")));

        assertThat(matcher.match(new SubjectAltName(SanType.URI, "spiffe://example.org"))).isTrue();
        assertThat(matcher.match(new SubjectAltName(SanType.DNS, "example.org"))).isFalse();
    }

    @Test
    void keepsOnlyUriMatchersInOrder() {
        var matchers = StringSanMatcher.forSpiffe(List.of(
                new SanMatcherDefinition(SanType.DNS, StringMatcherDefinition.exact("a.example.org")),
                SanMatcherDefinition.uri(StringMatcherDefinition.exact("spiffe://example.org/a")),
                new SanMatcherDefinition(SanType.EMAIL, StringMatcherDefinition.contains("@")),
                SanMatcherDefinition.uri(StringMatcherDefinition.prefix("spiffe://example.org/b"))));

        assertThat(matchers).hasSize(2)
                .allSatisfy(matcher -> assertThat(matcher).isInstanceOf(StringSanMatcher.class))
                .extracting(matcher -> ((StringSanMatcher) matcher).sanType())
                .containsOnly(SanType.URI);
        assertThat(matchers.get(0).match(new SubjectAltName(SanType.URI, "spiffe://example.org/a"))).isTrue();
        assertThat(matchers.get(1).match(new SubjectAltName(SanType.URI, "spiffe://example.org/b/c"))).isTrue();
    }

    @Test
    void noDefinitionsGivesNoMatchers() {
        assertThat(StringSanMatcher.forSpiffe(List.of())).isEmpty();
    }
}
