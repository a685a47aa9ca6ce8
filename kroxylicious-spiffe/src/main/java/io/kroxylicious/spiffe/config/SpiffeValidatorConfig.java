/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration of the SPIFFE certificate validator.
 * <br/>
 * Trust material comes from exactly one of two sources: a watched bundle map file, or a static
 * list of trust domains with their PEM bundles.
 *
 * @param trustBundleMap the bundle map file, hot reloaded on change.
 * @param trustDomains static trust domains. Never reloaded.
 * @param allowExpiredCertificate accept chains whose certificates are outside their validity period.
 * @param subjectAltNameMatchers if non-empty, a peer is accepted only if one of its SANs satisfies one of these.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SpiffeValidatorConfig(@JsonProperty("trustBundleMap") @Nullable TrustBundleMapConfig trustBundleMap,
                                    @JsonProperty("trustDomains") List<TrustDomainConfig> trustDomains,
                                    @JsonProperty("allowExpiredCertificate") boolean allowExpiredCertificate,
                                    @JsonProperty("subjectAltNameMatchers") List<SanMatcherDefinition> subjectAltNameMatchers) {

    @JsonCreator
    public SpiffeValidatorConfig {
        trustDomains = trustDomains == null ? List.of() : List.copyOf(trustDomains);
        subjectAltNameMatchers = subjectAltNameMatchers == null ? List.of() : List.copyOf(subjectAltNameMatchers);
    }

    public static SpiffeValidatorConfig forTrustBundleMap(String filename) {
        return new SpiffeValidatorConfig(new TrustBundleMapConfig(filename), List.of(), false, List.of());
    }

    public static SpiffeValidatorConfig forTrustDomains(List<TrustDomainConfig> trustDomains) {
        return new SpiffeValidatorConfig(null, trustDomains, false, List.of());
    }

    public SpiffeValidatorConfig withAllowExpiredCertificate(boolean allowExpired) {
        return new SpiffeValidatorConfig(trustBundleMap, trustDomains, allowExpired, subjectAltNameMatchers);
    }

    public SpiffeValidatorConfig withSubjectAltNameMatchers(List<SanMatcherDefinition> matchers) {
        return new SpiffeValidatorConfig(trustBundleMap, trustDomains, allowExpiredCertificate, Objects.requireNonNull(matchers));
    }

    @JsonIgnore
    public boolean definesTrustBundleMap() {
        return trustBundleMap != null;
    }
}
