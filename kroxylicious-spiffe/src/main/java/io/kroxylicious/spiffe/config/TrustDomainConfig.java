/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A trust domain and the PEM encoded bundle (CA certificates and optional CRLs) trusted for it.
 *
 * @param name trust domain name, e.g. {@code example.org}.
 * @param trustBundle source of the PEM bundle.
 */
public record TrustDomainConfig(@JsonProperty(value = "name", required = true) String name,
                                @JsonProperty(value = "trustBundle", required = true) DataSource trustBundle) {

    @JsonCreator
    public TrustDomainConfig {
        if (name == null || name.isEmpty()) {
            throw new IllegalConfigurationException("trust domain name must not be empty");
        }
        if (trustBundle == null) {
            throw new IllegalConfigurationException("trust domain '" + name + "' has no trustBundle");
        }
    }
}
