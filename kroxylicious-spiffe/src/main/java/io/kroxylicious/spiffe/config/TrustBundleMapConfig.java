/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of a SPIFFE bundle map: a JSON document mapping trust domain names to their bundles.
 * The file is watched and re-read whenever it changes.
 *
 * @param filename path of the bundle map file.
 */
public record TrustBundleMapConfig(@JsonProperty(value = "filename", required = true) String filename) {

    @JsonCreator
    public TrustBundleMapConfig {
        Objects.requireNonNull(filename, "filename");
        if (filename.isBlank()) {
            throw new IllegalConfigurationException("trustBundleMap filename must not be empty");
        }
    }
}
