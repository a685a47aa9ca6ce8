/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kroxylicious.spiffe.config;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Parses {@link SpiffeValidatorConfig} from YAML (and therefore also from JSON).
 */
public class ConfigParser {

    private static final ObjectMapper MAPPER = createObjectMapper();

    public SpiffeValidatorConfig parseConfiguration(String configuration) {
        try {
            return MAPPER.readValue(configuration, SpiffeValidatorConfig.class);
        }
        catch (IOException e) {
            throw new IllegalConfigurationException("Couldn't parse SPIFFE validator configuration", e);
        }
    }

    private static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
