/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

/**
 * Signals that the validator configuration, or the trust material it refers to, cannot be used
 * to construct a validator. Thrown only while the validator is being built; failures detected by
 * a later reload are reported as values instead.
 */
public class IllegalConfigurationException extends RuntimeException {
    public IllegalConfigurationException(String message) {
        super(message);
    }

    public IllegalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
