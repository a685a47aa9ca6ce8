/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

/**
 * Thrown when trust material is malformed or inconsistent. Any such problem aborts the whole load.
 */
public class TrustBundleException extends Exception {

    public TrustBundleException(String message) {
        super(message);
    }

    public TrustBundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
