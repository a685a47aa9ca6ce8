/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * Subject Alternative Name types, numbered as the {@code GeneralName} choice tags of RFC 5280
 * (the same numbers {@link java.security.cert.X509Certificate#getSubjectAlternativeNames()} reports).
 */
public enum SanType {
    OTHER_NAME(0),
    EMAIL(1),
    DNS(2),
    URI(6),
    IP_ADDRESS(7);

    private final int tag;

    SanType(int tag) {
        this.tag = tag;
    }

    public static Optional<SanType> fromTag(int tag) {
        return Arrays.stream(values()).filter(t -> t.tag == tag).findFirst();
    }
}
