/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import io.kroxylicious.spiffe.cert.SubjectAltName;

/**
 * Decides whether a Subject Alternative Name entry of a peer certificate is acceptable.
 */
@FunctionalInterface
public interface SanMatcher {

    /**
     * @param san a SAN entry of the peer's leaf certificate
     * @return true if the entry satisfies this matcher
     */
    boolean match(SubjectAltName san);
}
