/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.cert;

import java.security.cert.X509Certificate;
import java.util.Optional;

import io.kroxylicious.spiffe.config.SanType;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Trust domain helpers for SPIFFE IDs ({@code spiffe://<trust-domain>/<path>}).
 */
public final class TrustDomains {

    public static final String SPIFFE_PREFIX = "spiffe://";

    private TrustDomains() {
    }

    /**
     * Extracts the trust domain from a SPIFFE ID. Any path component is discarded.
     *
     * @param spiffeId a SAN URI
     * @return the trust domain, or the empty string if the URI is not a SPIFFE ID
     */
    @NonNull
    public static String extractTrustDomain(@NonNull String spiffeId) {
        if (!spiffeId.startsWith(SPIFFE_PREFIX)) {
            return "";
        }
        int slash = spiffeId.indexOf('/', SPIFFE_PREFIX.length());
        if (slash < 0) {
            return spiffeId.substring(SPIFFE_PREFIX.length());
        }
        return spiffeId.substring(SPIFFE_PREFIX.length(), slash);
    }

    /**
     * Returns the first URI SAN of the certificate that is a SPIFFE ID.
     *
     * @param certificate certificate
     * @return the SPIFFE ID, or empty
     */
    @NonNull
    public static Optional<String> firstSpiffeId(@NonNull X509Certificate certificate) {
        return SubjectAltName.of(certificate).stream()
                .filter(san -> san.type() == SanType.URI)
                .map(SubjectAltName::value)
                .filter(uri -> uri.startsWith(SPIFFE_PREFIX))
                .findFirst();
    }

    /**
     * Returns the trust domain embedded in the certificate's first SPIFFE ID.
     *
     * @param certificate certificate
     * @return the trust domain, or empty if the certificate carries no SPIFFE ID
     */
    @NonNull
    public static Optional<String> embeddedTrustDomain(@NonNull X509Certificate certificate) {
        return firstSpiffeId(certificate).map(TrustDomains::extractTrustDomain);
    }

    /**
     * Returns the trust domain a peer leaf certificate claims: derived from its first URI SAN,
     * which in a valid SVID is the only one.
     *
     * @param leaf leaf certificate
     * @return the trust domain, or empty if the leaf has no URI SAN or it is not a SPIFFE ID
     */
    @NonNull
    public static Optional<String> claimedTrustDomain(@NonNull X509Certificate leaf) {
        return SubjectAltName.firstUri(leaf)
                .map(TrustDomains::extractTrustDomain)
                .filter(domain -> !domain.isEmpty());
    }
}
