/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.cert;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

/**
 * Descriptive information about a CA certificate, for introspection.
 *
 * @param path where the certificate was loaded from
 * @param serialNumber serial number, lower case hex
 * @param subject subject distinguished name (RFC 2253)
 * @param subjectAltNames subject alternative name values
 * @param daysUntilExpiration whole days until the certificate expires, empty if it already has
 * @param validFrom start of the validity period
 * @param expirationTime end of the validity period
 */
public record CertificateDetails(String path,
                                 String serialNumber,
                                 String subject,
                                 List<String> subjectAltNames,
                                 OptionalInt daysUntilExpiration,
                                 Instant validFrom,
                                 Instant expirationTime) {

    public CertificateDetails {
        subjectAltNames = List.copyOf(subjectAltNames);
    }
}
