/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.cert;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kroxylicious.spiffe.config.SanType;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A single Subject Alternative Name entry of a certificate.
 *
 * @param type the entry type
 * @param value the entry value as text
 */
public record SubjectAltName(@NonNull SanType type, @NonNull String value) {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubjectAltName.class);

    public SubjectAltName {
        Objects.requireNonNull(type);
        Objects.requireNonNull(value);
    }

    /**
     * Returns the SAN entries of the certificate in extension order. Entry types without a textual
     * value (other names, X.400 addresses, EDI party names) are omitted, as are directory names and
     * registered ids which no matcher can select. A SAN extension that cannot be decoded yields no
     * entries.
     *
     * @param certificate certificate
     * @return entries, possibly empty
     */
    @NonNull
    public static List<SubjectAltName> of(@NonNull X509Certificate certificate) {
        Collection<List<?>> names;
        try {
            names = certificate.getSubjectAlternativeNames();
        }
        catch (CertificateParsingException e) {
            LOGGER.debug("Unable to decode subject alternative names of {}", certificate.getSubjectX500Principal(), e);
            return List.of();
        }
        if (names == null) {
            return List.of();
        }
        var result = new ArrayList<SubjectAltName>(names.size());
        for (List<?> name : names) {
            if (name.size() < 2 || !(name.get(0) instanceof Integer tag) || !(name.get(1) instanceof String value)) {
                continue;
            }
            SanType.fromTag(tag).ifPresent(type -> result.add(new SubjectAltName(type, value)));
        }
        return result;
    }

    /**
     * Returns the first URI entry of the certificate, whatever its scheme.
     *
     * @param certificate certificate
     * @return the URI, or empty
     */
    @NonNull
    public static Optional<String> firstUri(@NonNull X509Certificate certificate) {
        return of(certificate).stream()
                .filter(san -> san.type() == SanType.URI)
                .map(SubjectAltName::value)
                .findFirst();
    }
}
