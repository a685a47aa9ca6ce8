/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.cert;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Utility methods for X.509 certificates.
 */
public final class CertificateUtil {

    private static final String SHA_256 = "SHA-256";

    /** Key usage bit positions, RFC 5280 section 4.2.1.3. */
    private static final int KEY_CERT_SIGN = 5;
    private static final int CRL_SIGN = 6;

    private CertificateUtil() {
        // Utility class
    }

    /**
     * Parses a single DER encoded certificate.
     *
     * @param der DER bytes
     * @return the certificate
     * @throws IOException if the bytes are empty or not a certificate
     */
    @NonNull
    public static X509Certificate parseDerCertificate(@NonNull byte[] der) throws IOException {
        if (der.length == 0) {
            throw new IOException("Empty certificate");
        }
        try {
            CertificateFactory certFactory = CertificateFactory.getInstance("X.509");
            var certificate = certFactory.generateCertificate(new ByteArrayInputStream(der));
            if (!(certificate instanceof X509Certificate x509Certificate)) {
                throw new IOException("Not an X.509 certificate: " + certificate.getType());
            }
            return x509Certificate;
        }
        catch (CertificateException e) {
            throw new IOException("Failed to parse certificate", e);
        }
    }

    /**
     * Computes the SHA-256 fingerprint of the certificate's DER encoding.
     *
     * @param certificate certificate
     * @return 32 byte digest
     */
    @NonNull
    public static byte[] sha256Fingerprint(@NonNull X509Certificate certificate) {
        try {
            return MessageDigest.getInstance(SHA_256).digest(certificate.getEncoded());
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Required digest algorithm " + SHA_256 + " not available", e);
        }
        catch (CertificateEncodingException e) {
            throw new IllegalStateException("Unable to encode certificate " + certificate.getSubjectX500Principal(), e);
        }
    }

    /**
     * Whole days from now until the certificate's {@code notAfter}.
     *
     * @param certificate certificate
     * @param clock time source
     * @return the number of days, or empty if the certificate has already expired
     */
    @NonNull
    public static OptionalInt daysUntilExpiration(@NonNull X509Certificate certificate, @NonNull Clock clock) {
        Duration remaining = Duration.between(clock.instant(), certificate.getNotAfter().toInstant());
        if (remaining.isNegative()) {
            return OptionalInt.empty();
        }
        long days = remaining.toDays();
        return OptionalInt.of(days > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) days);
    }

    /**
     * Checks that a certificate can serve as a SPIFFE leaf: it is not a CA and may not sign
     * certificates or CRLs.
     *
     * @param leaf candidate leaf certificate
     * @return true if the certificate is an acceptable end entity
     */
    public static boolean isEndEntity(@NonNull X509Certificate leaf) {
        if (leaf.getBasicConstraints() != -1) {
            return false;
        }
        boolean[] keyUsage = leaf.getKeyUsage();
        if (keyUsage == null) {
            return true;
        }
        return !hasBit(keyUsage, KEY_CERT_SIGN) && !hasBit(keyUsage, CRL_SIGN);
    }

    private static boolean hasBit(boolean[] bits, int index) {
        return bits.length > index && bits[index];
    }

    /**
     * Describes a certificate for introspection.
     *
     * @param certificate certificate
     * @param path where it was loaded from
     * @param clock time source
     * @return details
     */
    @NonNull
    public static CertificateDetails details(@NonNull X509Certificate certificate, @NonNull String path, @NonNull Clock clock) {
        Instant validFrom = certificate.getNotBefore().toInstant();
        Instant expiration = certificate.getNotAfter().toInstant();
        var sans = SubjectAltName.of(certificate).stream().map(SubjectAltName::value).toList();
        return new CertificateDetails(path,
                certificate.getSerialNumber().toString(16),
                certificate.getSubjectX500Principal().getName(),
                sans,
                daysUntilExpiration(certificate, clock),
                validFrom,
                expiration);
    }
}
