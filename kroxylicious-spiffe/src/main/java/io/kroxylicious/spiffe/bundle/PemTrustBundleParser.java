/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.cert.CRLException;
import java.security.cert.CertificateException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CRLConverter;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Parses a PEM trust bundle: a sequence of certificates and certificate revocation lists.
 * Other PEM objects (keys, requests) are ignored.
 */
public final class PemTrustBundleParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(PemTrustBundleParser.class);

    private PemTrustBundleParser() {
    }

    /**
     * The entries of a PEM bundle, in file order.
     *
     * @param certificates certificate entries
     * @param crls CRL entries
     */
    public record PemBundle(List<X509Certificate> certificates, List<X509CRL> crls) {
        public PemBundle {
            certificates = List.copyOf(certificates);
            crls = List.copyOf(crls);
        }

        public boolean isEmpty() {
            return certificates.isEmpty() && crls.isEmpty();
        }
    }

    /**
     * Parses the PEM bytes.
     *
     * @param pem PEM text
     * @return the certificates and CRLs found
     * @throws TrustBundleException if the PEM is malformed or holds no certificate or CRL
     */
    @NonNull
    public static PemBundle parse(@NonNull byte[] pem) throws TrustBundleException {
        var certificateConverter = new JcaX509CertificateConverter();
        var crlConverter = new JcaX509CRLConverter();
        List<X509Certificate> certificates = new ArrayList<>();
        List<X509CRL> crls = new ArrayList<>();
        try (var parser = new PEMParser(new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII))) {
            Object entry;
            while ((entry = parser.readObject()) != null) {
                if (entry instanceof X509CertificateHolder holder) {
                    certificates.add(certificateConverter.getCertificate(holder));
                }
                else if (entry instanceof X509CRLHolder holder) {
                    crls.add(crlConverter.getCRL(holder));
                }
                else {
                    LOGGER.debug("Ignoring PEM entry of type {}", entry.getClass().getSimpleName());
                }
            }
        }
        catch (IOException e) {
            throw new TrustBundleException("Malformed PEM data: " + e.getMessage(), e);
        }
        catch (CertificateException | CRLException e) {
            throw new TrustBundleException("Failed to convert PEM entry: " + e.getMessage(), e);
        }
        var bundle = new PemBundle(certificates, crls);
        if (bundle.isEmpty()) {
            throw new TrustBundleException("No certificates or CRLs found in PEM data");
        }
        return bundle;
    }
}
