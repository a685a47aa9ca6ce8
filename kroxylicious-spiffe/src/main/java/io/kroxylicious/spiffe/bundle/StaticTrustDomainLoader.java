/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kroxylicious.spiffe.config.DataSourceReader;
import io.kroxylicious.spiffe.config.IllegalConfigurationException;
import io.kroxylicious.spiffe.config.TrustDomainConfig;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Builds a snapshot from a static list of trust domains and their PEM bundles. Every problem
 * is fatal: this material is only ever loaded while the validator is constructed.
 */
public final class StaticTrustDomainLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaticTrustDomainLoader.class);

    private StaticTrustDomainLoader() {
    }

    /**
     * Loads the trust domains.
     *
     * @param trustDomains domains, each with its bundle source
     * @return the snapshot and the provenance of its first CA
     * @throws IllegalConfigurationException on a duplicate domain or an unreadable or unparsable bundle
     */
    @NonNull
    public static TrustMaterial load(@NonNull List<TrustDomainConfig> trustDomains) {
        var builder = TrustSnapshot.builder();
        String caFileName = "";
        for (TrustDomainConfig domain : trustDomains) {
            String name = domain.name();
            if (!builder.registerTrustDomain(name)) {
                throw new IllegalConfigurationException("Multiple trust bundles are given for one trust domain for " + name);
            }

            PemTrustBundleParser.PemBundle bundle;
            try {
                bundle = PemTrustBundleParser.parse(DataSourceReader.read(domain.trustBundle()));
            }
            catch (IOException | TrustBundleException e) {
                throw new IllegalConfigurationException("Failed to load trusted CA certificate for " + name, e);
            }

            for (X509Certificate certificate : bundle.certificates()) {
                try {
                    builder.addCertificate(name, certificate);
                }
                catch (TrustBundleException e) {
                    throw new IllegalConfigurationException("Failed to load trusted CA certificate for " + name + ": " + e.getMessage(), e);
                }
                if (caFileName.isEmpty()) {
                    // only one CA can be described, the first one loaded
                    caFileName = name + ": " + domain.trustBundle().describe();
                }
            }
            bundle.crls().forEach(crl -> builder.addCrl(name, crl));
            LOGGER.info("Loaded trust domain '{}' from {}: {} certificate(s), {} CRL(s)",
                    name, domain.trustBundle().describe(), bundle.certificates().size(), bundle.crls().size());
        }
        return new TrustMaterial(builder.build(), caFileName);
    }
}
