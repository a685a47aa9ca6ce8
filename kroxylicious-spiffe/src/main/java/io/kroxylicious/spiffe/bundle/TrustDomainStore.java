/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.security.cert.TrustAnchor;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The verification store of one trust domain: its CA certificates, used as trust anchors, and
 * its CRLs. Immutable.
 * <br/>
 * Every CA certificate is a trust anchor, so a chain may terminate at an intermediate that the
 * bundle carries. When the bundle carries at least one CRL, revocation is checked for every
 * certificate of a validated path.
 */
public final class TrustDomainStore {

    private final String trustDomain;
    private final List<X509Certificate> certificates;
    private final List<X509CRL> crls;
    private final Set<TrustAnchor> trustAnchors;

    private TrustDomainStore(String trustDomain, List<X509Certificate> certificates, List<X509CRL> crls) {
        this.trustDomain = trustDomain;
        this.certificates = List.copyOf(certificates);
        this.crls = List.copyOf(crls);
        var anchors = new LinkedHashSet<TrustAnchor>();
        this.certificates.forEach(certificate -> anchors.add(new TrustAnchor(certificate, null)));
        this.trustAnchors = Set.copyOf(anchors);
    }

    @NonNull
    public String trustDomain() {
        return trustDomain;
    }

    /**
     * @return the CA certificates of the domain, in load order.
     */
    @NonNull
    public List<X509Certificate> certificates() {
        return certificates;
    }

    @NonNull
    public List<X509CRL> crls() {
        return crls;
    }

    /**
     * Trust anchors for PKIX validation. Empty when the domain's bundle had no usable certificate.
     *
     * @return anchors
     */
    @NonNull
    public Set<TrustAnchor> trustAnchors() {
        return trustAnchors;
    }

    public boolean isCrlCheckEnabled() {
        return !crls.isEmpty();
    }

    public boolean isTrustAnchor(@NonNull X509Certificate certificate) {
        return certificates.contains(certificate);
    }

    @Override
    public String toString() {
        return "TrustDomainStore[trustDomain=" + trustDomain + ", certificates=" + certificates.size() + ", crls=" + crls.size() + "]";
    }

    static Builder builder(String trustDomain) {
        return new Builder(trustDomain);
    }

    static final class Builder {
        private final String trustDomain;
        private final List<X509Certificate> certificates = new ArrayList<>();
        private final List<X509CRL> crls = new ArrayList<>();

        private Builder(String trustDomain) {
            this.trustDomain = Objects.requireNonNull(trustDomain);
        }

        void addCertificate(X509Certificate certificate) {
            if (!certificates.contains(certificate)) {
                certificates.add(certificate);
            }
        }

        void addCrl(X509CRL crl) {
            crls.add(crl);
        }

        TrustDomainStore build() {
            return new TrustDomainStore(trustDomain, certificates, crls);
        }
    }
}
