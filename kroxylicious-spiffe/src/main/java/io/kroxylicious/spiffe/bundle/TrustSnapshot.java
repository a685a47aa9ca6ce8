/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import io.kroxylicious.spiffe.cert.TrustDomains;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An immutable point-in-time view of all configured trust bundles.
 * <br/>
 * Every store holds only certificates whose SPIFFE ID, if they carry one, belongs to the store's
 * trust domain. A snapshot is never changed once built: reloads build a new one.
 */
public final class TrustSnapshot {

    private static final TrustSnapshot EMPTY = new Builder().build();

    private final Map<String, TrustDomainStore> stores;
    private final List<X509Certificate> caCertificates;
    @Nullable
    private final Duration refreshHint;
    @Nullable
    private final Long sequence;

    private TrustSnapshot(Map<String, TrustDomainStore> stores,
                          List<X509Certificate> caCertificates,
                          @Nullable Duration refreshHint,
                          @Nullable Long sequence) {
        this.stores = Collections.unmodifiableMap(new LinkedHashMap<>(stores));
        this.caCertificates = List.copyOf(caCertificates);
        this.refreshHint = refreshHint;
        this.sequence = sequence;
    }

    @NonNull
    public static TrustSnapshot empty() {
        return EMPTY;
    }

    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the trust domains, in load order.
     */
    @NonNull
    public Set<String> trustDomains() {
        return stores.keySet();
    }

    @NonNull
    public Optional<TrustDomainStore> store(@NonNull String trustDomain) {
        return Optional.ofNullable(stores.get(trustDomain));
    }

    /**
     * All CA certificates across all domains, in load order. Used for digests, expiration and
     * introspection, never for store selection.
     *
     * @return certificates
     */
    @NonNull
    public List<X509Certificate> caCertificates() {
        return caCertificates;
    }

    /**
     * Refresh hint carried by the bundle map. Informational only.
     *
     * @return hint
     */
    @NonNull
    public Optional<Duration> refreshHint() {
        return Optional.ofNullable(refreshHint);
    }

    /**
     * Sequence number carried by the bundle map. Informational only.
     *
     * @return sequence
     */
    @NonNull
    public OptionalLong sequence() {
        return sequence == null ? OptionalLong.empty() : OptionalLong.of(sequence);
    }

    public boolean isEmpty() {
        return stores.isEmpty();
    }

    @Override
    public String toString() {
        return "TrustSnapshot[trustDomains=" + stores.keySet() + ", caCertificates=" + caCertificates.size() + "]";
    }

    /**
     * Accumulates trust material for a snapshot. Not thread safe; confined to the loading thread.
     */
    public static final class Builder {
        private final Map<String, TrustDomainStore.Builder> stores = new LinkedHashMap<>();
        private final List<X509Certificate> caCertificates = new ArrayList<>();
        private Duration refreshHint;
        private Long sequence;

        private Builder() {
        }

        /**
         * Registers a trust domain with an empty store, unless it is already registered.
         *
         * @param trustDomain domain
         * @return true if the domain was not registered before
         */
        public boolean registerTrustDomain(@NonNull String trustDomain) {
            if (stores.containsKey(trustDomain)) {
                return false;
            }
            stores.put(trustDomain, TrustDomainStore.builder(trustDomain));
            return true;
        }

        /**
         * Adds a CA certificate to the domain's store and to the flattened CA list.
         *
         * @param trustDomain registered domain
         * @param certificate CA certificate
         * @throws TrustBundleException if the certificate's SPIFFE ID names another trust domain
         */
        public Builder addCertificate(@NonNull String trustDomain, @NonNull X509Certificate certificate) throws TrustBundleException {
            var embedded = TrustDomains.embeddedTrustDomain(certificate);
            if (embedded.isPresent() && !embedded.get().equals(trustDomain)) {
                throw new TrustBundleException("Domain specified in bundle '" + trustDomain + "' and in SAN '" + embedded.get() + "' do not match");
            }
            storeFor(trustDomain).addCertificate(certificate);
            caCertificates.add(certificate);
            return this;
        }

        public Builder addCrl(@NonNull String trustDomain, @NonNull X509CRL crl) {
            storeFor(trustDomain).addCrl(crl);
            return this;
        }

        public Builder refreshHint(@Nullable Duration refreshHint) {
            this.refreshHint = refreshHint;
            return this;
        }

        public Builder sequence(@Nullable Long sequence) {
            this.sequence = sequence;
            return this;
        }

        private TrustDomainStore.Builder storeFor(String trustDomain) {
            var store = stores.get(trustDomain);
            if (store == null) {
                throw new IllegalStateException("Trust domain '" + trustDomain + "' has not been registered");
            }
            return store;
        }

        @NonNull
        public TrustSnapshot build() {
            var built = new LinkedHashMap<String, TrustDomainStore>();
            stores.forEach((domain, store) -> built.put(domain, store.build()));
            return new TrustSnapshot(built, caCertificates, refreshHint, sequence);
        }
    }
}
