/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import javax.security.auth.x500.X500Principal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.util.concurrent.EventExecutor;

import io.kroxylicious.spiffe.bundle.BundleLoadResult;
import io.kroxylicious.spiffe.bundle.BundleMapLoader;
import io.kroxylicious.spiffe.bundle.StaticTrustDomainLoader;
import io.kroxylicious.spiffe.bundle.TrustDomainStore;
import io.kroxylicious.spiffe.bundle.TrustSnapshot;
import io.kroxylicious.spiffe.cert.CertificateDetails;
import io.kroxylicious.spiffe.cert.CertificateUtil;
import io.kroxylicious.spiffe.config.IllegalConfigurationException;
import io.kroxylicious.spiffe.config.SpiffeValidatorConfig;
import io.kroxylicious.spiffe.distribution.SnapshotDistributor;
import io.kroxylicious.spiffe.reload.ReloadWatcher;
import io.kroxylicious.spiffe.verify.ChainVerifier;
import io.kroxylicious.spiffe.verify.StringSanMatcher;
import io.kroxylicious.spiffe.verify.ValidationResult;
import io.kroxylicious.spiffe.verify.VerificationMetrics;
import io.kroxylicious.spiffe.verify.VerificationParameters;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Validates peer certificate chains against the trust bundle of the SPIFFE trust domain the
 * peer claims.
 * <p>
 * Trust material comes from either a bundle map file, which is watched and reloaded whenever it
 * changes, or a static list of trust domains. It is installed on every worker before the
 * constructor returns, so the validator is usable as soon as it exists. A reload that fails
 * leaves the previous trust material in place.
 * </p>
 * <p>
 * Verification and the other queries read the calling worker's own copy of the trust material
 * and never block.
 * </p>
 */
public class SpiffeValidator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpiffeValidator.class);

    public static final String BUNDLE_RELOADS_METER_NAME = "kroxylicious_spiffe_bundle_reloads";
    public static final String BUNDLE_RELOAD_FAILURES_METER_NAME = "kroxylicious_spiffe_bundle_reload_failures";

    private final EventExecutor controlExecutor;
    private final Clock clock;
    private final SnapshotDistributor distributor;
    private final ChainVerifier verifier;
    private final String caFileName;
    @Nullable
    private final BundleMapLoader bundleMapLoader;
    @Nullable
    private final ReloadWatcher reloadWatcher;
    private final Counter reloads;
    private final Counter reloadFailures;

    /**
     * Creates the validator, loads its trust material and installs it on every worker.
     *
     * @param config configuration
     * @param context executors, metrics and clock
     * @throws IllegalConfigurationException if the configuration or the initial trust material is unusable
     * @throws java.io.UncheckedIOException if the bundle map cannot be watched
     */
    public SpiffeValidator(@NonNull SpiffeValidatorConfig config, @NonNull SpiffeValidatorContext context) {
        Objects.requireNonNull(config);
        Objects.requireNonNull(context);
        boolean hasTrustDomains = !config.trustDomains().isEmpty();
        if (config.definesTrustBundleMap() && hasTrustDomains) {
            throw new IllegalConfigurationException("Cannot configure both trustDomains and trustBundleMap");
        }
        if (!config.definesTrustBundleMap() && !hasTrustDomains) {
            throw new IllegalConfigurationException("SPIFFE validator requires either trustDomains or trustBundleMap");
        }

        this.controlExecutor = context.controlExecutor();
        this.clock = context.clock();
        this.verifier = new ChainVerifier(StringSanMatcher.forSpiffe(config.subjectAltNameMatchers()),
                config.allowExpiredCertificate(),
                clock,
                new VerificationMetrics(context.meterRegistry()));
        this.distributor = new SnapshotDistributor(controlExecutor, context.workers());
        this.reloads = Counter.builder(BUNDLE_RELOADS_METER_NAME)
                .description("Count of SPIFFE bundle map reloads that replaced the trust material.")
                .register(context.meterRegistry());
        this.reloadFailures = Counter.builder(BUNDLE_RELOAD_FAILURES_METER_NAME)
                .description("Count of SPIFFE bundle map reloads rejected, leaving the trust material unchanged.")
                .register(context.meterRegistry());

        if (config.definesTrustBundleMap()) {
            this.bundleMapLoader = new BundleMapLoader(bundleMapPath(config));
            var result = bundleMapLoader.load();
            if (result instanceof BundleLoadResult.Failed failed) {
                throw new IllegalConfigurationException("Failed to load SPIFFE bundle map: " + failed.reason());
            }
            distributor.install(((BundleLoadResult.Loaded) result).snapshot());
            this.caFileName = bundleMapLoader.bundleMapPath().toString();
            this.reloadWatcher = new ReloadWatcher(bundleMapLoader.bundleMapPath(), this::scheduleReload);
            reloadWatcher.start();
        }
        else {
            var material = StaticTrustDomainLoader.load(config.trustDomains());
            distributor.install(material.snapshot());
            this.caFileName = material.caFileName();
            this.bundleMapLoader = null;
            this.reloadWatcher = null;
        }
        LOGGER.info("SPIFFE validator ready with trust domains {}", distributor.current().trustDomains());
    }

    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "The bundle map path is provided by the administrator via the validator configuration.")
    private static Path bundleMapPath(SpiffeValidatorConfig config) {
        return Path.of(config.trustBundleMap().filename());
    }

    /**
     * Verifies a peer certificate chain.
     *
     * @param chain peer certificates, leaf first
     * @param parameters validation time and required purpose
     * @return the outcome
     */
    @NonNull
    public ValidationResult doVerifyCertChain(@NonNull List<X509Certificate> chain, @NonNull VerificationParameters parameters) {
        return verifier.verify(chain, distributor.current(), parameters);
    }

    /**
     * Returns the store of the trust domain the leaf claims in its URI SAN.
     *
     * @param leaf leaf certificate
     * @return the store, or empty if the leaf claims no trust domain or an unknown one
     */
    @NonNull
    public Optional<TrustDomainStore> getTrustBundleStore(@NonNull X509Certificate leaf) {
        return ChainVerifier.trustBundleStore(leaf, distributor.current());
    }

    /**
     * Feeds the SHA-256 fingerprint of every CA certificate into the digest, so that TLS
     * sessions are not resumed across different trust material.
     *
     * @param digest digest to update
     */
    public void updateDigestForSessionId(@NonNull MessageDigest digest) {
        for (X509Certificate certificate : distributor.current().caCertificates()) {
            digest.update(CertificateUtil.sha256Fingerprint(certificate));
        }
    }

    /**
     * Whole days until the first CA certificate expires.
     *
     * @return the days, {@link Integer#MAX_VALUE} if there are no CA certificates, or empty if
     * one has already expired
     */
    @NonNull
    public OptionalInt daysUntilFirstCertExpires() {
        int days = Integer.MAX_VALUE;
        for (X509Certificate certificate : distributor.current().caCertificates()) {
            var remaining = CertificateUtil.daysUntilExpiration(certificate, clock);
            if (remaining.isEmpty()) {
                return OptionalInt.empty();
            }
            days = Math.min(days, remaining.getAsInt());
        }
        return OptionalInt.of(days);
    }

    @NonNull
    public String getCaFileName() {
        return caFileName;
    }

    /**
     * Describes the first CA certificate. Only one CA is ever described, whatever the number of
     * trust domains.
     *
     * @return details, or empty if there are no CA certificates
     */
    @NonNull
    public Optional<CertificateDetails> getCaCertInformation() {
        return distributor.current().caCertificates().stream()
                .findFirst()
                .map(certificate -> CertificateUtil.details(certificate, caFileName, clock));
    }

    /**
     * CA certificates to advertise to TLS clients, one per subject name.
     *
     * @return certificates in load order
     */
    @NonNull
    public X509Certificate[] getAcceptedIssuers() {
        var bySubject = new LinkedHashMap<X500Principal, X509Certificate>();
        for (X509Certificate certificate : distributor.current().caCertificates()) {
            bySubject.putIfAbsent(certificate.getSubjectX500Principal(), certificate);
        }
        return bySubject.values().toArray(new X509Certificate[0]);
    }

    /**
     * @return the trust material visible to the calling thread.
     */
    @NonNull
    public TrustSnapshot currentSnapshot() {
        return distributor.current();
    }

    private void scheduleReload() {
        controlExecutor.execute(this::reload);
    }

    private void reload() {
        Objects.requireNonNull(bundleMapLoader);
        LOGGER.info("SPIFFE bundle map {} changed, reloading", bundleMapLoader.bundleMapPath());
        var result = bundleMapLoader.load();
        if (result instanceof BundleLoadResult.Loaded loaded) {
            distributor.installAsync(loaded.snapshot());
            reloads.increment();
        }
        else if (result instanceof BundleLoadResult.Failed failed) {
            reloadFailures.increment();
            LOGGER.error("Failed to reload SPIFFE bundle map, keeping the current trust material: {}", failed.reason());
        }
    }

    /**
     * Stops watching the bundle map. The executors are left running.
     */
    @Override
    public void close() {
        if (reloadWatcher != null) {
            reloadWatcher.stop();
        }
        distributor.clear();
    }
}
