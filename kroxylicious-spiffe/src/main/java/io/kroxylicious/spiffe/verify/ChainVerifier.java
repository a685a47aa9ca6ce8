/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.cert.CRLReason;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertStore;
import java.security.cert.CertificateFactory;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXParameters;
import java.security.cert.PKIXRevocationChecker;
import java.security.cert.X509CRL;
import java.security.cert.X509CRLEntry;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kroxylicious.spiffe.bundle.TrustDomainStore;
import io.kroxylicious.spiffe.bundle.TrustSnapshot;
import io.kroxylicious.spiffe.cert.CertificateUtil;
import io.kroxylicious.spiffe.cert.SubjectAltName;
import io.kroxylicious.spiffe.cert.TrustDomains;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Verifies a peer certificate chain against the trust domain its leaf claims.
 * <ol>
 *     <li>the leaf must be an end entity: not a CA, unable to sign certificates or CRLs,</li>
 *     <li>the trust domain of the leaf's URI SAN selects the store; an unknown domain is rejected,</li>
 *     <li>the chain must pass PKIX validation against that store alone,</li>
 *     <li>if SAN matchers are configured, one of the leaf's SANs must satisfy one of them.</li>
 * </ol>
 * Stateless apart from its configuration, so one instance serves every worker.
 */
public class ChainVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChainVerifier.class);

    static final String VERIFY_CERT_FAILED = "verify cert failed: ";
    public static final String EMPTY_CERT_CHAIN = VERIFY_CERT_FAILED + "empty cert chain";
    public static final String CERT_PRECHECK = VERIFY_CERT_FAILED + "cert precheck";
    public static final String NO_TRUST_BUNDLE_STORE = VERIFY_CERT_FAILED + "no trust bundle store";
    public static final String SAN_MATCH = VERIFY_CERT_FAILED + "SAN match";

    private static final String PKIX = "PKIX";

    private final List<SanMatcher> sanMatchers;
    private final boolean allowExpiredCertificate;
    private final Clock clock;
    private final VerificationMetrics metrics;

    public ChainVerifier(@NonNull List<SanMatcher> sanMatchers,
                         boolean allowExpiredCertificate,
                         @NonNull Clock clock,
                         @NonNull VerificationMetrics metrics) {
        this.sanMatchers = List.copyOf(sanMatchers);
        this.allowExpiredCertificate = allowExpiredCertificate;
        this.clock = Objects.requireNonNull(clock);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Verifies the chain.
     *
     * @param chain peer certificates, leaf first
     * @param snapshot trust material to verify against
     * @param parameters caller policy for path validation
     * @return the outcome
     */
    @NonNull
    public ValidationResult verify(@NonNull List<X509Certificate> chain,
                                   @NonNull TrustSnapshot snapshot,
                                   @NonNull VerificationParameters parameters) {
        if (chain.isEmpty()) {
            return verifyError(EMPTY_CERT_CHAIN);
        }
        X509Certificate leaf = chain.get(0);
        if (!CertificateUtil.isEndEntity(leaf)) {
            return verifyError(CERT_PRECHECK);
        }

        var store = trustBundleStore(leaf, snapshot);
        if (store.isEmpty()) {
            return verifyError(NO_TRUST_BUNDLE_STORE);
        }

        var pathError = validatePath(chain, store.get(), parameters);
        if (pathError.isPresent()) {
            return verifyError(VERIFY_CERT_FAILED + pathError.get());
        }

        if (!sanMatchers.isEmpty() && !matchSubjectAltName(leaf)) {
            metrics.sanMismatch();
            return ValidationResult.failed(SAN_MATCH);
        }
        return ValidationResult.successful();
    }

    /**
     * Selects the store of the trust domain claimed by the leaf's URI SAN.
     *
     * @param leaf leaf certificate
     * @param snapshot trust material
     * @return the store, or empty if the leaf names no trust domain or an unknown one
     */
    @NonNull
    public static Optional<TrustDomainStore> trustBundleStore(@NonNull X509Certificate leaf, @NonNull TrustSnapshot snapshot) {
        return TrustDomains.claimedTrustDomain(leaf).flatMap(snapshot::store);
    }

    boolean matchSubjectAltName(X509Certificate leaf) {
        for (SubjectAltName san : SubjectAltName.of(leaf)) {
            for (SanMatcher matcher : sanMatchers) {
                if (matcher.match(san)) {
                    return true;
                }
            }
        }
        return false;
    }

    private ValidationResult verifyError(String details) {
        metrics.verifyError();
        return ValidationResult.failed(details);
    }

    private Optional<String> validatePath(List<X509Certificate> chain, TrustDomainStore store, VerificationParameters parameters) {
        if (store.trustAnchors().isEmpty()) {
            return Optional.of("no trust anchors for trust domain '" + store.trustDomain() + "'");
        }
        List<X509Certificate> path = withoutTrailingAnchors(chain, store);
        Instant validationTime = parameters.validationTime() != null ? parameters.validationTime() : clock.instant();
        try {
            CertPath certPath = CertificateFactory.getInstance("X.509").generateCertPath(path);
            try {
                validate(certPath, store, parameters, validationTime, store.isCrlCheckEnabled());
            }
            catch (CertPathValidatorException e) {
                Instant shifted = allowExpiredCertificate && isValidityFailure(e) ? timeWithinValidity(path, validationTime) : validationTime;
                if (shifted.equals(validationTime)) {
                    throw e;
                }
                LOGGER.debug("Retrying path validation for trust domain '{}' at {} to tolerate certificate validity", store.trustDomain(), shifted);
                // revocation is still judged at the real time
                validate(certPath, store, parameters, shifted, false);
                if (store.isCrlCheckEnabled()) {
                    checkRevocation(certPath, path, store, validationTime);
                }
            }
            return Optional.empty();
        }
        catch (CertPathValidatorException e) {
            LOGGER.debug("Path validation failed for trust domain '{}'", store.trustDomain(), e);
            return Optional.of("certificate verification error at depth " + Math.max(e.getIndex(), 0) + ": " + e.getMessage());
        }
        catch (GeneralSecurityException | IOException e) {
            LOGGER.warn("Unable to set up path validation for trust domain '{}'", store.trustDomain(), e);
            return Optional.of("init and setup certificate path validation: " + e.getMessage());
        }
    }

    private static void validate(CertPath certPath,
                                 TrustDomainStore store,
                                 VerificationParameters parameters,
                                 Instant validationTime,
                                 boolean checkRevocation)
            throws GeneralSecurityException, IOException {
        CertPathValidator validator = CertPathValidator.getInstance(PKIX);
        PKIXParameters pkixParameters = new PKIXParameters(store.trustAnchors());
        pkixParameters.setDate(Date.from(validationTime));

        var purpose = parameters.purpose().oid();
        if (purpose.isPresent()) {
            X509CertSelector targetConstraints = new X509CertSelector();
            targetConstraints.setExtendedKeyUsage(Set.of(purpose.get()));
            pkixParameters.setTargetCertConstraints(targetConstraints);
        }

        if (checkRevocation) {
            pkixParameters.addCertStore(CertStore.getInstance("Collection", new CollectionCertStoreParameters(store.crls())));
            // CRLs only, for every certificate of the path: OCSP is never consulted
            var revocationChecker = (PKIXRevocationChecker) validator.getRevocationChecker();
            revocationChecker.setOptions(EnumSet.of(PKIXRevocationChecker.Option.PREFER_CRLS, PKIXRevocationChecker.Option.NO_FALLBACK));
            pkixParameters.addCertPathChecker(revocationChecker);
        }
        else {
            pkixParameters.setRevocationEnabled(false);
        }

        validator.validate(certPath, pkixParameters);
    }

    private static boolean isValidityFailure(CertPathValidatorException e) {
        return e.getReason() == CertPathValidatorException.BasicReason.EXPIRED
                || e.getReason() == CertPathValidatorException.BasicReason.NOT_YET_VALID;
    }

    /**
     * Checks every certificate of an already validated path against the store's CRLs at the given time.
     * Each certificate needs a current CRL signed by its issuer, as the PKIX revocation checker requires.
     */
    private static void checkRevocation(CertPath certPath, List<X509Certificate> path, TrustDomainStore store, Instant time) throws CertPathValidatorException {
        Date date = Date.from(time);
        for (int index = 0; index < path.size(); index++) {
            X509Certificate certificate = path.get(index);
            boolean determined = false;
            for (X509CRL crl : store.crls()) {
                if (!crl.getIssuerX500Principal().equals(certificate.getIssuerX500Principal())
                        || !isCurrent(crl, date)
                        || !isSignedByIssuer(crl, issuerCandidates(path, index, store))) {
                    continue;
                }
                determined = true;
                X509CRLEntry entry = crl.getRevokedCertificate(certificate);
                if (entry != null && !entry.getRevocationDate().after(date)) {
                    throw new CertPathValidatorException("Certificate has been revoked, reason: "
                            + (entry.getRevocationReason() != null ? entry.getRevocationReason() : CRLReason.UNSPECIFIED)
                            + ", revocation date: " + entry.getRevocationDate()
                            + ", authority: " + crl.getIssuerX500Principal(),
                            null, certPath, index, CertPathValidatorException.BasicReason.REVOKED);
                }
            }
            if (!determined) {
                throw new CertPathValidatorException("Could not determine revocation status", null, certPath, index,
                        CertPathValidatorException.BasicReason.UNDETERMINED_REVOCATION_STATUS);
            }
        }
    }

    private static boolean isCurrent(X509CRL crl, Date date) {
        return !crl.getThisUpdate().after(date) && (crl.getNextUpdate() == null || !crl.getNextUpdate().before(date));
    }

    private static List<X509Certificate> issuerCandidates(List<X509Certificate> path, int index, TrustDomainStore store) {
        if (index + 1 < path.size()) {
            return List.of(path.get(index + 1));
        }
        return store.certificates();
    }

    private static boolean isSignedByIssuer(X509CRL crl, List<X509Certificate> candidates) {
        for (X509Certificate candidate : candidates) {
            if (!candidate.getSubjectX500Principal().equals(crl.getIssuerX500Principal())) {
                continue;
            }
            try {
                crl.verify(candidate.getPublicKey());
                return true;
            }
            catch (GeneralSecurityException e) {
                LOGGER.debug("CRL from '{}' is not signed by candidate issuer {}", crl.getIssuerX500Principal(), candidate.getSerialNumber(), e);
            }
        }
        return false;
    }

    private static List<X509Certificate> withoutTrailingAnchors(List<X509Certificate> chain, TrustDomainStore store) {
        int end = chain.size();
        while (end > 1 && store.isTrustAnchor(chain.get(end - 1))) {
            end--;
        }
        return chain.subList(0, end);
    }

    /**
     * Moves the validation time into the window in which every certificate of the path is valid.
     * If the validity periods do not overlap there is no such window and the time is unchanged.
     */
    static Instant timeWithinValidity(List<X509Certificate> path, Instant time) {
        Instant latestStart = Instant.MIN;
        Instant earliestEnd = Instant.MAX;
        for (X509Certificate certificate : path) {
            Instant notBefore = certificate.getNotBefore().toInstant();
            Instant notAfter = certificate.getNotAfter().toInstant();
            if (notBefore.isAfter(latestStart)) {
                latestStart = notBefore;
            }
            if (notAfter.isBefore(earliestEnd)) {
                earliestEnd = notAfter;
            }
        }
        if (latestStart.isAfter(earliestEnd)) {
            return time;
        }
        if (time.isBefore(latestStart)) {
            return latestStart;
        }
        if (time.isAfter(earliestEnd)) {
            return earliestEnd;
        }
        return time;
    }
}
