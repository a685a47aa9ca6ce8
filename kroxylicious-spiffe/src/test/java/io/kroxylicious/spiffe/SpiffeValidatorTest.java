/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutor;

import io.kroxylicious.spiffe.SpiffeCertificateGenerator.Issued;
import io.kroxylicious.spiffe.bundle.TrustSnapshot;
import io.kroxylicious.spiffe.cert.CertificateUtil;
import io.kroxylicious.spiffe.config.DataSource;
import io.kroxylicious.spiffe.config.IllegalConfigurationException;
import io.kroxylicious.spiffe.config.SanMatcherDefinition;
import io.kroxylicious.spiffe.config.SpiffeValidatorConfig;
import io.kroxylicious.spiffe.config.StringMatcherDefinition;
import io.kroxylicious.spiffe.config.TrustBundleMapConfig;
import io.kroxylicious.spiffe.config.TrustDomainConfig;
import io.kroxylicious.spiffe.verify.ValidationResult;
import io.kroxylicious.spiffe.verify.VerificationParameters;

import static io.kroxylicious.spiffe.SpiffeCertificateGenerator.certificate;
import static io.kroxylicious.spiffe.SpiffeCertificateGenerator.toPem;
import static io.kroxylicious.spiffe.SpiffeCertificateGenerator.toX5c;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SpiffeValidatorTest {

    private static final Duration RELOAD_TIMEOUT = Duration.ofSeconds(30);

    private static Issued exampleCa;
    private static Issued otherCa;
    private static Issued exampleLeaf;
    private static Issued otherLeaf;

    @TempDir
    Path tempDir;

    private DefaultEventExecutor control;
    private DefaultEventExecutorGroup workers;
    private SimpleMeterRegistry registry;
    private SpiffeValidator validator;

    @BeforeAll
    static void setUpCertificates() {
        exampleCa = SpiffeCertificateGenerator.rootCa("example.org");
        otherCa = SpiffeCertificateGenerator.rootCa("other.org");
        exampleLeaf = SpiffeCertificateGenerator.leaf(exampleCa, "spiffe://example.org/workload");
        otherLeaf = SpiffeCertificateGenerator.leaf(otherCa, "spiffe://other.org/workload");
    }

    @BeforeEach
    void setUp() {
        control = new DefaultEventExecutor();
        workers = new DefaultEventExecutorGroup(2);
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (validator != null) {
            validator.close();
        }
        workers.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        control.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private SpiffeValidator create(SpiffeValidatorConfig config) {
        return create(config, Clock.systemUTC());
    }

    private SpiffeValidator create(SpiffeValidatorConfig config, Clock clock) {
        validator = new SpiffeValidator(config, new SpiffeValidatorContext(control, workers, registry, clock));
        return validator;
    }

    private static SpiffeValidatorConfig staticConfig(TrustDomainConfig... domains) {
        return SpiffeValidatorConfig.forTrustDomains(List.of(domains));
    }

    private static TrustDomainConfig inline(String name, Object... pemObjects) {
        return new TrustDomainConfig(name, DataSource.ofInlineString(toPem(pemObjects)));
    }

    private static String bundleMap(String domain, X509Certificate... certificates) {
        var x5c = Arrays.stream(certificates).map(c -> "\"" + toX5c(c) + "\"").toList();
        return "\"" + domain + "\": {\"keys\": [{\"use\": \"x509-svid\", \"x5c\": [" + String.join(", ", x5c) + "]}]}";
    }

    private Path writeBundleMap(String... domains) throws Exception {
        Path file = tempDir.resolve("bundles.json");
        Path staged = tempDir.resolve("bundles.json.tmp");
        Files.writeString(staged, "{\"trust_domains\": {" + String.join(", ", domains) + "}}");
        Files.move(staged, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return file;
    }

    private double reloads() {
        return registry.get(SpiffeValidator.BUNDLE_RELOADS_METER_NAME).counter().count();
    }

    private double reloadFailures() {
        return registry.get(SpiffeValidator.BUNDLE_RELOAD_FAILURES_METER_NAME).counter().count();
    }

    private <T> T onWorker(Callable<T> task) throws Exception {
        EventExecutor worker = workers.next();
        return worker.submit(task).get(5, TimeUnit.SECONDS);
    }

    private ValidationResult verifyOnWorker(Issued leaf) throws Exception {
        return onWorker(() -> validator.doVerifyCertChain(List.of(leaf.certificate()), VerificationParameters.defaults()));
    }

    @Nested
    class Construction {

        @Test
        void rejectsBothSources() {
            var config = new SpiffeValidatorConfig(new TrustBundleMapConfig("bundles.json"),
                    List.of(inline("example.org", exampleCa.certificate())), false, List.of());

            assertThatThrownBy(() -> create(config))
                    .isInstanceOf(IllegalConfigurationException.class)
                    .hasMessage("Cannot configure both trustDomains and trustBundleMap");
        }

        @Test
        void rejectsNoSource() {
            var config = staticConfig();

            assertThatThrownBy(() -> create(config)).isInstanceOf(IllegalConfigurationException.class);
        }

        @Test
        void rejectsUnloadableBundleMap() {
            var config = SpiffeValidatorConfig.forTrustBundleMap(tempDir.resolve("absent.json").toString());

            assertThatThrownBy(() -> create(config))
                    .isInstanceOf(IllegalConfigurationException.class)
                    .hasMessageStartingWith("Failed to load SPIFFE bundle map: Failed to open SPIFFE bundle map file");
        }

        @Test
        void rejectsDuplicateStaticDomain() {
            var config = staticConfig(inline("example.org", exampleCa.certificate()), inline("example.org", exampleCa.certificate()));

            assertThatThrownBy(() -> create(config))
                    .isInstanceOf(IllegalConfigurationException.class)
                    .hasMessage("Multiple trust bundles are given for one trust domain for example.org");
        }

        @Test
        void trustMaterialInstalledBeforeConstructorReturns() throws Exception {
            create(staticConfig(inline("example.org", exampleCa.certificate())));

            for (EventExecutor worker : workers) {
                assertThat(worker.submit(() -> validator.currentSnapshot()).get(5, TimeUnit.SECONDS).trustDomains())
                        .containsExactly("example.org");
            }
        }
    }

    @Nested
    class StaticTrustDomains {

        @Test
        void acceptsLeafOfConfiguredDomain() throws Exception {
            create(staticConfig(inline("example.org", exampleCa.certificate())));

            assertThat(verifyOnWorker(exampleLeaf).isSuccessful()).isTrue();
        }

        @Test
        void rejectsLeafOfUnconfiguredDomain() throws Exception {
            create(staticConfig(inline("example.org", exampleCa.certificate())));
            var stranger = SpiffeCertificateGenerator.leaf(exampleCa, "spiffe://other.org/workload");

            var result = verifyOnWorker(stranger);

            assertThat(result.isSuccessful()).isFalse();
            assertThat(result.errorDetails()).isEqualTo("verify cert failed: no trust bundle store");
            assertThat(registry.get("kroxylicious_spiffe_verify_errors").counter().count()).isEqualTo(1.0);
        }

        @Test
        void rejectsRevokedLeaf() throws Exception {
            var revoked = SpiffeCertificateGenerator.leaf(exampleCa, "spiffe://example.org/revoked");
            create(staticConfig(inline("example.org", exampleCa.certificate(), SpiffeCertificateGenerator.crl(exampleCa, revoked.certificate()))));

            assertThat(verifyOnWorker(revoked).isSuccessful()).isFalse();
            assertThat(verifyOnWorker(exampleLeaf).isSuccessful()).isTrue();
        }

        @Test
        void acceptsExpiredLeafOnlyWhenAllowed() throws Exception {
            var expired = certificate("CN=expired").spiffeId("spiffe://example.org/old")
                    .validity(Instant.now().minus(Duration.ofDays(10)), Instant.now().minus(Duration.ofDays(1)))
                    .issuedBy(exampleCa).build();
            var config = staticConfig(inline("example.org", exampleCa.certificate()));

            create(config);
            assertThat(verifyOnWorker(expired).isSuccessful()).isFalse();
            validator.close();

            create(config.withAllowExpiredCertificate(true));
            assertThat(verifyOnWorker(expired).isSuccessful()).isTrue();
        }

        @Test
        void appliesSubjectAltNameMatchers() throws Exception {
            var allowed = SpiffeCertificateGenerator.leaf(exampleCa, "spiffe://example.org/ns/payments/api");
            create(staticConfig(inline("example.org", exampleCa.certificate()))
                    .withSubjectAltNameMatchers(List.of(SanMatcherDefinition.uri(StringMatcherDefinition.prefix("spiffe://example.org/ns/payments/")))));

            assertThat(verifyOnWorker(allowed).isSuccessful()).isTrue();
            assertThat(verifyOnWorker(exampleLeaf).errorDetails()).isEqualTo("verify cert failed: SAN match");
            assertThat(registry.get("kroxylicious_spiffe_verify_san_mismatches").counter().count()).isEqualTo(1.0);
        }

        @Test
        void describesFirstCa() {
            create(staticConfig(inline("example.org", exampleCa.certificate()), inline("other.org", otherCa.certificate())));

            assertThat(validator.getCaFileName()).isEqualTo("example.org: <inline>");
            assertThat(validator.getCaCertInformation()).hasValueSatisfying(details -> {
                assertThat(details.path()).isEqualTo("example.org: <inline>");
                assertThat(details.serialNumber()).isEqualTo(exampleCa.certificate().getSerialNumber().toString(16));
                assertThat(details.subjectAltNames()).containsExactly("spiffe://example.org");
            });
        }

        @Test
        void acceptedIssuersAreUniqueBySubject() {
            var sameSubject = SpiffeCertificateGenerator.rootCa("example.org");
            create(staticConfig(inline("example.org", exampleCa.certificate(), sameSubject.certificate()), inline("other.org", otherCa.certificate())));

            assertThat(validator.getAcceptedIssuers()).containsExactly(exampleCa.certificate(), otherCa.certificate());
        }

        @Test
        void digestCoversEveryCaInOrder() throws Exception {
            create(staticConfig(inline("example.org", exampleCa.certificate()), inline("other.org", otherCa.certificate())));
            var expected = MessageDigest.getInstance("SHA-256");
            expected.update(CertificateUtil.sha256Fingerprint(exampleCa.certificate()));
            expected.update(CertificateUtil.sha256Fingerprint(otherCa.certificate()));

            var actual = MessageDigest.getInstance("SHA-256");
            validator.updateDigestForSessionId(actual);

            assertThat(actual.digest()).isEqualTo(expected.digest());
        }
    }

    @Nested
    class Expiration {

        private final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        private final Clock clock = Clock.fixed(now, ZoneOffset.UTC);

        private Issued caExpiringIn(int days) {
            return certificate("CN=CA expiring in " + days).spiffeId("spiffe://example.org").ca()
                    .validity(now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(days)))
                    .build();
        }

        @Test
        void reportsEarliestExpiry() {
            create(staticConfig(inline("example.org",
                    caExpiringIn(10).certificate(), caExpiringIn(5).certificate(), caExpiringIn(30).certificate())), clock);

            assertThat(validator.daysUntilFirstCertExpires()).hasValue(5);
        }

        @Test
        void unknownWhenACaHasExpired() {
            var expired = certificate("CN=expired CA").ca().validity(now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(1))).build();
            create(staticConfig(inline("example.org", caExpiringIn(10).certificate(), expired.certificate())), clock);

            assertThat(validator.daysUntilFirstCertExpires()).isEmpty();
        }

        @Test
        void effectivelyInfiniteWithoutCaCertificates() throws Exception {
            var unidentified = certificate("CN=no spiffe id").ca().build();
            Path file = writeBundleMap(bundleMap("example.org", unidentified.certificate()));
            create(SpiffeValidatorConfig.forTrustBundleMap(file.toString()), clock);

            assertThat(validator.daysUntilFirstCertExpires()).hasValue(Integer.MAX_VALUE);
            assertThat(validator.getCaCertInformation()).isEmpty();
            assertThat(validator.getAcceptedIssuers()).isEmpty();
        }
    }

    @Nested
    class BundleMap {

        @Test
        void selectsStoreByClaimedDomain() throws Exception {
            Path file = writeBundleMap(bundleMap("example.org", exampleCa.certificate()));
            create(SpiffeValidatorConfig.forTrustBundleMap(file.toString()));

            assertThat(validator.getTrustBundleStore(exampleLeaf.certificate()))
                    .hasValueSatisfying(store -> assertThat(store.trustDomain()).isEqualTo("example.org"));
            assertThat(validator.getTrustBundleStore(otherLeaf.certificate())).isEmpty();
            assertThat(validator.getCaFileName()).isEqualTo(file.toAbsolutePath().toString());
        }

        @Test
        void reloadReachesEveryWorker() throws Exception {
            Path file = writeBundleMap(bundleMap("example.org", exampleCa.certificate()));
            create(SpiffeValidatorConfig.forTrustBundleMap(file.toString()));
            assertThat(verifyOnWorker(otherLeaf).isSuccessful()).isFalse();

            writeBundleMap(bundleMap("example.org", exampleCa.certificate()), bundleMap("other.org", otherCa.certificate()));

            await().atMost(RELOAD_TIMEOUT).untilAsserted(() -> {
                for (EventExecutor worker : workers) {
                    assertThat(worker.submit(() -> validator.currentSnapshot().trustDomains()).get(5, TimeUnit.SECONDS))
                            .containsExactly("example.org", "other.org");
                }
            });
            assertThat(verifyOnWorker(otherLeaf).isSuccessful()).isTrue();
            assertThat(verifyOnWorker(exampleLeaf).isSuccessful()).isTrue();
        }

        @Test
        void failedReloadKeepsPreviousTrustMaterial() throws Exception {
            Path file = writeBundleMap(bundleMap("example.org", exampleCa.certificate()));
            create(SpiffeValidatorConfig.forTrustBundleMap(file.toString()));
            TrustSnapshot initial = onWorker(() -> validator.currentSnapshot());

            // other.org's CA filed under a.org violates the bundle map's cross reference rule
            writeBundleMap(bundleMap("example.org", exampleCa.certificate()), bundleMap("a.org", otherCa.certificate()));

            await().atMost(RELOAD_TIMEOUT).until(() -> reloadFailures() >= 1.0);
            assertThat(reloads()).isZero();
            for (EventExecutor worker : workers) {
                assertThat(worker.submit(() -> validator.currentSnapshot()).get(5, TimeUnit.SECONDS)).isSameAs(initial);
            }
            assertThat(verifyOnWorker(exampleLeaf).isSuccessful()).isTrue();
            assertThat(verifyOnWorker(otherLeaf).isSuccessful()).isFalse();

            writeBundleMap(bundleMap("example.org", exampleCa.certificate()), bundleMap("other.org", otherCa.certificate()));

            await().atMost(RELOAD_TIMEOUT).until(() -> onWorker(() -> validator.currentSnapshot().trustDomains()).equals(Set.of("example.org", "other.org")));
            assertThat(verifyOnWorker(otherLeaf).isSuccessful()).isTrue();
        }

        @Test
        void reloadOfUnchangedFileKeepsOutcomes() throws Exception {
            String content = bundleMap("example.org", exampleCa.certificate());
            Path file = writeBundleMap(content);
            create(SpiffeValidatorConfig.forTrustBundleMap(file.toString()));
            TrustSnapshot initial = onWorker(() -> validator.currentSnapshot());

            writeBundleMap(content);

            await().atMost(RELOAD_TIMEOUT).until(() -> onWorker(() -> validator.currentSnapshot()) != initial);
            TrustSnapshot reloaded = onWorker(() -> validator.currentSnapshot());
            assertThat(reloaded.trustDomains()).isEqualTo(initial.trustDomains());
            assertThat(reloaded.caCertificates()).isEqualTo(initial.caCertificates());
            assertThat(verifyOnWorker(exampleLeaf).isSuccessful()).isTrue();
            assertThat(verifyOnWorker(otherLeaf).isSuccessful()).isFalse();
        }

        @Test
        void closeIsIdempotent() throws Exception {
            Path file = writeBundleMap(bundleMap("example.org", exampleCa.certificate()));
            create(SpiffeValidatorConfig.forTrustBundleMap(file.toString()));

            validator.close();
            validator.close();

            assertThat(validator.currentSnapshot().trustDomains()).isEqualTo(Set.of("example.org"));
        }
    }
}
