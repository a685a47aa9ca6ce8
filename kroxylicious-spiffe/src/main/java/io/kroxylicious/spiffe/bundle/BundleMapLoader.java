/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Base64;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.kroxylicious.spiffe.cert.CertificateUtil;
import io.kroxylicious.spiffe.cert.TrustDomains;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Loads a SPIFFE bundle map file:
 * <pre>
 * {"trust_domains": {"example.org": {"keys": [{"use": "x509-svid", "x5c": ["&lt;base64 DER&gt;"]}]}}}
 * </pre>
 * Loading is all or nothing: the first malformed or inconsistent record fails the whole load.
 * A domain that appears more than once accumulates the certificates of every occurrence.
 */
public class BundleMapLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(BundleMapLoader.class);

    static final String TRUST_DOMAINS = "trust_domains";
    static final String KEYS = "keys";
    static final String USE = "use";
    static final String X5C = "x5c";
    static final String X509_SVID = "x509-svid";
    static final String REFRESH_HINT = "spiffe_refresh_hint";
    static final String SEQUENCE = "spiffe_sequence";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path bundleMapPath;

    public BundleMapLoader(@NonNull Path bundleMapPath) {
        this.bundleMapPath = bundleMapPath.toAbsolutePath();
    }

    @NonNull
    public Path bundleMapPath() {
        return bundleMapPath;
    }

    /**
     * Reads and parses the bundle map.
     *
     * @return the loaded snapshot, or the reason the load failed
     */
    @NonNull
    public BundleLoadResult load() {
        byte[] content;
        try {
            content = readBundleMap();
        }
        catch (IOException e) {
            LOGGER.error("Failed to open SPIFFE bundle map file '{}'", bundleMapPath, e);
            return BundleLoadResult.failed("Failed to open SPIFFE bundle map file '" + bundleMapPath + "': " + e.getMessage());
        }

        try {
            var snapshot = parse(content);
            LOGGER.info("Successfully loaded SPIFFE bundle map from file '{}'", bundleMapPath);
            return BundleLoadResult.loaded(snapshot);
        }
        catch (JsonProcessingException e) {
            LOGGER.error("Failed to parse SPIFFE bundle map JSON in file '{}'", bundleMapPath, e);
            return BundleLoadResult.failed("Failed to parse SPIFFE bundle map JSON in file '" + bundleMapPath + "': " + e.getOriginalMessage());
        }
        catch (IOException e) {
            LOGGER.error("Failed to read SPIFFE bundle map file '{}'", bundleMapPath, e);
            return BundleLoadResult.failed("Failed to read SPIFFE bundle map file '" + bundleMapPath + "': " + e.getMessage());
        }
        catch (TrustBundleException e) {
            LOGGER.error("Failed to load SPIFFE bundle map '{}': {}", bundleMapPath, e.getMessage());
            return BundleLoadResult.failed(e.getMessage());
        }
    }

    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "The bundle map path is provided by the administrator via the validator configuration.")
    private byte[] readBundleMap() throws IOException {
        return Files.readAllBytes(bundleMapPath);
    }

    private TrustSnapshot parse(byte[] content) throws IOException, TrustBundleException {
        var builder = TrustSnapshot.builder();
        int domainsSeen = 0;
        try (JsonParser parser = MAPPER.createParser(content)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new TrustBundleException("SPIFFE bundle map '" + bundleMapPath + "' is not a JSON object");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                switch (field) {
                    case TRUST_DOMAINS -> domainsSeen += loadTrustDomains(parser, value, builder);
                    case REFRESH_HINT -> builder.refreshHint(Duration.ofSeconds(readLong(parser, value, REFRESH_HINT)));
                    case SEQUENCE -> builder.sequence(readLong(parser, value, SEQUENCE));
                    default -> parser.skipChildren();
                }
            }
        }
        if (domainsSeen == 0) {
            throw new TrustBundleException("No trust domains found in SPIFFE bundle map '" + bundleMapPath + "'");
        }
        return builder.build();
    }

    private long readLong(JsonParser parser, JsonToken token, String field) throws IOException, TrustBundleException {
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw new TrustBundleException("'" + field + "' in SPIFFE bundle map '" + bundleMapPath + "' is not an integer");
        }
        return parser.getLongValue();
    }

    private int loadTrustDomains(JsonParser parser, JsonToken token, TrustSnapshot.Builder builder) throws IOException, TrustBundleException {
        if (token != JsonToken.START_OBJECT) {
            throw new TrustBundleException("'" + TRUST_DOMAINS + "' in SPIFFE bundle map '" + bundleMapPath + "' is not an object");
        }
        int count = 0;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String domainName = parser.currentName();
            parser.nextToken();
            JsonNode domain = parser.readValueAsTree();
            loadTrustDomain(domainName, domain, builder);
            count++;
        }
        return count;
    }

    private void loadTrustDomain(String domainName, JsonNode domain, TrustSnapshot.Builder builder) throws TrustBundleException {
        if (!builder.registerTrustDomain(domainName)) {
            LOGGER.warn("Duplicate domain '{}' in SPIFFE bundle map '{}'", domainName, bundleMapPath);
        }
        LOGGER.info("Loading domain '{}' from SPIFFE bundle map '{}'", domainName, bundleMapPath);

        JsonNode keys = domain == null ? null : domain.get(KEYS);
        if (keys == null || !keys.isArray() || keys.isEmpty()) {
            throw new TrustBundleException("No keys found in SPIFFE bundle for domain '" + domainName + "'");
        }
        LOGGER.info("Found '{}' keys for domain '{}'", keys.size(), domainName);

        for (JsonNode key : keys) {
            JsonNode use = key.get(USE);
            if (use == null || !X509_SVID.equals(use.asText())) {
                continue;
            }
            JsonNode x5c = key.get(X5C);
            if (x5c == null || !x5c.isArray()) {
                throw new TrustBundleException("x509-svid key without an x5c array for domain '" + domainName + "'");
            }
            for (JsonNode encoded : x5c) {
                if (!encoded.isTextual()) {
                    throw new TrustBundleException("Non string x5c entry for domain '" + domainName + "'");
                }
                loadCertificate(domainName, encoded.asText(), builder);
            }
        }
    }

    private void loadCertificate(String domainName, String encoded, TrustSnapshot.Builder builder) throws TrustBundleException {
        byte[] der;
        try {
            der = Base64.getDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            throw new TrustBundleException("Failed to decode cert in '" + bundleMapPath + "' for domain '" + domainName + "'", e);
        }
        if (der.length == 0) {
            throw new TrustBundleException("Empty cert decoded in '" + bundleMapPath + "' for domain '" + domainName + "'");
        }

        X509Certificate certificate;
        try {
            certificate = CertificateUtil.parseDerCertificate(der);
        }
        catch (IOException e) {
            throw new TrustBundleException("Failed to create x509 object while loading '" + bundleMapPath + "' for domain '" + domainName + "'", e);
        }

        var embeddedDomain = TrustDomains.embeddedTrustDomain(certificate);
        if (embeddedDomain.isEmpty()) {
            LOGGER.debug("Skipping certificate {} for domain '{}': no SPIFFE ID in its subject alternative names",
                    certificate.getSubjectX500Principal(), domainName);
            return;
        }
        // addCertificate rejects a certificate whose SPIFFE ID belongs to another domain
        builder.addCertificate(domainName, certificate);
    }
}
