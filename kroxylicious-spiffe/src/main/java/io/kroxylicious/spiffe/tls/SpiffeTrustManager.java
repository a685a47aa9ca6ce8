/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.tls;

import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;

import io.kroxylicious.spiffe.SpiffeValidator;
import io.kroxylicious.spiffe.verify.VerificationParameters;
import io.kroxylicious.spiffe.verify.VerificationParameters.Purpose;

/**
 * A TrustManager that delegates every trust decision to a {@link SpiffeValidator}.
 * <br/>
 * Client chains must permit client authentication and server chains server authentication.
 * The socket or engine of the handshake plays no part in the decision: SPIFFE identities are
 * checked by trust domain and SAN matchers, not by host name.
 */
public class SpiffeTrustManager extends X509ExtendedTrustManager {

    private static final VerificationParameters CLIENT = VerificationParameters.forPurpose(Purpose.CLIENT_AUTH);
    private static final VerificationParameters SERVER = VerificationParameters.forPurpose(Purpose.SERVER_AUTH);

    private final SpiffeValidator validator;

    public SpiffeTrustManager(SpiffeValidator validator) {
        this.validator = Objects.requireNonNull(validator);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        check(chain, CLIENT);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
        check(chain, CLIENT);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
        check(chain, CLIENT);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        check(chain, SERVER);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
        check(chain, SERVER);
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
        check(chain, SERVER);
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return validator.getAcceptedIssuers();
    }

    private void check(X509Certificate[] chain, VerificationParameters parameters) throws CertificateException {
        var result = validator.doVerifyCertChain(certificates(chain), parameters);
        if (!result.isSuccessful()) {
            throw new CertificateException(result.errorDetails());
        }
    }

    // a missing chain, or one with holes, is verified as an empty chain
    private static List<X509Certificate> certificates(X509Certificate[] chain) {
        if (chain == null || Arrays.asList(chain).contains(null)) {
            return List.of();
        }
        return List.of(chain);
    }
}
