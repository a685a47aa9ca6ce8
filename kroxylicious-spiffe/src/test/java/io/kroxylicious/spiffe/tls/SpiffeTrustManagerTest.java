/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.tls;

import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.List;

import javax.net.ssl.SSLEngine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.kroxylicious.spiffe.SpiffeValidator;
import io.kroxylicious.spiffe.verify.ValidationResult;
import io.kroxylicious.spiffe.verify.VerificationParameters;
import io.kroxylicious.spiffe.verify.VerificationParameters.Purpose;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpiffeTrustManagerTest {

    private static final String FAILURE = "verify cert failed: no trust bundle store";

    @Mock
    private SpiffeValidator validator;

    @Mock
    private X509Certificate leaf;

    private SpiffeTrustManager trustManager;

    @BeforeEach
    void setUp() {
        trustManager = new SpiffeTrustManager(validator);
    }

    @Test
    void clientChainVerifiedForClientAuth() throws Exception {
        when(validator.doVerifyCertChain(List.of(leaf), VerificationParameters.forPurpose(Purpose.CLIENT_AUTH))).thenReturn(ValidationResult.successful());

        assertThatCode(() -> trustManager.checkClientTrusted(new X509Certificate[]{ leaf }, "RSA")).doesNotThrowAnyException();
        assertThatCode(() -> trustManager.checkClientTrusted(new X509Certificate[]{ leaf }, "RSA", mock(Socket.class))).doesNotThrowAnyException();
        assertThatCode(() -> trustManager.checkClientTrusted(new X509Certificate[]{ leaf }, "RSA", mock(SSLEngine.class))).doesNotThrowAnyException();
    }

    @Test
    void serverChainVerifiedForServerAuth() throws Exception {
        when(validator.doVerifyCertChain(List.of(leaf), VerificationParameters.forPurpose(Purpose.SERVER_AUTH))).thenReturn(ValidationResult.successful());

        trustManager.checkServerTrusted(new X509Certificate[]{ leaf }, "RSA");
        trustManager.checkServerTrusted(new X509Certificate[]{ leaf }, "RSA", mock(Socket.class));
        trustManager.checkServerTrusted(new X509Certificate[]{ leaf }, "RSA", mock(SSLEngine.class));

        verify(validator, times(3)).doVerifyCertChain(List.of(leaf), VerificationParameters.forPurpose(Purpose.SERVER_AUTH));
    }

    @Test
    void failureBecomesCertificateException() {
        when(validator.doVerifyCertChain(any(), any())).thenReturn(ValidationResult.failed(FAILURE));

        assertThatThrownBy(() -> trustManager.checkClientTrusted(new X509Certificate[]{ leaf }, "RSA"))
                .isInstanceOf(CertificateException.class)
                .hasMessage(FAILURE);
        assertThatThrownBy(() -> trustManager.checkServerTrusted(new X509Certificate[]{ leaf }, "RSA", mock(SSLEngine.class)))
                .isInstanceOf(CertificateException.class)
                .hasMessage(FAILURE);
    }

    @Test
    void missingChainIsVerifiedAsEmpty() {
        when(validator.doVerifyCertChain(List.of(), VerificationParameters.forPurpose(Purpose.CLIENT_AUTH)))
                .thenReturn(ValidationResult.failed("verify cert failed: empty cert chain"));

        assertThatThrownBy(() -> trustManager.checkClientTrusted(null, "RSA"))
                .isInstanceOf(CertificateException.class)
                .hasMessage("verify cert failed: empty cert chain");
    }

    @Test
    void chainWithNullEntryIsVerifiedAsEmpty() {
        when(validator.doVerifyCertChain(List.of(), VerificationParameters.forPurpose(Purpose.SERVER_AUTH)))
                .thenReturn(ValidationResult.failed("verify cert failed: empty cert chain"));

        assertThatThrownBy(() -> trustManager.checkServerTrusted(new X509Certificate[]{ leaf, null }, "RSA"))
                .isInstanceOf(CertificateException.class)
                .hasMessage("verify cert failed: empty cert chain");
    }

    @Test
    void acceptedIssuersComeFromValidator() {
        X509Certificate ca = mock(X509Certificate.class);
        when(validator.getAcceptedIssuers()).thenReturn(new X509Certificate[]{ ca });

        assertThat(trustManager.getAcceptedIssuers()).containsExactly(ca);
    }
}
