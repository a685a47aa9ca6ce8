/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.tls;

import java.util.Objects;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContextBuilder;

import io.kroxylicious.spiffe.SpiffeValidator;

/**
 * Configures a Netty server {@link SslContextBuilder} to authenticate clients by SPIFFE identity.
 * Client certificates are required: a client that presents none fails the handshake.
 */
public class NettySpiffeTrustProvider {

    private final SpiffeValidator validator;

    public NettySpiffeTrustProvider(SpiffeValidator validator) {
        this.validator = Objects.requireNonNull(validator);
    }

    public SslContextBuilder apply(SslContextBuilder builder) {
        return builder.trustManager(new SpiffeTrustManager(validator))
                .clientAuth(ClientAuth.REQUIRE);
    }
}
