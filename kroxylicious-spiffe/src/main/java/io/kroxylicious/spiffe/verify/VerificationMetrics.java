/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.util.Objects;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counters for rejected peer certificate chains. Chains rejected for their trust (bad or
 * unknown issuer, precheck, expiry, revocation) are counted apart from chains that are trusted
 * but carry the wrong identity.
 */
public class VerificationMetrics {

    static final String VERIFY_ERRORS_METER_NAME = "kroxylicious_spiffe_verify_errors";
    static final String VERIFY_SAN_MISMATCH_METER_NAME = "kroxylicious_spiffe_verify_san_mismatches";

    private final Counter verifyErrors;
    private final Counter sanMismatches;

    public VerificationMetrics(MeterRegistry registry) {
        Objects.requireNonNull(registry);
        this.verifyErrors = Counter.builder(VERIFY_ERRORS_METER_NAME)
                .description("Count of peer certificate chains rejected by SPIFFE trust verification.")
                .register(registry);
        this.sanMismatches = Counter.builder(VERIFY_SAN_MISMATCH_METER_NAME)
                .description("Count of trusted peer certificate chains rejected because no subject alternative name matched.")
                .register(registry);
    }

    void verifyError() {
        verifyErrors.increment();
    }

    void sanMismatch() {
        sanMismatches.increment();
    }
}
