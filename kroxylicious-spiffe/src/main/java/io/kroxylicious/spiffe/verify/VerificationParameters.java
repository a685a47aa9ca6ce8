/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Caller supplied policy for one path validation, handed through to the PKIX validator.
 *
 * @param validationTime the time at which the chain must be valid, or null for the validator's clock
 * @param purpose the extended key usage the leaf must permit
 */
public record VerificationParameters(@Nullable Instant validationTime, @NonNull Purpose purpose) {

    private static final VerificationParameters DEFAULTS = new VerificationParameters(null, Purpose.ANY);

    /**
     * Extended key usage required of the leaf. A leaf without the extended key usage extension
     * satisfies every purpose.
     */
    public enum Purpose {
        ANY(null),
        CLIENT_AUTH("1.3.6.1.5.5.7.3.2"),
        SERVER_AUTH("1.3.6.1.5.5.7.3.1");

        @Nullable
        private final String oid;

        Purpose(@Nullable String oid) {
            this.oid = oid;
        }

        public Optional<String> oid() {
            return Optional.ofNullable(oid);
        }
    }

    public VerificationParameters {
        Objects.requireNonNull(purpose);
    }

    public static VerificationParameters defaults() {
        return DEFAULTS;
    }

    public static VerificationParameters forPurpose(@NonNull Purpose purpose) {
        return new VerificationParameters(null, purpose);
    }

    public VerificationParameters at(@NonNull Instant time) {
        return new VerificationParameters(Objects.requireNonNull(time), purpose);
    }
}
