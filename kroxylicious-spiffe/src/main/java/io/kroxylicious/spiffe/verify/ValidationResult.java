/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.verify;

import java.util.Objects;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Outcome of verifying a peer certificate chain.
 *
 * @param status outcome
 * @param errorDetails human readable reason, present only when the chain was rejected
 */
public record ValidationResult(@NonNull ValidationStatus status, @Nullable String errorDetails) {

    private static final ValidationResult SUCCESSFUL = new ValidationResult(ValidationStatus.SUCCESSFUL, null);

    public ValidationResult {
        Objects.requireNonNull(status);
        if (status == ValidationStatus.FAILED && errorDetails == null) {
            throw new IllegalArgumentException("A failed validation requires error details");
        }
    }

    public static ValidationResult successful() {
        return SUCCESSFUL;
    }

    public static ValidationResult failed(@NonNull String errorDetails) {
        return new ValidationResult(ValidationStatus.FAILED, errorDetails);
    }

    public boolean isSuccessful() {
        return status == ValidationStatus.SUCCESSFUL;
    }

    public Optional<String> error() {
        return Optional.ofNullable(errorDetails);
    }
}
