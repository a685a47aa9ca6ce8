/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.util.Objects;

/**
 * Outcome of loading a bundle map: either a complete snapshot, or the reason nothing was loaded.
 */
public sealed interface BundleLoadResult permits BundleLoadResult.Loaded, BundleLoadResult.Failed {

    static BundleLoadResult loaded(TrustSnapshot snapshot) {
        return new Loaded(snapshot);
    }

    static BundleLoadResult failed(String reason) {
        return new Failed(reason);
    }

    default boolean isSuccess() {
        return this instanceof Loaded;
    }

    record Loaded(TrustSnapshot snapshot) implements BundleLoadResult {
        public Loaded {
            Objects.requireNonNull(snapshot);
        }
    }

    record Failed(String reason) implements BundleLoadResult {
        public Failed {
            Objects.requireNonNull(reason);
        }
    }
}
