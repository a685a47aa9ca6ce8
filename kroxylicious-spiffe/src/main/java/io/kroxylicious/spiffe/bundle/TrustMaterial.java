/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe.bundle;

import java.util.Objects;

/**
 * A loaded snapshot together with the provenance reported for its representative CA.
 *
 * @param snapshot the snapshot
 * @param caFileName where the representative CA came from, empty if there is none
 */
public record TrustMaterial(TrustSnapshot snapshot, String caFileName) {
    public TrustMaterial {
        Objects.requireNonNull(snapshot);
        Objects.requireNonNull(caFileName);
    }
}
