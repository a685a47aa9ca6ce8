/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.spiffe;

import java.time.Clock;
import java.util.Objects;

import io.micrometer.core.instrument.MeterRegistry;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The runtime a {@link SpiffeValidator} lives in. The executors belong to the caller, who shuts
 * them down; closing the validator does not.
 *
 * @param controlExecutor runs reloads and drives snapshot distribution
 * @param workers the threads that verify peer certificate chains, each holding its own snapshot
 * @param meterRegistry registry for the verification counters
 * @param clock time source for validation dates and expiry calculations
 */
public record SpiffeValidatorContext(@NonNull EventExecutor controlExecutor,
                                     @NonNull EventExecutorGroup workers,
                                     @NonNull MeterRegistry meterRegistry,
                                     @NonNull Clock clock) {

    public SpiffeValidatorContext {
        Objects.requireNonNull(controlExecutor, "controlExecutor");
        Objects.requireNonNull(workers, "workers");
        Objects.requireNonNull(meterRegistry, "meterRegistry");
        Objects.requireNonNull(clock, "clock");
    }

    public SpiffeValidatorContext(@NonNull EventExecutor controlExecutor,
                                  @NonNull EventExecutorGroup workers,
                                  @NonNull MeterRegistry meterRegistry) {
        this(controlExecutor, workers, meterRegistry, Clock.systemUTC());
    }
}
