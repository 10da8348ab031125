package com.creativeforge.orchestrator.service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * What the dispatcher should do after one Orchestrator call.
 *
 * @param delay    wait before the next unit; only meaningful for RETRY_LATER
 * @param admitted jobs the gate admitted while this call released a slot; they must be started
 */
public record Advance(Kind kind, Duration delay, List<UUID> admitted) {

    public enum Kind {
        /** Run the next unit of the same job right away. */
        CONTINUE,
        /** Run the same unit again after {@code delay}. */
        RETRY_LATER,
        /** Nothing left to do for this job (terminal, lost a race, or waiting in the queue). */
        IDLE
    }

    public Advance {
        delay    = delay == null ? Duration.ZERO : delay;
        admitted = admitted == null ? List.of() : List.copyOf(admitted);
    }

    public static Advance proceed() {
        return new Advance(Kind.CONTINUE, Duration.ZERO, List.of());
    }

    public static Advance retryAfter(Duration delay) {
        return new Advance(Kind.RETRY_LATER, delay, List.of());
    }

    public static Advance idle() {
        return new Advance(Kind.IDLE, Duration.ZERO, List.of());
    }

    public static Advance finished(List<UUID> admitted) {
        return new Advance(Kind.IDLE, Duration.ZERO, admitted);
    }
}
