package com.funnelscope.service.core.funnel.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** Caller-driven stop signal, polled by the engine between actor batches. */
@FunctionalInterface
public interface FunnelCancellation {

    FunnelCancellation NEVER = () -> null;

    /** Why the computation should stop, or {@code null} to keep going. */
    String cancellationReason();

    default boolean isCancelled() {
        return cancellationReason() != null;
    }

    static FunnelCancellation deadline(Clock clock, Instant deadline) {
        return () -> clock.instant().isAfter(deadline) ? "deadline " + deadline + " exceeded" : null;
    }

    static Manual manual() {
        return new Manual();
    }

    default FunnelCancellation or(FunnelCancellation other) {
        return () -> {
            String reason = cancellationReason();
            return reason != null ? reason : other.cancellationReason();
        };
    }

    final class Manual implements FunnelCancellation {
        private final AtomicReference<String> reason = new AtomicReference<>();

        public void cancel(String why) {
            reason.compareAndSet(null, why == null ? "cancelled" : why);
        }

        @Override
        public String cancellationReason() {
            return reason.get();
        }
    }
}
