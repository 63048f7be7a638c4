package com.funnelscope.service.core.funnel.engine;

import java.util.function.Function;

/**
 * Result of a funnel computation. {@link Completed} with {@code partial} set means some runs were cut short by the
 * conversion window, which is expected; {@link Cancelled} means the caller's cancellation stopped the scan and no
 * result is available.
 */
public sealed interface FunnelOutcome<T> permits FunnelOutcome.Completed, FunnelOutcome.Cancelled {

    static <T> FunnelOutcome<T> completed(T value, boolean partial) {
        return new Completed<>(value, partial);
    }

    static <T> FunnelOutcome<T> cancelled(String reason, long actorsProcessed) {
        return new Cancelled<>(reason, actorsProcessed);
    }

    boolean isCompleted();

    <R> FunnelOutcome<R> map(Function<? super T, ? extends R> mapper);

    /** The completed value; throws {@link FunnelCancelledException} for a cancelled outcome. */
    T orElseThrow();

    record Completed<T>(T value, boolean partial) implements FunnelOutcome<T> {
        @Override
        public boolean isCompleted() {
            return true;
        }

        @Override
        public <R> FunnelOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Completed<>(mapper.apply(value), partial);
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    record Cancelled<T>(String reason, long actorsProcessed) implements FunnelOutcome<T> {
        @Override
        public boolean isCompleted() {
            return false;
        }

        @Override
        public <R> FunnelOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Cancelled<>(reason, actorsProcessed);
        }

        @Override
        public T orElseThrow() {
            throw new FunnelCancelledException(reason, actorsProcessed);
        }
    }
}
