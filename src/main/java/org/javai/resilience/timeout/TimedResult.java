package org.javai.resilience.timeout;

import java.util.Objects;
import java.util.Optional;

/**
 * The result of a {@link TimeoutGuard#attempt} call.
 *
 * @param value the work's result, or the fallback when the deadline passed
 * @param timedOut whether the deadline passed before the work finished
 * @param orphan the still-running work when {@code timedOut}, otherwise empty
 */
public record TimedResult<T>(T value, boolean timedOut, Optional<OrphanedTask<T>> orphan) {

    public TimedResult {
        Objects.requireNonNull(orphan, "orphan must not be null, use Optional.empty()");
        if (timedOut != orphan.isPresent()) {
            throw new IllegalArgumentException("an orphaned task is present exactly when the call timed out");
        }
    }

    static <T> TimedResult<T> completed(T value) {
        return new TimedResult<>(value, false, Optional.empty());
    }

    static <T> TimedResult<T> timedOut(T fallback, OrphanedTask<T> orphan) {
        return new TimedResult<>(fallback, true, Optional.of(orphan));
    }
}
