package io.schedlens.core;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single engine query.
 *
 * <ul>
 *   <li>{@link Present}: the engine returned data</li>
 *   <li>{@link Absent}: the entity does not exist (not an error)</li>
 *   <li>{@link Failed}: the engine raised an error</li>
 * </ul>
 */
public sealed interface FetchResult<T> permits FetchResult.Present, FetchResult.Absent, FetchResult.Failed {

    record Present<T>(T value) implements FetchResult<T> {
        public Present {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Absent<T>() implements FetchResult<T> {
    }

    record Failed<T>(SchedulerEngineException error) implements FetchResult<T> {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }

        /**
         * True when the failure is the anticipated "definition cannot be materialized" case.
         */
        public boolean isDetailUnavailable() {
            return error instanceof JobDetailUnavailableException;
        }
    }

    /**
     * Present when {@code value} is non-null, absent otherwise.
     */
    static <T> FetchResult<T> of(T value) {
        return value == null ? new Absent<>() : new Present<>(value);
    }

    static <T> FetchResult<T> failed(SchedulerEngineException error) {
        return new Failed<>(error);
    }

    /**
     * Empty for {@link Absent}; rethrows the engine error for {@link Failed}.
     */
    default Optional<T> toOptional() {
        if (this instanceof Present<T> p) {
            return Optional.of(p.value());
        }
        if (this instanceof Failed<T> f) {
            throw f.error();
        }
        return Optional.empty();
    }

    /**
     * Returns the value, rethrowing the engine error for {@link Failed}.
     *
     * @throws NoSuchElementException if the result is {@link Absent}
     */
    default T orElseThrow() {
        return toOptional().orElseThrow(() -> new NoSuchElementException("engine returned no value"));
    }
}
