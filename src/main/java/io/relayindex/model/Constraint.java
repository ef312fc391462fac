package io.relayindex.model;

import java.util.Objects;

/**
 * A selection that is either unconstrained ({@link Any}) or bound to a single value ({@link Only}).
 *
 * @param <T> type of the bound value
 */
public sealed interface Constraint<T> permits Constraint.Any, Constraint.Only {

    static <T> Constraint<T> any() {
        return new Any<>();
    }

    static <T> Constraint<T> only(T value) {
        return new Only<>(value);
    }

    record Any<T>() implements Constraint<T> {
    }

    record Only<T>(T value) implements Constraint<T> {
        public Only {
            Objects.requireNonNull(value, "value");
        }
    }
}
