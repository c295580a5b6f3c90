package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * The result of a data quality decision: either an accepted value or the
 * reason it was rejected. Rejections are an expected part of processing real
 * data, so they are represented as values rather than exceptions.
 *
 * @param <T> The type of the accepted value
 */
public final class Outcome<T> {

    private final T value;
    private final String reason;

    private Outcome(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> Outcome<T> accepted(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> rejected(String reason) {
        return new Outcome<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isAccepted() {
        return reason == null;
    }

    /**
     * @return The accepted value
     * @throws IllegalStateException if this outcome is a rejection
     */
    public T getValue() {
        if (!isAccepted()) {
            throw new IllegalStateException("Rejected: " + reason);
        }
        return value;
    }

    /**
     * @return The rejection reason, or null if accepted
     */
    public String getReason() {
        return reason;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return isAccepted() ? Outcome.accepted(mapper.apply(value)) : Outcome.rejected(reason);
    }

    /**
     * Collect the accepted values, in order.
     *
     * @param <T> The value type
     * @param outcomes The outcomes to filter
     * @return The accepted values
     */
    public static <T> List<T> acceptedValues(List<Outcome<T>> outcomes) {
        List<T> result = new ArrayList<>();
        for (Outcome<T> outcome : outcomes) {
            if (outcome.isAccepted()) {
                result.add(outcome.value);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted{" + value + '}' : "Rejected{" + reason + '}';
    }
}
