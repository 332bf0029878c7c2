package com.heronix.directory.model.domain;

import java.util.List;
import java.util.Optional;

import com.heronix.directory.exception.DirectoryException;

/**
 * Outcome of one independently fallible step.
 *
 * {@link Success} carries a value, {@link Degraded} a warning that the caller
 * records before continuing, {@link Failed} an error that ends the enclosing call.
 */
public sealed interface StepResult<T> {

    record Success<T>(T value) implements StepResult<T> {}

    record Degraded<T>(String warning) implements StepResult<T> {}

    record Failed<T>(DirectoryException error) implements StepResult<T> {}

    static <T> StepResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StepResult<T> degraded(String warning) {
        return new Degraded<>(warning);
    }

    static <T> StepResult<T> failed(DirectoryException error) {
        return new Failed<>(error);
    }

    /**
     * Return the value of a success, append the warning of a degradation to
     * {@code warnings}, rethrow a failure.
     */
    default Optional<T> unwrap(List<String> warnings) {
        if (this instanceof Success<T> success) {
            return Optional.ofNullable(success.value());
        }
        if (this instanceof Degraded<T> degraded) {
            warnings.add(degraded.warning());
            return Optional.empty();
        }
        throw ((Failed<T>) this).error();
    }
}
