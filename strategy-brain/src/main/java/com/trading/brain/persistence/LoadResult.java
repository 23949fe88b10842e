package com.trading.brain.persistence;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of reading a snapshot. {@link Missing} and {@link Failed} are the caller's
 * "start fresh" branch.
 */
public sealed interface LoadResult<T> permits LoadResult.Loaded, LoadResult.Missing, LoadResult.Failed {

    Path path();

    record Loaded<T>(Path path, T value) implements LoadResult<T> {}

    record Missing<T>(Path path) implements LoadResult<T> {}

    record Failed<T>(Path path, Exception cause) implements LoadResult<T> {}

    default Optional<T> asOptional() {
        if (this instanceof Loaded<T> loaded) {
            return Optional.of(loaded.value());
        }
        return Optional.empty();
    }
}
