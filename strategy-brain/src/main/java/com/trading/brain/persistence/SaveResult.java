package com.trading.brain.persistence;

import java.nio.file.Path;

/**
 * Outcome of writing a snapshot.
 */
public sealed interface SaveResult permits SaveResult.Saved, SaveResult.Failed {

    Path path();

    record Saved(Path path, long bytes) implements SaveResult {}

    record Failed(Path path, Exception cause) implements SaveResult {}

    default boolean isSaved() {
        return this instanceof Saved;
    }
}
