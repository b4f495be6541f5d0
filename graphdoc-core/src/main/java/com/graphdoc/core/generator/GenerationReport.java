package com.graphdoc.core.generator;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a documentation run.
 *
 * @param written documents written
 * @param failures sources that could not be documented
 * @param deleted stale documents removed
 */
public record GenerationReport(
    List<Path> written,
    List<Failure> failures,
    List<Path> deleted
) {
    public GenerationReport {
        written = written == null ? List.of() : List.copyOf(written);
        failures = failures == null ? List.of() : List.copyOf(failures);
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Source that could not be documented.
     *
     * @param source source path
     * @param message error message
     */
    public record Failure(Path source, String message) {
    }
}
