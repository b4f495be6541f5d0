package com.graphdoc.core.locator;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A model paired with the document it is rendered to.
 *
 * <p>The previous text of the document is read at most once, on first access, and kept
 * until this object is discarded. Writing does not refresh it.
 *
 * @param <T> model type
 */
public final class DocFile<T> {

    private final T model;
    private final Path destination;
    private final DocFileLocator locator;
    private List<String> previousLines;

    public DocFile(T model, Path destination, DocFileLocator locator) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.destination = Objects.requireNonNull(destination, "destination must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    public T model() {
        return model;
    }

    public Path destination() {
        return destination;
    }

    /**
     * Text of the previous run.
     *
     * @return lines, empty if the document does not exist yet
     */
    public List<String> previousLines() {
        if (previousLines == null) {
            previousLines = List.copyOf(locator.existingText(destination));
        }
        return previousLines;
    }

    /**
     * Writes new document text.
     *
     * @param lines document lines
     */
    public void write(List<String> lines) {
        previousLines();
        locator.write(destination, lines);
    }

    @Override
    public String toString() {
        return "DocFile[" + destination + "]";
    }
}
