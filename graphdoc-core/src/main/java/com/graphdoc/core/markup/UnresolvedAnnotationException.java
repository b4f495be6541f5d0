package com.graphdoc.core.markup;

import java.nio.file.Path;

/**
 * Raised when a node-scoped annotation has no node to attach to.
 *
 * <p>Fatal for the file being documented. The batch runner catches it and continues
 * with the next file.
 */
public class UnresolvedAnnotationException extends RuntimeException {

    private final Path file;
    private final String annotationText;

    public UnresolvedAnnotationException(Path file, String annotationText) {
        super("No node found for annotation \"" + annotationText + "\" in " + file);
        this.file = file;
        this.annotationText = annotationText;
    }

    public Path getFile() {
        return file;
    }

    public String getAnnotationText() {
        return annotationText;
    }
}
