package com.graphdoc.core.model;

/**
 * Type of a graph file.
 */
public enum FileType {
    /** Runnable script ({@code .dyn}) */
    SCRIPT("dyn"),
    /** Custom node definition ({@code .dyf}) */
    CUSTOM_NODE("dyf");

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
