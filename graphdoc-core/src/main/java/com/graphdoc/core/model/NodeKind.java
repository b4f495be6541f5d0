package com.graphdoc.core.model;

/**
 * Discriminant of the graph node variants.
 */
public enum NodeKind {
    GENERAL,
    CODE_BLOCK,
    PYTHON_SCRIPT,
    FILE_PATH,
    DIRECTORY_PATH,
    SELECTION,
    INPUT_VALUE,
    CUSTOM_REFERENCE;

    /**
     * Returns whether nodes of this kind point at a file or directory.
     *
     * @return true for file and directory path inputs
     */
    public boolean isPath() {
        return this == FILE_PATH || this == DIRECTORY_PATH;
    }
}
