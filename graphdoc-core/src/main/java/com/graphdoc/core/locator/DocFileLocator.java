package com.graphdoc.core.locator;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;

import java.nio.file.Path;
import java.util.List;

/**
 * Maps source files to documentation files and performs the document I/O.
 *
 * <p>The content tree never computes paths itself. It reads previous text and writes new
 * text only through this interface.
 */
public interface DocFileLocator {

    /**
     * Destination of a script document.
     *
     * @param sourcePath script path
     * @return documentation path
     */
    Path destinationPath(Path sourcePath);

    /**
     * Destination of a package document.
     *
     * @param graphPackage package
     * @return documentation path
     */
    Path packageDestination(GraphPackage graphPackage);

    /**
     * Destination of a custom node document, nested under its package.
     *
     * @param customNode custom node definition
     * @param graphPackage package shipping the node
     * @return documentation path
     */
    Path customNodeDestination(GraphFile customNode, GraphPackage graphPackage);

    /**
     * Reads the text previously written to a destination.
     *
     * @param destinationPath documentation path
     * @return lines, empty if the file does not exist
     */
    List<String> existingText(Path destinationPath);

    /**
     * Writes a document, creating parent directories.
     *
     * @param destinationPath documentation path
     * @param lines document lines
     */
    void write(Path destinationPath, List<String> lines);

    /**
     * Lists all documents currently present below the documentation roots.
     *
     * @return document paths
     */
    List<Path> listDocuments();

    /**
     * Documentation roots owned by this locator.
     *
     * @return root directories
     */
    List<Path> documentRoots();
}
