package com.graphdoc.core.locator.impl;

import com.graphdoc.core.locator.DocFileLocator;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Locator mirroring the source tree below a documentation root.
 *
 * <p>Scripts keep their relative directory, package documents are nested by package name
 * and version. File names are cleaned of characters that break links.
 *
 * <p><b>Layout:</b>
 * <pre>{@code
 * <source>/Scripts/Walls/01_Create.dyn
 *   -> <docs>/Scripts/Walls/01_Create.org
 * <source>/Packages/Tools/pkg.json (version 1.2.0)
 *   -> <docs>/Packages/Tools/Tools-1-2-0.org
 * <source>/Packages/Tools/dyf/Split.List.dyf
 *   -> <docs>/Packages/Tools/1-2-0/Split-List.org
 * }</pre>
 */
public class MirroredDocFileLocator implements DocFileLocator {

    private static final Logger log = LoggerFactory.getLogger(MirroredDocFileLocator.class);
    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[%\\[\\]&()\\uA7FF]");

    private final Path sourceRoot;
    private final Path scriptDocRoot;
    private final Path packageDocRoot;
    private final Path docRoot;
    private final String extension;

    /**
     * Creates a locator.
     *
     * @param sourceRoot root of the graph sources
     * @param docRoot root of the documentation
     * @param scriptFolder folder name of the scripts below both roots
     * @param packageFolder folder name of the packages below both roots
     * @param extension document extension without dot
     */
    public MirroredDocFileLocator(Path sourceRoot, Path docRoot, String scriptFolder, String packageFolder,
                                  String extension) {
        this.sourceRoot = Objects.requireNonNull(sourceRoot, "sourceRoot must not be null").toAbsolutePath().normalize();
        this.docRoot = Objects.requireNonNull(docRoot, "docRoot must not be null").toAbsolutePath().normalize();
        this.scriptDocRoot = this.docRoot.resolve(scriptFolder);
        this.packageDocRoot = this.docRoot.resolve(packageFolder);
        this.extension = Objects.requireNonNull(extension, "extension must not be null");
    }

    @Override
    public Path destinationPath(Path sourcePath) {
        Path source = sourcePath.toAbsolutePath().normalize();
        String fileName = cleanName(FileUtils.getStem(source)) + "." + extension;
        if (!source.startsWith(sourceRoot)) {
            log.debug("Source {} is outside of {}, documenting at script root", source, sourceRoot);
            return scriptDocRoot.resolve(fileName);
        }
        Path parent = sourceRoot.relativize(source).getParent();
        return parent == null ? docRoot.resolve(fileName) : docRoot.resolve(parent).resolve(fileName);
    }

    @Override
    public Path packageDestination(GraphPackage graphPackage) {
        String name = cleanName(graphPackage.name());
        String version = cleanName(graphPackage.version());
        String fileName = version.isEmpty() ? name : name + "-" + version;
        return packageDocRoot.resolve(name).resolve(fileName + "." + extension);
    }

    @Override
    public Path customNodeDestination(GraphFile customNode, GraphPackage graphPackage) {
        String version = cleanName(graphPackage.version());
        Path packageDir = packageDocRoot.resolve(cleanName(graphPackage.name()));
        Path versionDir = version.isEmpty() ? packageDir : packageDir.resolve(version);
        return versionDir.resolve(cleanName(customNode.fileStem()) + "." + extension);
    }

    @Override
    public List<String> existingText(Path destinationPath) {
        if (!Files.isRegularFile(destinationPath)) {
            return List.of();
        }
        try {
            return Files.readAllLines(destinationPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read previous document: " + destinationPath, e);
        }
    }

    @Override
    public void write(Path destinationPath, List<String> lines) {
        log.debug("Writing file: {}", destinationPath);

        try {
            Path parentDir = destinationPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            String content = String.join("\n", lines) + "\n";
            Files.writeString(destinationPath, content, StandardCharsets.UTF_8);
            log.info("Wrote file: {} ({} lines)", docRoot.relativize(destinationPath.toAbsolutePath().normalize()), lines.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + destinationPath, e);
        }
    }

    @Override
    public List<Path> listDocuments() {
        List<Path> documents = new ArrayList<>();
        for (Path root : documentRoots()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try {
                documents.addAll(FileUtils.findFiles(root, extension));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list documents below " + root, e);
            }
        }
        return documents;
    }

    @Override
    public List<Path> documentRoots() {
        return List.of(scriptDocRoot, packageDocRoot);
    }

    /**
     * Removes characters that break Org links and replaces dots.
     *
     * @param value raw name
     * @return cleaned name, empty for null
     */
    static String cleanName(String value) {
        if (value == null) {
            return "";
        }
        return UNSAFE_CHARACTERS.matcher(value).replaceAll("").replace('.', '-').trim();
    }
}
