package com.graphdoc.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final List<String> DEVELOPMENT_MARKERS = List.of("_dev_", " dev ", "-dev-");
    private static final List<Character> NUMBER_SEPARATORS = List.of('_', ' ');

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files with the given extension below a root directory.
     *
     * @param rootPath root directory to search from
     * @param extension extension without dot
     * @return list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String extension) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> getExtension(path).equalsIgnoreCase(extension))
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without extension.
     *
     * @param path file path
     * @return stem
     */
    public static String getStem(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Computes a {@code ./}-prefixed link from one file to another with forward slashes.
     *
     * @param target linked file
     * @param from file containing the link
     * @return relative link
     */
    public static String relativeLink(Path target, Path from) {
        Path base = from.toAbsolutePath().normalize().getParent();
        Path relative = base.relativize(target.toAbsolutePath().normalize());
        String link = relative.toString().replace('\\', '/');
        return link.startsWith("../") ? link : "./" + link;
    }

    /**
     * Reads the leading sequence number of a file name, e.g. {@code 3} for {@code 03_Walls.dyn}.
     *
     * @param path file path
     * @return number before the first separator, if numeric
     */
    public static Optional<Integer> startNumber(Path path) {
        String stem = getStem(path);
        for (char separator : NUMBER_SEPARATORS) {
            int index = stem.indexOf(separator);
            if (index < 1) {
                continue;
            }
            String prefix = stem.substring(0, index);
            if (prefix.chars().allMatch(Character::isDigit)) {
                return Optional.of(Integer.parseInt(prefix));
            }
        }
        return Optional.empty();
    }

    /**
     * Checks if a file is a development copy, e.g. {@code 03_dev_Walls.dyn}.
     *
     * @param path file path
     * @return true if the name carries a development marker
     */
    public static boolean isDevelopmentCopy(Path path) {
        String stem = getStem(path).toLowerCase(Locale.ROOT);
        return DEVELOPMENT_MARKERS.stream().anyMatch(stem::contains);
    }

    /**
     * Deletes empty directories below a root, deepest first. The root itself is kept.
     *
     * @param rootPath root directory
     * @return number of deleted directories
     * @throws IOException if traversal or deletion fails
     */
    public static int deleteEmptyDirectories(Path rootPath) throws IOException {
        if (!Files.isDirectory(rootPath)) {
            return 0;
        }
        List<Path> directories;
        try (Stream<Path> paths = Files.walk(rootPath)) {
            directories = paths
                .filter(Files::isDirectory)
                .filter(path -> !path.equals(rootPath))
                .sorted(Comparator.comparingInt(Path::getNameCount).reversed())
                .toList();
        }
        int deleted = 0;
        for (Path directory : directories) {
            try (Stream<Path> entries = Files.list(directory)) {
                if (entries.findAny().isPresent()) {
                    continue;
                }
            }
            Files.delete(directory);
            deleted++;
        }
        return deleted;
    }
}
