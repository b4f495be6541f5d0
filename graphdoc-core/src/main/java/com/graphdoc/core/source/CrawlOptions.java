package com.graphdoc.core.source;

import com.graphdoc.core.util.FileUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rules deciding which directories are entered and which files are collected.
 *
 * <p>Directories are skipped when their name contains {@code DEV}, equals one of the
 * excluded names ignoring case, or starts with {@code _} or {@code -}. Files are collected
 * when their extension matches and their name does not contain {@code DEV}.
 *
 * @param extensions file extensions without dot
 * @param excludedNames excluded directory names
 */
public record CrawlOptions(Set<String> extensions, List<String> excludedNames) {

    private static final String DEVELOPMENT_MARKER = "DEV";
    private static final List<String> EXCLUDED_PREFIXES = List.of("_", "-");

    public CrawlOptions {
        extensions = extensions == null ? Set.of() : extensions.stream()
            .map(extension -> extension.startsWith(".") ? extension.substring(1) : extension)
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        excludedNames = excludedNames == null ? List.of() : excludedNames.stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .toList();
    }

    /**
     * Creates options for one extension.
     *
     * @param extension file extension without dot
     * @param excludedNames excluded directory names
     * @return options
     */
    public static CrawlOptions of(String extension, List<String> excludedNames) {
        return new CrawlOptions(Set.of(extension), excludedNames);
    }

    /**
     * Whether a directory is entered.
     *
     * @param directory directory
     * @return true if its content is crawled
     */
    public boolean isCrawlingAllowed(Path directory) {
        String name = fileName(directory);
        if (name.contains(DEVELOPMENT_MARKER)) {
            return false;
        }
        if (excludedNames.contains(name.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return EXCLUDED_PREFIXES.stream().noneMatch(name::startsWith);
    }

    /**
     * Whether a file is collected.
     *
     * @param file regular file
     * @return true if it is part of the result
     */
    public boolean canAppend(Path file) {
        if (FileUtils.getStem(file).contains(DEVELOPMENT_MARKER)) {
            return false;
        }
        return extensions.contains(FileUtils.getExtension(file).toLowerCase(Locale.ROOT));
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }
}
