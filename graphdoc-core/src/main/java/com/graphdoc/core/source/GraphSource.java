package com.graphdoc.core.source;

import com.graphdoc.core.config.GraphDocConfig;
import com.graphdoc.core.model.FileType;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers and reads the scripts and packages of a source tree.
 *
 * <p>Files that cannot be read or parsed are logged and skipped.
 */
public class GraphSource {

    private static final Logger log = LoggerFactory.getLogger(GraphSource.class);

    /**
     * File name of a package manifest.
     */
    public static final String PACKAGE_MANIFEST = "pkg.json";

    private final GraphJsonReader reader;
    private final SourceCrawler crawler;
    private final List<String> excludedNames;

    public GraphSource(GraphJsonReader reader, SourceCrawler crawler, List<String> excludedNames) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.crawler = Objects.requireNonNull(crawler, "crawler must not be null");
        this.excludedNames = excludedNames == null ? List.of() : List.copyOf(excludedNames);
    }

    public static GraphSource fromConfig(GraphDocConfig config) {
        return new GraphSource(new GraphJsonReader(), new SourceCrawler(config.crawler().threads()),
            config.crawler().excludedNames());
    }

    /**
     * Script folder of a configured source tree.
     *
     * @param config configuration
     * @return script root
     */
    public static Path scriptRoot(GraphDocConfig config) {
        return Paths.get(config.source().root()).resolve(config.source().scriptFolder());
    }

    /**
     * Package folder of a configured source tree.
     *
     * @param config configuration
     * @return package root
     */
    public static Path packageRoot(GraphDocConfig config) {
        return Paths.get(config.source().root()).resolve(config.source().packageFolder());
    }

    /**
     * Reads all scripts below a root.
     *
     * @param root script root, ignored if missing
     * @return scripts sorted by path
     */
    public List<GraphFile> readScripts(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("Script folder not found: {}", root);
            return List.of();
        }
        List<Path> files = crawler.crawl(List.of(root), CrawlOptions.of(FileType.SCRIPT.extension(), excludedNames));
        List<GraphFile> scripts = readGraphs(files);
        log.info("Read {} scripts below {}", scripts.size(), root);
        return scripts;
    }

    /**
     * Reads all packages below a root with their custom nodes.
     *
     * <p>Each package directory is crawled in its own task. Packages with the same name and
     * version are read once.
     *
     * @param root package root, ignored if missing
     * @return packages sorted by name and version
     */
    public List<GraphPackage> readPackages(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("Package folder not found: {}", root);
            return List.of();
        }

        List<Path> manifests = crawler.crawl(List.of(root), CrawlOptions.of("json", excludedNames)).stream()
            .filter(path -> PACKAGE_MANIFEST.equalsIgnoreCase(path.getFileName().toString()))
            .toList();

        Map<String, GraphPackage> packages = new LinkedHashMap<>();
        for (Path manifest : manifests) {
            GraphPackage graphPackage;
            try {
                graphPackage = reader.readPackage(manifest);
            } catch (IOException | UncheckedIOException e) {
                log.error("Failed to read package manifest {}: {}", manifest, e.getMessage());
                continue;
            }
            GraphPackage known = packages.putIfAbsent(graphPackage.fullName(), graphPackage);
            if (known != null) {
                log.warn("Package {} found twice, keeping {} and ignoring {}",
                    graphPackage.fullName(), known.path(), manifest);
            }
        }

        List<Path> packageDirectories = packages.values().stream()
            .map(graphPackage -> graphPackage.path().getParent())
            .toList();
        List<Path> customNodeFiles = crawler.crawl(packageDirectories,
            CrawlOptions.of(FileType.CUSTOM_NODE.extension(), excludedNames));

        List<GraphPackage> result = new ArrayList<>();
        for (GraphPackage graphPackage : packages.values()) {
            Path directory = graphPackage.path().getParent();
            List<Path> ownFiles = customNodeFiles.stream()
                .filter(file -> file.startsWith(directory))
                .toList();
            result.add(graphPackage.withCustomNodes(readGraphs(ownFiles)));
        }
        result.sort(Comparator.comparing(GraphPackage::name).thenComparing(GraphPackage::version));
        log.info("Read {} packages below {}", result.size(), root);
        return result;
    }

    private List<GraphFile> readGraphs(List<Path> files) {
        List<GraphFile> graphs = new ArrayList<>();
        for (Path file : files) {
            try {
                graphs.add(reader.readGraph(file));
            } catch (IOException | UncheckedIOException e) {
                log.error("Failed to read {}: {}", file, e.getMessage());
            }
        }
        graphs.sort(Comparator.comparing(GraphFile::path));
        return graphs;
    }
}
