package com.graphdoc.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Finds source files below a set of roots.
 *
 * <p>Each root is crawled by its own task on a fixed thread pool. A root that fails is
 * logged and contributes nothing; the other roots are unaffected. Results keep the order
 * of the roots, files of one root are sorted.
 */
public class SourceCrawler {

    private static final Logger log = LoggerFactory.getLogger(SourceCrawler.class);

    private final int threads;

    public SourceCrawler(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.threads = threads;
    }

    /**
     * Crawls all roots in parallel.
     *
     * @param roots root directories
     * @param options crawl rules
     * @return files found
     */
    public List<Path> crawl(List<Path> roots, CrawlOptions options) {
        if (roots.isEmpty()) {
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, roots.size()));
        try {
            Map<Path, Future<List<Path>>> tasks = new LinkedHashMap<>();
            for (Path root : roots) {
                tasks.put(root, executor.submit(() -> crawlRoot(root, options)));
            }

            List<Path> files = new ArrayList<>();
            for (Map.Entry<Path, Future<List<Path>>> task : tasks.entrySet()) {
                try {
                    files.addAll(task.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Failed to crawl {}: {}", task.getKey(), cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while crawling " + task.getKey(), e);
                }
            }
            log.debug("Found {} files below {} roots", files.size(), roots.size());
            return files;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Crawls one root on the calling thread.
     *
     * @param root root directory
     * @param options crawl rules
     * @return sorted files
     */
    List<Path> crawlRoot(Path root, CrawlOptions options) {
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException(new IOException("Not a directory: " + root));
        }
        List<Path> files = new ArrayList<>();
        collect(root, options, files);
        files.sort(null);
        log.debug("Crawled {}: {} files", root, files.size());
        return files;
    }

    private void collect(Path directory, CrawlOptions options, List<Path> files) {
        List<Path> entries;
        try (Stream<Path> stream = Files.list(directory)) {
            entries = stream.sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }

        for (Path entry : entries) {
            if (Files.isDirectory(entry)) {
                if (options.isCrawlingAllowed(entry)) {
                    collect(entry, options, files);
                } else {
                    log.debug("Skipping excluded directory: {}", entry);
                }
            } else if (Files.isRegularFile(entry) && options.canAppend(entry)) {
                files.add(entry);
            }
        }
    }
}
