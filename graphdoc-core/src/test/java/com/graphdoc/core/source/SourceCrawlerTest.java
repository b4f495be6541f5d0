package com.graphdoc.core.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceCrawlerTest {

    @TempDir
    Path tempDir;

    private final CrawlOptions scripts = CrawlOptions.of(".dyn", List.of("Backup"));

    @Test
    void crawl_skipsExcludedDevelopmentAndPrivateDirectories() throws IOException {
        // Given
        Path root = tempDir.resolve("Scripts");
        touch(root.resolve("Walls/01_Walls.dyn"));
        touch(root.resolve("Walls/02_Doors.DYN"));
        touch(root.resolve("Walls/notes.txt"));
        touch(root.resolve("Walls/03_Walls DEV.dyn"));
        touch(root.resolve("backup/01_Walls.dyn"));
        touch(root.resolve("Walls DEV/01_Walls.dyn"));
        touch(root.resolve("_drafts/01_Walls.dyn"));
        touch(root.resolve("-old/01_Walls.dyn"));

        // When
        List<Path> files = new SourceCrawler(2).crawl(List.of(root), scripts);

        // Then
        assertThat(files).containsExactly(root.resolve("Walls/01_Walls.dyn"), root.resolve("Walls/02_Doors.DYN"));
    }

    @Test
    void crawl_missingRoot_doesNotStopOtherRoots() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        touch(first.resolve("a.dyn"));
        touch(second.resolve("b.dyn"));

        List<Path> files = new SourceCrawler(4).crawl(
            List.of(first, tempDir.resolve("missing"), second), scripts);

        assertThat(files).containsExactly(first.resolve("a.dyn"), second.resolve("b.dyn"));
    }

    @Test
    void crawl_noRoots_returnsEmpty() {
        assertThat(new SourceCrawler(1).crawl(List.of(), scripts)).isEmpty();
    }

    @Test
    void constructor_nonPositiveThreads_throws() {
        assertThatThrownBy(() -> new SourceCrawler(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void crawlOptions_normalizeExtensionsAndExclusions() {
        CrawlOptions options = CrawlOptions.of(".DYF", List.of("Archive"));

        assertThat(options.extensions()).containsExactly("dyf");
        assertThat(options.excludedNames()).containsExactly("archive");
        assertThat(options.isCrawlingAllowed(Path.of("/src/Archive 2019"))).isTrue();
        assertThat(options.isCrawlingAllowed(Path.of("/src/ARCHIVE"))).isFalse();
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}");
    }
}
