package com.graphdoc.core.locator;

import com.graphdoc.core.locator.impl.MirroredDocFileLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocFileTest {

    @TempDir
    Path tempDir;

    private MirroredDocFileLocator locator;
    private Path destination;

    @BeforeEach
    void setUp() {
        locator = new MirroredDocFileLocator(tempDir.resolve("src"), tempDir.resolve("docs"), "Scripts", "Packages",
            "org");
        destination = tempDir.resolve("docs/Scripts/01_Walls.org");
    }

    @Test
    void write_newDocument_createsFileAndKeepsEmptyPreviousText() throws IOException {
        // Given
        DocFile<String> docFile = new DocFile<>("walls", destination, locator);

        // When
        docFile.write(List.of("* Tutorial", "", "Run it first"));

        // Then
        assertThat(Files.readAllLines(destination, StandardCharsets.UTF_8))
            .containsExactly("* Tutorial", "", "Run it first");
        assertThat(docFile.previousLines()).isEmpty();
    }

    @Test
    void write_existingDocument_previousLinesStillReturnTextBeforeTheWrite() throws IOException {
        // Given
        Files.createDirectories(destination.getParent());
        Files.writeString(destination, "* Old\n", StandardCharsets.UTF_8);
        DocFile<String> docFile = new DocFile<>("walls", destination, locator);

        // When
        docFile.write(List.of("* New"));

        // Then
        assertThat(docFile.previousLines()).containsExactly("* Old");
        assertThat(new DocFile<>("walls", destination, locator).previousLines()).containsExactly("* New");
    }
}
