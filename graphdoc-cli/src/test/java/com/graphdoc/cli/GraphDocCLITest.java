package com.graphdoc.cli;

import com.graphdoc.GraphDocCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GraphDoc command line")
class GraphDocCLITest {

    private static final String SCRIPT = """
        {
          "Uuid": "3c9d0464-8643-5ffe-96e5-ab1769818209",
          "Name": "01_Walls",
          "Description": "Creates walls",
          "Nodes": [{"Id": "n1", "NodeType": "FunctionNode"}],
          "View": {
            "Dynamo": {"Version": "2.13.1.3887"},
            "NodeViews": [{"Id": "n1", "Name": "Wall.ByCurve", "X": 0.0, "Y": 0.0}],
            "Annotations": [%s]
          }
        }
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    @DisplayName("Should list all section markers")
    void listSections_printsMarkers() {
        int exitCode = GraphDocCLI.commandLine().execute("list", "sections");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("[D] Description (headline)")
            .contains("[W] Warnings (node)");
    }

    @Test
    @DisplayName("Should fail on unknown list type")
    void listUnknownType_returnsError() {
        assertThat(GraphDocCLI.commandLine().execute("list", "widgets")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should write documents for a source tree")
    void generate_writesDocuments() throws IOException {
        // Given
        writeScript("");

        // When
        int exitCode = GraphDocCLI.commandLine().execute("-q", "generate",
            "-c", tempDir.resolve("graphdoc.yaml").toString(),
            "-s", tempDir.resolve("src").toString(),
            "-o", tempDir.resolve("docs").toString());

        // Then
        assertThat(exitCode).isZero();
        Path document = tempDir.resolve("docs/Scripts/01_Walls.org");
        assertThat(document).exists();
        assertThat(Files.readString(document, StandardCharsets.UTF_8)).contains("#+title: 01 Walls", "* Information");
    }

    @Test
    @DisplayName("Should accept annotations placed next to a node")
    void validate_linkedAnnotation_succeeds() throws IOException {
        writeScript("{\"Id\": \"a1\", \"Title\": \"[W] Check\", \"Nodes\": [], \"Left\": 5.0, \"Top\": 5.0}");

        int exitCode = GraphDocCLI.commandLine().execute("validate",
            "-c", tempDir.resolve("graphdoc.yaml").toString(),
            "-s", tempDir.resolve("src").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Checked 1 files, 1 section markups linked");
    }

    @Test
    @DisplayName("Should report annotations in graphs without nodes")
    void validate_orphanAnnotation_returnsError() throws IOException {
        Path script = tempDir.resolve("src/Scripts/02_Empty.dyn");
        Files.createDirectories(script.getParent());
        Files.writeString(script, """
            {"Nodes": [], "View": {"Annotations": [{"Id": "a1", "Title": "[W] Orphan", "Nodes": []}]}}
            """, StandardCharsets.UTF_8);

        int exitCode = GraphDocCLI.commandLine().execute("validate",
            "-c", tempDir.resolve("graphdoc.yaml").toString(),
            "-s", tempDir.resolve("src").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("Should parse global options before subcommands")
    void globalOptions_areParsed() {
        GraphDocCLI cli = new GraphDocCLI();
        new CommandLine(cli).parseArgs("-v", "list", "sections");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    private void writeScript(String annotations) throws IOException {
        Path script = tempDir.resolve("src/Scripts/01_Walls.dyn");
        Files.createDirectories(script.getParent());
        Files.writeString(script, SCRIPT.formatted(annotations), StandardCharsets.UTF_8);
    }
}
