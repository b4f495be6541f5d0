package com.graphdoc.core.export.impl;

import com.graphdoc.core.export.TableRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OrgExporter}.
 */
class OrgExporterTest {

    private OrgExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new OrgExporter();
    }

    @Test
    void heading_levels_areRecognizedAsHeadings() {
        for (int level = 1; level <= 4; level++) {
            String heading = exporter.heading("Information", level);

            assertThat(heading).isEqualTo("*".repeat(level) + " Information");
            assertThat(exporter.isHeading(heading)).isTrue();
        }
    }

    @Test
    void heading_levelBelowOne_throws() {
        assertThatThrownBy(() -> exporter.heading("Oops", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isHeading_bodyTextStartingWithStar_isNotAHeading() {
        assertThat(exporter.isHeading("*bold* statement")).isFalse();
        assertThat(exporter.isHeading(" * indented bullet")).isFalse();
        assertThat(exporter.isHeading("***")).isFalse();
        assertThat(exporter.isHeading("")).isFalse();
    }

    @Test
    void asTable_withHeader_isFoundAsOneRange() {
        // When
        List<String> table = exporter.asTable(List.of("A", "B"), List.of(List.of("x", "y")));

        // Then
        assertThat(table).containsExactly("| A | B |", "|---+---|", "| x | y |");
        assertThat(exporter.tableRanges(table)).containsExactly(new TableRange(0, 3));
    }

    @Test
    void asTable_columnWidths_areMaxOfCells() {
        List<String> table = exporter.asTable(null, List.of(
            List.of("Name", "Tools"),
            List.of("Version", "1.2.0")));

        assertThat(table).containsExactly(
            "| Name    | Tools |",
            "| Version | 1.2.0 |");
    }

    @Test
    void asTable_cellWithPipeAndNewline_isEscaped() {
        List<String> table = exporter.asTable(null, List.of(List.of("a|b", "one\ntwo")));

        assertThat(table).containsExactly("| a\\vert{}b | one two |");
    }

    @Test
    void tableRanges_surroundedByText_findsEachTable() {
        List<String> lines = new ArrayList<>();
        lines.add("text");
        lines.addAll(exporter.asTable(null, List.of(List.of("k", "v"))));
        lines.add("");
        lines.addAll(exporter.asTable(List.of("h"), List.of(List.of("1"), List.of("2"))));

        assertThat(exporter.tableRanges(lines)).containsExactly(new TableRange(1, 2), new TableRange(3, 7));
    }

    @Test
    void asCode_orgSyntaxInCode_isCommaEscaped() {
        List<String> code = exporter.asCode("* not a heading\n#+begin_src\n\tindented\nplain", "python", 4);

        assertThat(code).containsExactly(
            "#+begin_src python",
            ",* not a heading",
            ",#+begin_src",
            "    indented",
            "plain",
            "#+end_src");
    }

    @Test
    void asText_headingLikeLines_areIndented() {
        assertThat(exporter.asText(List.of("* Step one", "normal"))).containsExactly(" * Step one", "normal");
    }

    @Test
    void fileLink_siblingAndParentDirectories_areRelative() {
        Path from = Path.of("docs", "Scripts", "01_Walls.org");

        assertThat(exporter.fileLink(Path.of("docs", "Scripts", "02_Doors.org"), from, "02 Doors"))
            .isEqualTo("[[file:./02_Doors.org][02 Doors]]");
        assertThat(exporter.fileLink(Path.of("docs", "Packages", "Tools", "Tools.org"), from, "Tools [1.0]"))
            .isEqualTo("[[file:../Packages/Tools/Tools.org][Tools (1.0)]]");
    }

    @Test
    void urlLink_withoutLabel_isBareLink() {
        assertThat(exporter.urlLink("https://example.org", null)).isEqualTo("[[https://example.org]]");
        assertThat(exporter.urlLink("https://example.org", "Site")).isEqualTo("[[https://example.org][Site]]");
    }

    @Test
    void docHead_withSetupFile_emitsSetupLine() {
        OrgExporter withSetup = new OrgExporter("theme.setup");

        assertThat(withSetup.docHead()).containsExactly("#+setupfile: theme.setup");
        assertThat(exporter.docHead()).isEmpty();
        assertThat(exporter.title("01 Walls")).containsExactly("#+title: 01 Walls");
    }
}
