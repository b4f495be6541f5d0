package com.graphdoc.core.content.merge;

import com.graphdoc.core.export.impl.OrgExporter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExistingContentExtractor}.
 */
class ExistingContentExtractorTest {

    private final ExistingContentExtractor extractor = new ExistingContentExtractor(new OrgExporter());

    @Test
    void extract_headingPresent_returnsBlockUntilNextHeading() {
        List<String> previous = List.of(
            "#+title: Walls",
            "",
            "* Heading X",
            "",
            "Author's hand-written paragraph",
            "",
            "* Heading Y",
            "",
            "Other text");

        Optional<ExistingBlock> block = extractor.extract(previous, "* Heading X");

        assertThat(block).isPresent();
        assertThat(block.get().block()).containsExactly("", "Author's hand-written paragraph", "");
        assertThat(block.get().remainder()).containsExactly("* Heading Y", "", "Other text");
    }

    @Test
    void extract_deeperHeadingEndsBlock() {
        List<String> previous = List.of("* Parent", "text", "** Child", "child text");

        Optional<ExistingBlock> block = extractor.extract(previous, "* Parent");

        assertThat(block).isPresent();
        assertThat(block.get().block()).containsExactly("text");
    }

    @Test
    void extract_trailingWhitespace_isIgnoredForMatching() {
        Optional<ExistingBlock> block = extractor.extract(List.of("* Heading X   ", "kept"), "* Heading X");

        assertThat(block).isPresent();
        assertThat(block.get().block()).containsExactly("kept");
    }

    @Test
    void extract_headingAbsent_returnsEmpty() {
        assertThat(extractor.extract(List.of("* Other", "text"), "* Heading X")).isEmpty();
        assertThat(extractor.extract(List.of(), "* Heading X")).isEmpty();
    }

    @Test
    void extract_sameHeadingTwice_usesFirst() {
        List<String> previous = List.of("** Node", "first", "* Next", "** Node", "second");

        assertThat(extractor.extract(previous, "** Node").orElseThrow().block()).containsExactly("first");
    }
}
