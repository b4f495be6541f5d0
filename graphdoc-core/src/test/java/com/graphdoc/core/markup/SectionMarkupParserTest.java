package com.graphdoc.core.markup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SectionMarkupParser}.
 */
class SectionMarkupParserTest {

    private SectionMarkupParser parser;

    @BeforeEach
    void setUp() {
        parser = new SectionMarkupParser();
    }

    @Test
    void parse_markerLine_returnsSectionWithTitleAndBody() {
        Optional<SectionMarkup> markup = parser.parse("[D] Purpose\nCreates walls.\nUses model lines.", "a1");

        assertThat(markup).isPresent();
        assertThat(markup.get().section()).isEqualTo(Section.DESCRIPTION);
        assertThat(markup.get().title()).isEqualTo("Purpose");
        assertThat(markup.get().body()).containsExactly("Creates walls.", "Uses model lines.");
        assertThat(markup.get().sourceId()).isEqualTo("a1");
        assertThat(markup.get().hasOrder()).isFalse();
    }

    @Test
    void parse_textBeforeMarker_isDiscarded() {
        Optional<SectionMarkup> markup = parser.parse("Group title\n\n[T] Steps\nSelect the lines", "g1");

        assertThat(markup).isPresent();
        assertThat(markup.get().section()).isEqualTo(Section.TUTORIAL);
        assertThat(markup.get().body()).containsExactly("Select the lines");
    }

    @Test
    void parse_multipleMarkers_firstMarkerWins() {
        Optional<SectionMarkup> markup = parser.parse("[W] Careful\n[D] Not a new section");

        assertThat(markup).isPresent();
        assertThat(markup.get().section()).isEqualTo(Section.WARNINGS);
        assertThat(markup.get().body()).containsExactly("[D] Not a new section");
    }

    @Test
    void parse_orderHint_isParsedAndRemovedFromTitle() {
        Optional<SectionMarkup> markup = parser.parse("[T] 2 Second step\nbody");

        assertThat(markup).isPresent();
        assertThat(markup.get().order()).isEqualTo(2);
        assertThat(markup.get().title()).isEqualTo("Second step");
    }

    @Test
    void parse_orderHintWithoutTitle_leavesTitleEmpty() {
        Optional<SectionMarkup> markup = parser.parse("[T] 3");

        assertThat(markup).isPresent();
        assertThat(markup.get().order()).isEqualTo(3);
        assertThat(markup.get().title()).isEmpty();
        assertThat(markup.get().body()).isEmpty();
    }

    @Test
    void parse_blankLinesAroundBody_areStripped() {
        Optional<SectionMarkup> markup = parser.parse("[P]\n\n  \nFirst\n\nSecond\n\n");

        assertThat(markup).isPresent();
        assertThat(markup.get().body()).containsExactly("First", "", "Second");
    }

    @Test
    void parse_withoutMarker_returnsEmpty() {
        assertThat(parser.parse("Just a note next to a node")).isEmpty();
    }

    @Test
    void parse_nullOrBlank_returnsEmpty() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
    }

    @Test
    void parse_indentedMarker_isRecognized() {
        Optional<SectionMarkup> markup = parser.parse("   [I] Level");

        assertThat(markup).isPresent();
        assertThat(markup.get().section()).isEqualTo(Section.INPUT);
        assertThat(markup.get().title()).isEqualTo("Level");
    }
}
