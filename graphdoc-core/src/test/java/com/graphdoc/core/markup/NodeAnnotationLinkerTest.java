package com.graphdoc.core.markup;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static com.graphdoc.core.GraphFixtures.annotation;
import static com.graphdoc.core.GraphFixtures.group;
import static com.graphdoc.core.GraphFixtures.node;
import static com.graphdoc.core.GraphFixtures.script;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NodeAnnotationLinker}.
 */
class NodeAnnotationLinkerTest {

    private static final Path SCRIPT = Path.of("Scripts", "01_Walls.dyn");

    private NodeAnnotationLinker linker;

    @BeforeEach
    void setUp() {
        linker = new NodeAnnotationLinker();
    }

    @Test
    void nearestNode_annotationCloseToEitherNode_resolvesToThatNode() {
        // Given
        GraphNode left = node("n1", "Left", 0, 0);
        GraphNode right = node("n2", "Right", 10, 0);
        GraphFile file = script(SCRIPT, List.of(left, right));

        // When / Then
        assertThat(linker.nearestNode(file, annotation("a1", "[W] Check", 1, 0))).isEqualTo(left);
        assertThat(linker.nearestNode(file, annotation("a2", "[W] Check", 9, 0))).isEqualTo(right);
    }

    @Test
    void nearestNode_equidistantNodes_firstNodeWins() {
        GraphNode first = node("n1", "First", 0, 0);
        GraphNode second = node("n2", "Second", 10, 0);
        GraphFile file = script(SCRIPT, List.of(first, second));

        assertThat(linker.nearestNode(file, annotation("a1", "[W] Tie", 5, 0))).isEqualTo(first);
    }

    @Test
    void link_nodeMarkupWithoutNodes_throwsWithFileAndText() {
        GraphFile file = script(SCRIPT, List.of(), List.of(), List.of(annotation("a1", "[W] Orphan", 0, 0)), List.of());

        assertThatThrownBy(() -> linker.link(file))
            .isInstanceOf(UnresolvedAnnotationException.class)
            .hasMessageContaining("[W] Orphan")
            .hasMessageContaining("01_Walls.dyn")
            .satisfies(thrown -> {
                UnresolvedAnnotationException e = (UnresolvedAnnotationException) thrown;
                assertThat(e.getFile()).isEqualTo(SCRIPT);
                assertThat(e.getAnnotationText()).isEqualTo("[W] Orphan");
            });
    }

    @Test
    void link_headlineMarkupWithoutNodes_doesNotNeedNodes() {
        GraphFile file = script(SCRIPT, List.of(), List.of(), List.of(annotation("a1", "[D] About", 0, 0)), List.of());

        FileDocumentation documentation = linker.link(file);

        assertThat(documentation.sectionMarkups(Section.DESCRIPTION))
            .extracting(SectionMarkup::title)
            .containsExactly("About");
    }

    @Test
    void link_groupNodeMarkup_attachesToEveryExistingMember() {
        // Given
        GraphFile file = script(SCRIPT,
            List.of(node("n1", "A", 0, 0), node("n2", "B", 5, 5)),
            List.of(group("g1", "Export", "[W] Slow\nRuns for minutes", List.of("n1", "n2", "missing"))),
            List.of(),
            List.of());

        // When
        FileDocumentation documentation = linker.link(file);

        // Then
        assertThat(documentation.nodeMarkups("n1")).hasSize(1);
        assertThat(documentation.nodeMarkups("n2", Section.WARNINGS)).hasSize(1);
        assertThat(documentation.nodeMarkups("missing")).isEmpty();
        assertThat(documentation.linkedNodeIds(Section.WARNINGS)).containsExactly("n1", "n2");
    }

    @Test
    void link_headlineMarkups_areSortedByOrderHintWithUnorderedLast() {
        GraphFile file = script(SCRIPT, List.of(node("n1", "A", 0, 0)), List.of(),
            List.of(
                annotation("a1", "[T] Free", 0, 0),
                annotation("a2", "[T] 2 Second", 0, 0),
                annotation("a3", "[T] 1 First", 0, 0)),
            List.of());

        FileDocumentation documentation = linker.link(file);

        assertThat(documentation.sectionMarkups(Section.TUTORIAL))
            .extracting(SectionMarkup::title)
            .containsExactly("First", "Second", "Free");
    }

    @Test
    void link_textWithoutMarker_isIgnored() {
        GraphFile file = script(SCRIPT, List.of(), List.of(), List.of(annotation("a1", "plain note", 0, 0)), List.of());

        assertThat(linker.link(file).size()).isZero();
    }
}
