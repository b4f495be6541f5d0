package com.graphdoc.core.generator;

import com.graphdoc.core.model.GraphFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static com.graphdoc.core.GraphFixtures.script;
import static org.assertj.core.api.Assertions.assertThat;

class ScriptSequenceTest {

    private static final Path DIR = Path.of("/models/Scripts/Walls");

    private final GraphFile importScript = script(DIR.resolve("01_Import.dyn"), List.of());
    private final GraphFile devScript = script(DIR.resolve("02_dev_Walls.dyn"), List.of());
    private final GraphFile wallsScript = script(DIR.resolve("03_Walls.dyn"), List.of());
    private final GraphFile exportScript = script(DIR.resolve("05 Export.dyn"), List.of());
    private final GraphFile otherDir = script(Path.of("/models/Scripts/Roofs/04_Roofs.dyn"), List.of());
    private final GraphFile unnumbered = script(DIR.resolve("Cleanup.dyn"), List.of());

    private final ScriptSequence sequence = new ScriptSequence(
        List.of(exportScript, wallsScript, devScript, otherDir, importScript, unnumbered));

    @Test
    void previousAndNext_skipDevelopmentCopies() {
        assertThat(sequence.previous(wallsScript)).contains(importScript);
        assertThat(sequence.next(importScript)).contains(wallsScript);
    }

    @Test
    void next_acceptsSpaceSeparatedNumbers() {
        assertThat(sequence.next(wallsScript)).contains(exportScript);
        assertThat(sequence.previous(exportScript)).contains(wallsScript);
    }

    @Test
    void previousAndNext_stayInTheSameDirectory() {
        assertThat(sequence.previous(otherDir)).isEmpty();
        assertThat(sequence.next(otherDir)).isEmpty();
    }

    @Test
    void previousAndNext_atTheEnds_areEmpty() {
        assertThat(sequence.previous(importScript)).isEmpty();
        assertThat(sequence.next(exportScript)).isEmpty();
    }

    @Test
    void unnumberedAndDevelopmentScripts_haveNoNeighbours() {
        assertThat(sequence.previous(unnumbered)).isEmpty();
        assertThat(sequence.next(devScript)).isEmpty();
    }
}
