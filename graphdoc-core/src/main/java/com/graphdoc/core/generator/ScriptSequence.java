package com.graphdoc.core.generator;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Numbered scripts of a directory forming a workflow, e.g. {@code 01_Import.dyn},
 * {@code 02_Check.dyn}.
 *
 * <p>Development copies are never part of a sequence.
 */
public class ScriptSequence {

    private final List<GraphFile> scripts;

    public ScriptSequence(List<GraphFile> scripts) {
        this.scripts = scripts.stream()
            .filter(script -> FileUtils.startNumber(script.path()).isPresent())
            .filter(script -> !FileUtils.isDevelopmentCopy(script.path()))
            .toList();
    }

    /**
     * Script with the closest lower number in the same directory.
     *
     * @param script script of the sequence
     * @return previous script
     */
    public Optional<GraphFile> previous(GraphFile script) {
        return number(script).flatMap(number -> siblings(script).stream()
            .filter(other -> numberOf(other) < number)
            .max(Comparator.comparingInt(ScriptSequence::numberOf).thenComparing(GraphFile::fileStem)));
    }

    /**
     * Script with the closest higher number in the same directory.
     *
     * @param script script of the sequence
     * @return next script
     */
    public Optional<GraphFile> next(GraphFile script) {
        return number(script).flatMap(number -> siblings(script).stream()
            .filter(other -> numberOf(other) > number)
            .min(Comparator.comparingInt(ScriptSequence::numberOf).thenComparing(GraphFile::fileStem)));
    }

    private Optional<Integer> number(GraphFile script) {
        if (FileUtils.isDevelopmentCopy(script.path())) {
            return Optional.empty();
        }
        return FileUtils.startNumber(script.path());
    }

    private List<GraphFile> siblings(GraphFile script) {
        Path directory = script.path().toAbsolutePath().normalize().getParent();
        return scripts.stream()
            .filter(other -> Objects.equals(other.path().toAbsolutePath().normalize().getParent(), directory))
            .toList();
    }

    private static int numberOf(GraphFile script) {
        return FileUtils.startNumber(script.path()).orElse(Integer.MAX_VALUE);
    }
}
