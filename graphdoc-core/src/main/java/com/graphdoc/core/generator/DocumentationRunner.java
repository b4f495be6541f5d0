package com.graphdoc.core.generator;

import com.graphdoc.core.config.GraphDocConfig;
import com.graphdoc.core.content.ContentDocument;
import com.graphdoc.core.content.RenderContext;
import com.graphdoc.core.content.ValueFormatter;
import com.graphdoc.core.content.detail.NodeDetailRenderers;
import com.graphdoc.core.content.merge.ManualDocs;
import com.graphdoc.core.export.DocExporter;
import com.graphdoc.core.export.impl.OrgExporter;
import com.graphdoc.core.locator.DocFile;
import com.graphdoc.core.locator.DocFileLocator;
import com.graphdoc.core.locator.impl.MirroredDocFileLocator;
import com.graphdoc.core.markup.FileDocumentation;
import com.graphdoc.core.markup.NodeAnnotationLinker;
import com.graphdoc.core.markup.UnresolvedAnnotationException;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Writes the documentation of a whole source tree.
 *
 * <p>Every document is processed on the calling thread: its previous text is read, its
 * content tree rendered against that text and the result written back. A file whose
 * annotations cannot be resolved, or whose document cannot be read or written, is
 * reported as failed; the remaining files are still processed and the failed document
 * is left untouched.
 *
 * <p>After all documents are written, documents below the documentation roots that were
 * not produced by this run are deleted together with empty directories.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * DocumentationRunner runner = DocumentationRunner.fromConfig(config);
 * GenerationReport report = runner.generate(scripts, packages);
 * }</pre>
 */
public class DocumentationRunner {

    private static final Logger log = LoggerFactory.getLogger(DocumentationRunner.class);

    private final DocFileLocator locator;
    private final DocExporter exporter;
    private final ManualDocs manualDocs;
    private final ValueFormatter values;
    private final NodeAnnotationLinker linker;
    private final DocumentLayouts layouts;

    public DocumentationRunner(DocFileLocator locator, DocExporter exporter, ManualDocs manualDocs,
                               ValueFormatter values, NodeAnnotationLinker linker, DocumentLayouts layouts) {
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        this.manualDocs = Objects.requireNonNull(manualDocs, "manualDocs must not be null");
        this.values = Objects.requireNonNull(values, "values must not be null");
        this.linker = Objects.requireNonNull(linker, "linker must not be null");
        this.layouts = Objects.requireNonNull(layouts, "layouts must not be null");
    }

    /**
     * Creates a runner writing Org documents as configured.
     *
     * @param config configuration
     * @return runner
     */
    public static DocumentationRunner fromConfig(GraphDocConfig config) {
        OrgExporter exporter = new OrgExporter(config.output().setupFile());
        GraphDocConfig.RenderingConfig rendering = config.rendering();
        DocFileLocator locator = new MirroredDocFileLocator(
            Paths.get(config.source().root()),
            Paths.get(config.output().directory()),
            config.source().scriptFolder(),
            config.source().packageFolder(),
            exporter.fileExtension());
        return new DocumentationRunner(
            locator,
            exporter,
            new ManualDocs(exporter, rendering.placeholder()),
            new ValueFormatter(rendering.trueValue(), rendering.falseValue(), rendering.defaultValue()),
            new NodeAnnotationLinker(),
            new DocumentLayouts(NodeDetailRenderers.defaults(), rendering.withCodeBlocks()));
    }

    /**
     * Documents packages, their custom nodes and scripts, then removes stale documents.
     *
     * @param scripts scripts to document
     * @param packages packages to document
     * @return run outcome
     */
    public GenerationReport generate(List<GraphFile> scripts, List<GraphPackage> packages) {
        log.info("Generating documentation for {} scripts and {} packages", scripts.size(), packages.size());

        List<Path> written = new ArrayList<>();
        List<GenerationReport.Failure> failures = new ArrayList<>();
        Set<Path> produced = new HashSet<>();
        Map<Path, Path> sources = new HashMap<>();

        for (GraphPackage graphPackage : packages) {
            Path packageDocument = locator.packageDestination(graphPackage);
            process(graphPackage.path(), new DocFile<>(graphPackage, packageDocument, locator), sources, produced,
                written, failures, docFile -> {
                    ContentDocument layout = layouts.graphPackage(
                        node -> locator.customNodeDestination(node, graphPackage));
                    return render(docFile, layout, FileDocumentation.empty());
                });

            for (GraphFile customNode : graphPackage.customNodes()) {
                Path destination = locator.customNodeDestination(customNode, graphPackage);
                process(customNode.path(), new DocFile<>(customNode, destination, locator), sources, produced,
                    written, failures,
                    docFile -> render(docFile, layouts.customNode(customNode), linker.link(customNode)));
            }
        }

        ScriptSequence sequence = new ScriptSequence(scripts);
        for (GraphFile script : scripts) {
            Path destination = locator.destinationPath(script.path());
            process(script.path(), new DocFile<>(script, destination, locator), sources, produced, written, failures,
                docFile -> {
                    Optional<Path> previous = sequence.previous(script)
                        .map(other -> locator.destinationPath(other.path()));
                    Optional<Path> next = sequence.next(script).map(other -> locator.destinationPath(other.path()));
                    return render(docFile, layouts.script(script, previous, next), linker.link(script));
                });
        }

        List<Path> deleted = deleteStaleDocuments(produced);

        GenerationReport report = new GenerationReport(written, failures, deleted);
        log.info("Wrote {} documents, {} failed, {} stale documents deleted",
            report.written().size(), report.failures().size(), report.deleted().size());
        return report;
    }

    /**
     * Renders one document against its previous text.
     *
     * @param docFile document
     * @param layout content tree
     * @param documentation markup linked to the model
     * @return document lines
     */
    List<String> render(DocFile<?> docFile, ContentDocument layout, FileDocumentation documentation) {
        RenderContext context = RenderContext.root(docFile, exporter, manualDocs, values, documentation);
        return layout.render(context);
    }

    private void process(Path source, DocFile<?> docFile, Map<Path, Path> sources, Set<Path> produced,
                         List<Path> written, List<GenerationReport.Failure> failures,
                         Function<DocFile<?>, List<String>> renderer) {
        Path destination = docFile.destination();
        Path normalized = destination.toAbsolutePath().normalize();
        // Claimed before rendering so a failed document is not deleted as stale.
        produced.add(normalized);

        Path previousSource = sources.putIfAbsent(normalized, source);
        if (previousSource != null) {
            log.error("Skipping {}: document {} is already generated from {}", source, destination, previousSource);
            failures.add(new GenerationReport.Failure(source, "Duplicate destination " + destination
                + " (already generated from " + previousSource + ")"));
            return;
        }

        try {
            docFile.write(renderer.apply(docFile));
            written.add(destination);
        } catch (UnresolvedAnnotationException e) {
            log.error("Failed to document {}: {}", source, e.getMessage());
            failures.add(new GenerationReport.Failure(source, e.getMessage()));
        } catch (UncheckedIOException e) {
            log.error("Failed to document {}: {}", source, e.getMessage(), e);
            failures.add(new GenerationReport.Failure(source, e.getMessage()));
        }
    }

    private List<Path> deleteStaleDocuments(Set<Path> produced) {
        List<Path> deleted = new ArrayList<>();
        for (Path document : locator.listDocuments()) {
            if (produced.contains(document.toAbsolutePath().normalize())) {
                continue;
            }
            try {
                Files.deleteIfExists(document);
                deleted.add(document);
                log.info("Deleted stale document: {}", document);
            } catch (IOException e) {
                log.warn("Failed to delete stale document {}: {}", document, e.getMessage());
            }
        }

        for (Path root : locator.documentRoots()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try {
                int removed = FileUtils.deleteEmptyDirectories(root);
                log.debug("Removed {} empty directories below {}", removed, root);
            } catch (IOException e) {
                log.warn("Failed to remove empty directories below {}: {}", root, e.getMessage());
            }
        }
        return deleted;
    }
}
