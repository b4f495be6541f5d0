package com.graphdoc.core.generator;

import com.graphdoc.core.content.CategoryContent;
import com.graphdoc.core.content.ContentDocument;
import com.graphdoc.core.content.ContentNode;
import com.graphdoc.core.content.DependencyContent;
import com.graphdoc.core.content.GroupContent;
import com.graphdoc.core.content.HeadingText;
import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.content.ItemContent;
import com.graphdoc.core.content.ListingContent;
import com.graphdoc.core.content.ManualMode;
import com.graphdoc.core.content.NodeDetailContent;
import com.graphdoc.core.content.NodeLinkContent;
import com.graphdoc.core.content.RenderContext;
import com.graphdoc.core.content.SectionContent;
import com.graphdoc.core.content.TitleContent;
import com.graphdoc.core.content.detail.NodeDetailRenderers;
import com.graphdoc.core.content.merge.ManualCleanup;
import com.graphdoc.core.markup.Section;
import com.graphdoc.core.model.Dependency;
import com.graphdoc.core.model.ExternalDependency;
import com.graphdoc.core.model.FileType;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.model.NodeCategory;
import com.graphdoc.core.model.NodeKind;
import com.graphdoc.core.model.PackageDependency;
import com.graphdoc.core.util.FileUtils;
import com.graphdoc.core.util.TextLines;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Content trees of the three document types.
 *
 * <p><b>Script:</b>
 * <pre>{@code
 * #+title: <script>
 * * Tutorial
 * ** Problem / Solution
 * ** Files
 * ** Input
 * ** Output
 * * Source Code
 * ** Python Nodes
 * ** Code Blocks
 * * Information
 * ** Description
 * ** Warnings
 * ** Dependencies
 * *** Packages
 * *** External
 * }</pre>
 *
 * <p>Custom nodes use the source code and information parts. Packages list their custom
 * nodes by category.
 */
public class DocumentLayouts {

    private static final Set<NodeKind> PATH_KINDS = EnumSet.of(NodeKind.FILE_PATH, NodeKind.DIRECTORY_PATH);

    private final NodeDetailRenderers renderers;
    private final boolean withCodeBlocks;

    public DocumentLayouts(NodeDetailRenderers renderers, boolean withCodeBlocks) {
        this.renderers = Objects.requireNonNull(renderers, "renderers must not be null");
        this.withCodeBlocks = withCodeBlocks;
    }

    /**
     * Layout of a script document.
     *
     * @param script script model
     * @param previousDocument document of the previous script of the sequence
     * @param nextDocument document of the next script of the sequence
     * @return content document
     */
    public ContentDocument script(GraphFile script, Optional<Path> previousDocument, Optional<Path> nextDocument) {
        requireType(script, FileType.SCRIPT);

        ContentNode tutorial = new SectionContent(Section.TUTORIAL, List.of(
            new SectionContent(Section.SOLUTION, List.of()),
            filesSection(script),
            sequenceSection(script, Section.INPUT, previousDocument, "Previous script"),
            sequenceSection(script, Section.OUTPUT, nextDocument, "Next script")
        ));

        return new ContentDocument(List.of(
            title(),
            tutorial,
            sourceCode(),
            information(false)
        ));
    }

    /**
     * Layout of a custom node document.
     *
     * @param customNode custom node model
     * @return content document
     */
    public ContentDocument customNode(GraphFile customNode) {
        requireType(customNode, FileType.CUSTOM_NODE);
        return new ContentDocument(List.of(
            title(),
            sourceCode(),
            information(true)
        ));
    }

    /**
     * Layout of a package document.
     *
     * @param customNodeDocuments document path of each custom node
     * @return content document
     */
    public ContentDocument graphPackage(Function<GraphFile, Path> customNodeDocuments) {
        ContentNode description = new SectionContent(Section.DESCRIPTION,
            context -> context.exporter().asText(splitLines(context.model(GraphPackage.class).description())),
            ManualMode.FALLBACK, Set.of(), List.of());

        ContentNode information = new InformationContent("Information", context -> {
            GraphPackage model = context.model(GraphPackage.class);
            return List.of(
                new InformationContent.Row("Name", model.name()),
                new InformationContent.Row("Version", model.info().version()),
                new InformationContent.Row("Engine", model.info().engineVersion()),
                new InformationContent.Row("License", model.info().license()),
                new InformationContent.Row("Group", model.info().group()),
                new InformationContent.Row("Keywords", String.join(", ", model.info().keywords())),
                new InformationContent.Row("Homepage", url(context, model.info().siteUrl())),
                new InformationContent.Row("Repository", url(context, model.info().repositoryUrl())),
                new InformationContent.Row("Custom nodes", String.valueOf(model.customNodes().size())));
        }, List.of(description));

        ContentNode nodeDocumentation = new ListingContent<NodeCategory>("Node Documentation",
            context -> context.model(GraphPackage.class).categories(),
            category -> new CategoryContent(customNodeDocuments));

        return new ContentDocument(List.of(
            new TitleContent(context -> HeadingText.displayName(context.model(GraphPackage.class).name(), "Package")),
            information,
            nodeDocumentation
        ));
    }

    private ContentNode title() {
        return new TitleContent(context -> {
            GraphFile file = context.model(GraphFile.class);
            return HeadingText.displayName(file.fileStem(), file.name());
        });
    }

    private ContentNode filesSection(GraphFile script) {
        NodeDetailContent pathContent = new NodeDetailContent(renderers, true, ManualMode.APPEND,
            Set.of(ManualCleanup.STRIP_FIRST_TABLE));
        List<ContentNode> items = script.nodesOf(PATH_KINDS).stream()
            .map(node -> (ContentNode) new ItemContent(pathContent, node))
            .toList();
        return new SectionContent(Section.FILES, items);
    }

    private ContentNode sequenceSection(GraphFile script, Section section, Optional<Path> linkedDocument, String label) {
        NodeDetailContent detail = new NodeDetailContent(renderers);
        NodeLinkContent link = new NodeLinkContent();
        List<ContentNode> items = script.nodes().stream()
            .filter(node -> section.belongs(script, node))
            .sorted(Comparator.comparing(GraphNode::name).thenComparing(GraphNode::id))
            .map(node -> (ContentNode) new ItemContent(isDocumentedElsewhere(node) ? link : detail, node))
            .toList();

        Function<RenderContext, List<String>> body = context -> linkedDocument
            .map(document -> List.of(label + ": " + context.exporter().fileLink(
                document, context.docFile().destination(), HeadingText.displayName(
                    FileUtils.getStem(document), label))))
            .orElse(List.of());

        BiPredicate<RenderContext, String> previousLink = (context, line) -> line.startsWith(label + ": ")
            && !context.exporter().linkIndexes(List.of(line)).isEmpty();
        return new SectionContent(section, body, ManualMode.APPEND, Set.of(), items, previousLink);
    }

    private ContentNode sourceCode() {
        List<ContentNode> listings = new ArrayList<>();
        listings.add(new ListingContent<GraphNode>("Python Nodes",
            context -> context.model(GraphFile.class).nodesOf(NodeKind.PYTHON_SCRIPT),
            node -> new NodeDetailContent(renderers)));
        if (withCodeBlocks) {
            listings.add(new ListingContent<GraphNode>("Code Blocks",
                context -> context.model(GraphFile.class).nodesOf(NodeKind.CODE_BLOCK),
                node -> new NodeDetailContent(renderers)));
        }
        return new GroupContent("Source Code", true, listings);
    }

    private ContentNode information(boolean customNode) {
        ContentNode description = new SectionContent(Section.DESCRIPTION,
            context -> context.exporter().asText(splitLines(context.model(GraphFile.class).description())),
            ManualMode.FALLBACK, Set.of(), List.of());

        ContentNode warnings = new ListingContent<GraphNode>(Section.WARNINGS.title(),
            context -> {
                GraphFile file = context.model(GraphFile.class);
                Set<String> linked = context.documentation().linkedNodeIds(Section.WARNINGS);
                return file.nodes().stream()
                    .filter(node -> linked.contains(node.id()))
                    .filter(node -> Section.WARNINGS.belongs(file, node))
                    .toList();
            },
            node -> new NodeDetailContent(renderers, false, ManualMode.FALLBACK, Set.of()));

        ContentNode dependencies = new GroupContent("Dependencies", true, List.of(
            new ListingContent<Dependency>("Packages",
                context -> List.copyOf(context.model(GraphFile.class).dependenciesOf(PackageDependency.class)),
                dependency -> new DependencyContent()),
            new ListingContent<Dependency>("External Dependencies",
                context -> List.copyOf(context.model(GraphFile.class).dependenciesOf(ExternalDependency.class)),
                dependency -> new DependencyContent())
        ));

        return new InformationContent("Information", context -> {
            GraphFile file = context.model(GraphFile.class);
            List<InformationContent.Row> rows = new ArrayList<>();
            rows.add(new InformationContent.Row("UUID", file.uuid()));
            rows.add(new InformationContent.Row("Host version", file.hostVersion()));
            if (customNode) {
                rows.add(new InformationContent.Row("Category", file.category()));
            }
            rows.add(new InformationContent.Row("File", file.path().getFileName().toString()));
            return rows;
        }, List.of(description, warnings, dependencies));
    }

    private boolean isDocumentedElsewhere(GraphNode node) {
        return node.kind() == NodeKind.PYTHON_SCRIPT
            || (withCodeBlocks && node.kind() == NodeKind.CODE_BLOCK)
            || PATH_KINDS.contains(node.kind());
    }

    private static String url(RenderContext context, String url) {
        return url == null || url.isBlank() ? null : context.exporter().urlLink(url.trim(), null);
    }

    private static List<String> splitLines(String text) {
        return TextLines.split(text);
    }

    private static void requireType(GraphFile file, FileType type) {
        if (file.type() != type) {
            throw new IllegalArgumentException("Expected " + type + " but got " + file.type() + ": " + file.path());
        }
    }
}
