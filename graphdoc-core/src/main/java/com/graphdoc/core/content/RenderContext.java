package com.graphdoc.core.content;

import com.graphdoc.core.content.merge.ExistingBlock;
import com.graphdoc.core.content.merge.ExistingContentExtractor;
import com.graphdoc.core.content.merge.ManualDocs;
import com.graphdoc.core.export.DocExporter;
import com.graphdoc.core.locator.DocFile;
import com.graphdoc.core.markup.FileDocumentation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State handed down the content tree while rendering one document.
 *
 * <p>{@code scope} is the part of the previous document below the parent heading; a node
 * looks for its own heading there first and in the whole previous document second.
 * {@code item} is the current list entry (node, dependency, category) of a listing.
 *
 * @param docFile document being rendered
 * @param exporter format backend
 * @param manualDocs manual text recovery
 * @param values cell value formatter
 * @param documentation markup linked to the file, empty for packages
 * @param scope previous lines below the parent heading
 * @param item current listing item, may be null
 */
public record RenderContext(
    DocFile<?> docFile,
    DocExporter exporter,
    ManualDocs manualDocs,
    ValueFormatter values,
    FileDocumentation documentation,
    List<String> scope,
    Object item
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(docFile, "docFile must not be null");
        Objects.requireNonNull(exporter, "exporter must not be null");
        Objects.requireNonNull(manualDocs, "manualDocs must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (documentation == null) {
            documentation = FileDocumentation.empty();
        }
        scope = scope == null ? docFile.previousLines() : scope;
    }

    /**
     * Creates the root context of a document.
     *
     * @param docFile document being rendered
     * @param exporter format backend
     * @param manualDocs manual text recovery
     * @param values cell value formatter
     * @param documentation linked markup
     * @return root context
     */
    public static RenderContext root(DocFile<?> docFile, DocExporter exporter, ManualDocs manualDocs,
                                     ValueFormatter values, FileDocumentation documentation) {
        return new RenderContext(docFile, exporter, manualDocs, values, documentation, null, null);
    }

    public RenderContext withScope(List<String> newScope) {
        return new RenderContext(docFile, exporter, manualDocs, values, documentation, newScope, item);
    }

    public RenderContext withItem(Object newItem) {
        return new RenderContext(docFile, exporter, manualDocs, values, documentation, scope, newItem);
    }

    /**
     * Returns the current listing item.
     *
     * @param type expected item type
     * @param <T> item type
     * @return item
     * @throws IllegalStateException if no item of that type is set
     */
    public <T> T require(Class<T> type) {
        if (!type.isInstance(item)) {
            throw new IllegalStateException("Expected current item of type " + type.getSimpleName()
                + " but got " + (item == null ? "none" : item.getClass().getSimpleName()) + " in " + docFile);
        }
        return type.cast(item);
    }

    /**
     * Returns the model of the document.
     *
     * @param type expected model type
     * @param <T> model type
     * @return model
     * @throws IllegalStateException if the document renders another model type
     */
    public <T> T model(Class<T> type) {
        Object model = docFile.model();
        if (!type.isInstance(model)) {
            throw new IllegalStateException("Expected document model of type " + type.getSimpleName()
                + " but got " + model.getClass().getSimpleName());
        }
        return type.cast(model);
    }

    /**
     * Finds the previous block under a heading, in scope first, then in the whole document.
     *
     * @param headingLine rendered heading line
     * @return previous block
     */
    public Optional<ExistingBlock> existingBlock(String headingLine) {
        ExistingContentExtractor extractor = new ExistingContentExtractor(exporter);
        Optional<ExistingBlock> scoped = extractor.extract(scope, headingLine);
        if (scoped.isPresent()) {
            return scoped;
        }
        return extractor.extract(docFile.previousLines(), headingLine);
    }
}
