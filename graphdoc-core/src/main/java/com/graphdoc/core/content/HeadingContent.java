package com.graphdoc.core.content;

import com.graphdoc.core.content.merge.ExistingBlock;
import com.graphdoc.core.content.merge.ManualCleanup;
import com.graphdoc.core.util.TextLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base class of all nodes rendered under a heading.
 *
 * <p>Renders a blank separator, the heading, the body and the children one level deeper.
 * The body is the model content combined with the text found under the same heading in
 * the previous run, as selected by {@link #manualMode()}.
 *
 * <p><b>Rendered shape:</b>
 * <pre>{@code
 *
 * ** Heading
 *
 * body line
 *
 * *** Child heading
 * }</pre>
 *
 * <p>Optional headings disappear when neither their model body nor any child has content.
 * Mandatory headings are always rendered so authors always find a place to write.
 */
public abstract class HeadingContent extends ContentNode {

    /**
     * Heading text before canonicalization.
     *
     * @param context render context
     * @return heading text
     */
    protected abstract String headingText(RenderContext context);

    /**
     * Content computed from the model.
     *
     * @param context render context
     * @return body lines, empty if the model has nothing to say
     */
    protected List<String> body(RenderContext context) {
        return List.of();
    }

    /**
     * Child nodes rendered one level deeper.
     *
     * @param context render context
     * @return children in render order
     */
    protected List<ContentNode> children(RenderContext context) {
        return List.of();
    }

    protected ManualMode manualMode() {
        return ManualMode.FALLBACK;
    }

    protected Set<ManualCleanup> manualCleanups() {
        return Set.of();
    }

    /**
     * Returns whether a line of the previous block was generated by this heading. The first
     * such line is dropped before the block is recovered as manual text.
     *
     * @param context render context
     * @param line previous line
     * @return true for a regenerated line
     */
    protected boolean isRegeneratedLine(RenderContext context, String line) {
        return false;
    }

    /**
     * Returns whether the heading is suppressed when it has nothing to render.
     *
     * @return true for optional headings
     */
    protected boolean isOptional() {
        return false;
    }

    /**
     * Fallback used when the heading text is blank.
     *
     * @return fallback heading text
     */
    protected String defaultHeading() {
        return "Untitled";
    }

    @Override
    public boolean hasContent(RenderContext context) {
        if (!isOptional()) {
            return true;
        }
        if (!TextLines.isBlank(body(context))) {
            return true;
        }
        return children(context).stream().anyMatch(child -> child.hasContent(context));
    }

    @Override
    public List<String> render(int level, RenderContext context) {
        if (!hasContent(context)) {
            return List.of();
        }

        String headingLine = context.exporter().heading(heading(context), level);
        Optional<ExistingBlock> existing = context.existingBlock(headingLine);
        List<String> previousBlock = existing.map(ExistingBlock::block).orElse(List.of());

        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add(headingLine);

        List<String> bodyLines = mergedBody(context, previousBlock);
        if (!bodyLines.isEmpty()) {
            lines.add("");
            lines.addAll(bodyLines);
        }

        RenderContext childContext = context.withScope(
            existing.map(ExistingBlock::remainder).orElse(context.docFile().previousLines()));
        for (ContentNode child : children(context)) {
            lines.addAll(child.render(level + 1, childContext));
        }
        return lines;
    }

    @Override
    public Optional<String> renderedHeading(RenderContext context) {
        return hasContent(context) ? Optional.of(heading(context)) : Optional.empty();
    }

    /**
     * Canonical heading text, the merge key between runs.
     *
     * @param context render context
     * @return heading text
     */
    public String heading(RenderContext context) {
        return HeadingText.canonical(headingText(context), defaultHeading());
    }

    private List<String> mergedBody(RenderContext context, List<String> previousBlock) {
        List<String> model = TextLines.stripBlank(body(context));
        List<String> previous = withoutRegeneratedLine(context, previousBlock);
        if (model.isEmpty()) {
            return context.manualDocs().recover(previous, manualCleanups());
        }
        return manualMode() == ManualMode.APPEND
            ? append(model, context.manualDocs().recoverOrEmpty(previous, manualCleanups()))
            : model;
    }

    private List<String> withoutRegeneratedLine(RenderContext context, List<String> previousBlock) {
        for (int index = 0; index < previousBlock.size(); index++) {
            if (isRegeneratedLine(context, previousBlock.get(index))) {
                List<String> lines = new ArrayList<>(previousBlock);
                lines.remove(index);
                return lines;
            }
        }
        return previousBlock;
    }

    private static List<String> append(List<String> model, List<String> manual) {
        if (manual.isEmpty()) {
            return model;
        }
        List<String> combined = new ArrayList<>(model);
        if (!combined.isEmpty()) {
            combined.add("");
        }
        combined.addAll(manual);
        return combined;
    }
}
