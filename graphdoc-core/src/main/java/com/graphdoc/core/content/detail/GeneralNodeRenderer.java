package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.model.GraphNode;

import java.util.List;

/**
 * Catch-all renderer, always last.
 */
public class GeneralNodeRenderer implements NodeDetailRenderer {

    @Override
    public String name() {
        return "general";
    }

    @Override
    public boolean supports(GraphNode node) {
        return true;
    }

    @Override
    public List<InformationContent.Row> rows(GraphNode node) {
        return List.of();
    }
}
