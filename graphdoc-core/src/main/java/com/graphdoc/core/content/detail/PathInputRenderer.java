package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.NodeDetails;

import java.util.List;

/**
 * File and directory inputs.
 */
public class PathInputRenderer implements NodeDetailRenderer {

    @Override
    public String name() {
        return "path";
    }

    @Override
    public boolean supports(GraphNode node) {
        return node.details() instanceof NodeDetails.PathInput;
    }

    @Override
    public List<InformationContent.Row> rows(GraphNode node) {
        NodeDetails.PathInput path = (NodeDetails.PathInput) node.details();
        return List.of(
            new InformationContent.Row("Type", path.directory() ? "Directory" : "File"),
            new InformationContent.Row("Path", path.path()));
    }
}
