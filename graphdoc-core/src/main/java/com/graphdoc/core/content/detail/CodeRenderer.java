package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.content.RenderContext;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.NodeDetails;

import java.util.List;

/**
 * Any node carrying code. Must come after more specific code renderers.
 */
public class CodeRenderer implements NodeDetailRenderer {

    private final int indent;

    public CodeRenderer(int indent) {
        this.indent = indent;
    }

    @Override
    public String name() {
        return "code";
    }

    @Override
    public boolean supports(GraphNode node) {
        return node.details() instanceof NodeDetails.Code;
    }

    @Override
    public List<InformationContent.Row> rows(GraphNode node) {
        NodeDetails.Code code = (NodeDetails.Code) node.details();
        return List.of(new InformationContent.Row("Lines", String.valueOf(code.code().lines().count())));
    }

    @Override
    public List<String> extra(GraphNode node, RenderContext context) {
        NodeDetails.Code code = (NodeDetails.Code) node.details();
        if (code.code().isBlank()) {
            return List.of();
        }
        return context.exporter().asCode(code.code(), code.language(), indent);
    }
}
