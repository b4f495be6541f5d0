package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.content.RenderContext;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.NodeDetails;

import java.util.List;

/**
 * Python script nodes: engine row and the script source.
 */
public class PythonScriptRenderer implements NodeDetailRenderer {

    private final int indent;

    public PythonScriptRenderer(int indent) {
        this.indent = indent;
    }

    @Override
    public String name() {
        return "python";
    }

    @Override
    public boolean supports(GraphNode node) {
        return node.details() instanceof NodeDetails.PythonScript;
    }

    @Override
    public List<InformationContent.Row> rows(GraphNode node) {
        NodeDetails.PythonScript python = (NodeDetails.PythonScript) node.details();
        return List.of(new InformationContent.Row("Engine", python.engine()));
    }

    @Override
    public List<String> extra(GraphNode node, RenderContext context) {
        NodeDetails.PythonScript python = (NodeDetails.PythonScript) node.details();
        if (python.code().isBlank()) {
            return List.of();
        }
        return context.exporter().asCode(python.code(), python.language(), indent);
    }
}
