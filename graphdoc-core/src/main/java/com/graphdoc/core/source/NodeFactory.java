package com.graphdoc.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.graphdoc.core.model.NodeDetails;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Matcher and builder of one node variant.
 *
 * <p>Factories are tried in list order and the first match wins, so the order of
 * {@link #defaults()} is significant: more specific matchers come first and the general
 * factory, matching every node, comes last.
 *
 * @param name variant name, used in log messages
 * @param matcher decides whether the merged node JSON is of this variant
 * @param details builds the variant details from the merged node JSON
 */
public record NodeFactory(String name, Predicate<JsonNode> matcher, Function<JsonNode, NodeDetails> details) {

    static final String CUSTOM_FUNCTION_TYPE = "Dynamo.Graph.Nodes.CustomNodes.Function, DynamoCore";
    static final String PYTHON_TYPE = "PythonNodeModels.PythonNode, PythonNodeModels";
    static final String FILE_TYPE = "CoreNodeModels.Input.Filename, CoreNodeModels";
    static final String DIRECTORY_TYPE = "CoreNodeModels.Input.Directory, CoreNodeModels";
    static final String DEFAULT_PYTHON_ENGINE = "IronPython2";

    public NodeFactory {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(details, "details must not be null");
    }

    public boolean matches(JsonNode node) {
        return matcher.test(node);
    }

    /**
     * Factories in priority order: custom node reference, python script, code block,
     * file path, directory path, selection, input value, general.
     *
     * @return ordered factories
     */
    public static List<NodeFactory> defaults() {
        return List.of(
            new NodeFactory("custom",
                node -> CUSTOM_FUNCTION_TYPE.equals(text(node, "ConcreteType"))
                    && "FunctionNode".equals(text(node, "NodeType")),
                node -> new NodeDetails.CustomReference(text(node, "FunctionSignature"))),
            new NodeFactory("python",
                node -> "PythonScriptNode".equals(text(node, "NodeType"))
                    || PYTHON_TYPE.equals(text(node, "ConcreteType")),
                node -> new NodeDetails.PythonScript(text(node, "Code"),
                    isBlank(text(node, "Engine")) ? DEFAULT_PYTHON_ENGINE : text(node, "Engine"))),
            new NodeFactory("code block",
                node -> "CodeBlockNode".equals(text(node, "NodeType")),
                node -> new NodeDetails.CodeBlock(text(node, "Code"))),
            new NodeFactory("file",
                node -> FILE_TYPE.equals(text(node, "ConcreteType")),
                node -> new NodeDetails.PathInput(path(node), false)),
            new NodeFactory("directory",
                node -> DIRECTORY_TYPE.equals(text(node, "ConcreteType")),
                node -> new NodeDetails.PathInput(path(node), true)),
            new NodeFactory("selection",
                node -> "ExtensionNode".equals(text(node, "NodeType"))
                    && !isBlank(text(node, "SelectedString")),
                node -> new NodeDetails.Selection(text(node, "SelectedString"))),
            new NodeFactory("input value",
                node -> {
                    String nodeType = text(node, "NodeType");
                    return nodeType != null && nodeType.endsWith("InputNode") && !isBlank(text(node, "InputValue"));
                },
                node -> new NodeDetails.InputValue(text(node, "InputValue"))),
            new NodeFactory("general",
                node -> true,
                node -> new NodeDetails.General())
        );
    }

    private static String path(JsonNode node) {
        String hintPath = text(node, "HintPath");
        return isBlank(hintPath) ? text(node, "InputValue") : hintPath;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.isValueNode() ? null : value.asText();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
