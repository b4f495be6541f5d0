package com.graphdoc.core.model;

import java.util.Objects;

/**
 * Kind-specific payload of a {@link GraphNode}.
 *
 * <p>The variants form a closed set. Renderers pick a variant through an ordered list of
 * predicates rather than through the node class itself, so one node kind never needs its
 * own node type.
 */
public sealed interface NodeDetails permits NodeDetails.General, NodeDetails.CodeBlock,
    NodeDetails.PythonScript, NodeDetails.PathInput, NodeDetails.Selection,
    NodeDetails.InputValue, NodeDetails.CustomReference {

    /**
     * Returns the discriminant of this variant.
     *
     * @return node kind
     */
    NodeKind kind();

    /**
     * Variants that carry source code.
     */
    interface Code {
        String code();

        String language();
    }

    /**
     * Any node without a dedicated variant.
     */
    record General() implements NodeDetails {
        @Override
        public NodeKind kind() {
            return NodeKind.GENERAL;
        }
    }

    /**
     * DesignScript code block.
     *
     * @param code code of the block
     */
    record CodeBlock(String code) implements NodeDetails, Code {
        public CodeBlock {
            if (code == null) {
                code = "";
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CODE_BLOCK;
        }

        @Override
        public String language() {
            return "js";
        }
    }

    /**
     * Python script node.
     *
     * @param code python source
     * @param engine python engine name, e.g. {@code CPython3}
     */
    record PythonScript(String code, String engine) implements NodeDetails, Code {
        public PythonScript {
            if (code == null) {
                code = "";
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PYTHON_SCRIPT;
        }

        @Override
        public String language() {
            return "python";
        }
    }

    /**
     * File or directory input.
     *
     * @param path configured path, may be null
     * @param directory true for directory inputs
     */
    record PathInput(String path, boolean directory) implements NodeDetails {
        @Override
        public NodeKind kind() {
            return directory ? NodeKind.DIRECTORY_PATH : NodeKind.FILE_PATH;
        }
    }

    /**
     * Dropdown style selection node.
     *
     * @param selected selected entry
     */
    record Selection(String selected) implements NodeDetails {
        @Override
        public NodeKind kind() {
            return NodeKind.SELECTION;
        }
    }

    /**
     * Core input node (number, string, boolean).
     *
     * @param value raw input value
     */
    record InputValue(String value) implements NodeDetails {
        @Override
        public NodeKind kind() {
            return NodeKind.INPUT_VALUE;
        }
    }

    /**
     * Call of a custom node definition.
     *
     * @param functionUuid uuid of the referenced custom node
     */
    record CustomReference(String functionUuid) implements NodeDetails {
        public CustomReference {
            Objects.requireNonNull(functionUuid, "functionUuid must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CUSTOM_REFERENCE;
        }
    }
}
