package com.graphdoc.core.markup;

/**
 * Where the text of a section marker is attached.
 */
public enum SectionScope {
    /** Attached to the file, rendered under the section heading */
    HEADLINE,
    /** Attached to the nearest node, or to the members of a group */
    NODE
}
