package com.graphdoc.core.content;

/**
 * How a heading combines model content with text recovered from the previous run.
 */
public enum ManualMode {
    /** Model content if any, otherwise the recovered text or the placeholder */
    FALLBACK,
    /** Model content followed by the recovered text, if any; the placeholder when both are empty */
    APPEND
}
