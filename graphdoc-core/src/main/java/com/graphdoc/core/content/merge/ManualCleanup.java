package com.graphdoc.core.content.merge;

/**
 * Generated parts to remove from a recovered block before it is reused as manual text.
 */
public enum ManualCleanup {
    /** First table of the block, regenerated from the model */
    STRIP_FIRST_TABLE
}
