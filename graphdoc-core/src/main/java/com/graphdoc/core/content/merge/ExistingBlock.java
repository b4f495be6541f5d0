package com.graphdoc.core.content.merge;

import java.util.List;

/**
 * Text found under a heading of a previous run.
 *
 * @param block lines after the heading up to the next heading of any level
 * @param remainder lines from that next heading to the end of the searched text
 */
public record ExistingBlock(List<String> block, List<String> remainder) {
    public ExistingBlock {
        block = block == null ? List.of() : List.copyOf(block);
        remainder = remainder == null ? List.of() : List.copyOf(remainder);
    }
}
