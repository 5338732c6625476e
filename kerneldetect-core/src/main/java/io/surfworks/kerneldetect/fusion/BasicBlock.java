package io.surfworks.kerneldetect.fusion;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A kernel: a group of original operator nodes expected to run as one fused unit.
 *
 * @param type  the block label: the template name or op type for a single node,
 *              otherwise the member types joined with {@code -}
 * @param nodes the original node names, in traversal order
 */
public record BasicBlock(String type, Set<String> nodes) {

    public BasicBlock {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Basic block '" + type + "' has no nodes");
        }
        nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
    }

    public boolean contains(String node) {
        return nodes.contains(node);
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return type + nodes;
    }
}
