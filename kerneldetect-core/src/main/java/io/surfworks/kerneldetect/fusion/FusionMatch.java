package io.surfworks.kerneldetect.fusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.kerneldetect.ir.IrNode;

/**
 * One occurrence of a {@link FusionUnit} in a graph.
 *
 * @param patternName  the name of the matched fusion unit
 * @param nodesByAlias the graph node bound to each template position
 */
public record FusionMatch(String patternName, Map<String, IrNode> nodesByAlias) {

    public FusionMatch {
        nodesByAlias = Collections.unmodifiableMap(new LinkedHashMap<>(nodesByAlias));
    }

    /**
     * The matched nodes in template declaration order.
     */
    public List<IrNode> matchedNodes() {
        return List.copyOf(nodesByAlias.values());
    }

    public IrNode node(String alias) {
        return nodesByAlias.get(alias);
    }

    public boolean includes(IrNode node) {
        return nodesByAlias.containsValue(node);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FusionMatch[pattern=").append(patternName);
        nodesByAlias.forEach((alias, node) -> sb.append(", ").append(alias).append('=').append(node.name()));
        return sb.append(']').toString();
    }
}
