package io.surfworks.kerneldetect.ir;

import java.util.List;
import java.util.Map;

/**
 * Structural description of one node as produced by a graph converter.
 *
 * <p>Example:
 * <pre>{@code
 * Map<String, NodeRecord> records = new LinkedHashMap<>();
 * records.put("input", new NodeRecord("Placeholder", Map.of("shape", List.of(1, 32, 32, 3)),
 *         List.of(), List.of("conv")));
 * records.put("conv", new NodeRecord("Conv2D", convAttrs, List.of("input", "weights"), List.of()));
 * GraphIr graph = GraphIr.fromRecords(records);
 * }</pre>
 *
 * @param type       the op type tag, e.g. {@code "Conv2D"}
 * @param attributes op-specific parameters
 * @param inbounds   names of producer nodes, in operand order
 * @param outbounds  names of consumer nodes
 */
public record NodeRecord(
        String type,
        Map<String, Object> attributes,
        List<String> inbounds,
        List<String> outbounds
) {

    public NodeRecord {
        attributes = attributes == null ? Map.of() : attributes;
        inbounds = inbounds == null ? List.of() : List.copyOf(inbounds);
        outbounds = outbounds == null ? List.of() : List.copyOf(outbounds);
    }
}
