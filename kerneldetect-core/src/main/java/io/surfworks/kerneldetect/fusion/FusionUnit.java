package io.surfworks.kerneldetect.fusion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named multi-operator template that is collapsed into one node before the
 * pairwise fusion loop runs.
 *
 * <p>Each alias names one template position and the op types it accepts; each
 * edge requires a producer-to-consumer connection between two positions.
 *
 * <p>Example, a convolution followed by batch norm and an activation:
 * <pre>{@code
 * FusionUnit unit = FusionUnit.builder("conv-bn-relu")
 *     .alias("conv", "Conv2D")
 *     .alias("bn", "FusedBatchNorm", "FusedBatchNormV3")
 *     .alias("relu", "Relu", "Relu6")
 *     .edge("conv", "bn")
 *     .edge("bn", "relu")
 *     .build();
 * }</pre>
 *
 * @param name    the template name; becomes the op type of the collapsed node
 * @param aliases template positions and their accepted op types, in declaration order
 * @param edges   required connections between positions
 */
public record FusionUnit(String name, Map<String, Set<String>> aliases, List<Edge> edges) {

    /**
     * A required connection from one template position to another.
     */
    public record Edge(String from, String to) {}

    public FusionUnit {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Fusion unit needs a name");
        }
        if (aliases.isEmpty()) {
            throw new IllegalArgumentException("Fusion unit '" + name + "' has no nodes");
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        aliases.forEach((alias, types) -> copy.put(alias, Collections.unmodifiableSet(new LinkedHashSet<>(types))));
        aliases = Collections.unmodifiableMap(copy);
        for (Edge edge : edges) {
            if (!aliases.containsKey(edge.from()) || !aliases.containsKey(edge.to())) {
                throw new IllegalArgumentException(
                        "Fusion unit '" + name + "' has an edge between unknown nodes " + edge);
            }
        }
        edges = List.copyOf(edges);
    }

    /**
     * A template matching a simple chain {@code types[0] -> types[1] -> ...}.
     */
    public static FusionUnit chain(String name, List<String> types) {
        Builder builder = builder(name);
        for (int i = 0; i < types.size(); i++) {
            builder.alias("op" + i, types.get(i));
            if (i > 0) {
                builder.edge("op" + (i - 1), "op" + i);
            }
        }
        return builder.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public int size() {
        return aliases.size();
    }

    public static final class Builder {

        private final String name;
        private final Map<String, Set<String>> aliases = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder alias(String alias, String... types) {
            aliases.computeIfAbsent(alias, k -> new LinkedHashSet<>()).addAll(List.of(types));
            return this;
        }

        public Builder edge(String from, String to) {
            edges.add(new Edge(from, to));
            return this;
        }

        public FusionUnit build() {
            return new FusionUnit(name, aliases, edges);
        }
    }
}
