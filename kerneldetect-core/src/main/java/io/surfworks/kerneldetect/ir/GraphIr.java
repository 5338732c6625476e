package io.surfworks.kerneldetect.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import io.surfworks.kerneldetect.KernelDetectException;

/**
 * Annotated operator graph: nodes are operators, edges are tensor dataflow.
 *
 * <p>Nodes are kept in an arena and addressed by dense integer index. Fusing
 * nodes appends a new node to the arena and marks the fused nodes removed, so
 * indices handed out earlier stay valid (they simply stop being live).
 *
 * <p>A GraphIr is mutated in place by shape inference (attribute annotation)
 * and by template pre-fusion (node merging). It is not safe for concurrent use.
 *
 * <p>Example:
 * <pre>{@code
 * GraphIr graph = GraphIr.builder()
 *     .node("input", "Placeholder", Attributes.of("shape", List.of(1, 8, 8, 3)))
 *     .node("relu", "Relu", new Attributes(), "input")
 *     .build();
 *
 * List<IrNode> order = graph.traversalOrder();
 * }</pre>
 */
public final class GraphIr {

    private static final Logger LOG = Logger.getLogger(GraphIr.class.getName());

    private final List<IrNode> arena = new ArrayList<>();
    private final Map<String, Integer> indexByName = new HashMap<>();

    public GraphIr() {}

    /**
     * Builds a graph from converter records, keyed by node name.
     *
     * <p>An edge declared on either side (producer's outbounds or consumer's
     * inbounds) exists in the result. Inbound order follows the consumer's
     * record, with edges only declared by producers appended after.
     *
     * @throws KernelDetectException if a record references an unknown node
     */
    public static GraphIr fromRecords(Map<String, NodeRecord> records) {
        GraphIr graph = new GraphIr();
        for (Map.Entry<String, NodeRecord> entry : records.entrySet()) {
            NodeRecord record = entry.getValue();
            graph.addNode(entry.getKey(), record.type(), new Attributes(record.attributes()));
        }
        for (Map.Entry<String, NodeRecord> entry : records.entrySet()) {
            IrNode consumer = graph.require(entry.getKey());
            for (String producerName : entry.getValue().inbounds()) {
                graph.connect(graph.requireReference(producerName, entry.getKey()), consumer);
            }
        }
        for (Map.Entry<String, NodeRecord> entry : records.entrySet()) {
            IrNode producer = graph.require(entry.getKey());
            for (String consumerName : entry.getValue().outbounds()) {
                graph.connect(producer, graph.requireReference(consumerName, entry.getKey()));
            }
        }
        return graph;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Construction ====================

    /**
     * Adds an unconnected node.
     *
     * @throws KernelDetectException if the name is already taken
     */
    public IrNode addNode(String name, String type, Attributes attributes) {
        return addNode(name, type, attributes, Set.of(name));
    }

    private IrNode addNode(String name, String type, Attributes attributes, Set<String> members) {
        if (indexByName.containsKey(name)) {
            throw new KernelDetectException("Duplicate node name '" + name + "'");
        }
        IrNode node = new IrNode(arena.size(), name, type, attributes, members);
        arena.add(node);
        indexByName.put(name, node.index());
        return node;
    }

    /**
     * Adds the edge {@code producer -> consumer} unless it already exists.
     */
    public void connect(IrNode producer, IrNode consumer) {
        if (!producer.mutableOutbounds().contains(consumer.index())) {
            producer.mutableOutbounds().add(consumer.index());
        }
        if (!consumer.mutableInbounds().contains(producer.index())) {
            consumer.mutableInbounds().add(producer.index());
        }
    }

    // ==================== Lookup ====================

    public IrNode node(int index) {
        return arena.get(index);
    }

    /**
     * Finds a live node by name.
     */
    public Optional<IrNode> find(String name) {
        Integer index = indexByName.get(name);
        if (index == null || arena.get(index).isRemoved()) {
            return Optional.empty();
        }
        return Optional.of(arena.get(index));
    }

    public IrNode require(String name) {
        return find(name).orElseThrow(() -> new KernelDetectException("Unknown node '" + name + "'"));
    }

    /**
     * Finds the live node that currently stands for an original node name,
     * following fusions.
     */
    public Optional<IrNode> owner(String memberName) {
        for (IrNode node : arena) {
            if (!node.isRemoved() && node.members().contains(memberName)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Live nodes in arena (insertion) order.
     */
    public List<IrNode> nodes() {
        return arena.stream().filter(n -> !n.isRemoved()).toList();
    }

    public int size() {
        int count = 0;
        for (IrNode node : arena) {
            if (!node.isRemoved()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Live nodes without producers: graph inputs, constants and weights.
     */
    public List<IrNode> heads() {
        return arena.stream().filter(n -> !n.isRemoved() && n.inbounds().isEmpty()).toList();
    }

    public List<IrNode> inbounds(IrNode node) {
        return node.inbounds().stream().map(arena::get).toList();
    }

    public List<IrNode> outbounds(IrNode node) {
        return node.outbounds().stream().map(arena::get).toList();
    }

    /**
     * Union of the members of all live nodes: the original node names.
     */
    public Set<String> memberNames() {
        Set<String> names = new LinkedHashSet<>();
        for (IrNode node : nodes()) {
            names.addAll(node.members());
        }
        return names;
    }

    // ==================== Traversal ====================

    /**
     * Topological order of the whole graph, starting from {@link #heads()}.
     */
    public List<IrNode> traversalOrder() {
        return traversalOrder(heads());
    }

    /**
     * Topological order of the nodes reachable from the given heads.
     *
     * <p>Kahn's algorithm with a FIFO queue: ready nodes are visited in the order
     * they became ready, nodes ready at the start in arena order. Producers that
     * are not reachable from the heads do not hold their consumers back.
     *
     * @throws KernelDetectException if the reachable subgraph has a cycle
     */
    public List<IrNode> traversalOrder(Collection<IrNode> heads) {
        Set<Integer> reachable = reachableFrom(heads);

        Map<Integer, Integer> pending = new HashMap<>();
        for (int index : reachable) {
            int count = 0;
            for (int producer : arena.get(index).inbounds()) {
                if (reachable.contains(producer)) {
                    count++;
                }
            }
            pending.put(index, count);
        }

        Deque<Integer> queue = new ArrayDeque<>();
        reachable.stream()
                .filter(i -> pending.get(i) == 0)
                .sorted()
                .forEach(queue::add);

        List<IrNode> order = new ArrayList<>(reachable.size());
        while (!queue.isEmpty()) {
            IrNode node = arena.get(queue.poll());
            order.add(node);
            for (int consumer : node.outbounds()) {
                if (!reachable.contains(consumer)) {
                    continue;
                }
                int left = pending.merge(consumer, -1, Integer::sum);
                if (left == 0) {
                    queue.add(consumer);
                }
            }
        }

        if (order.size() != reachable.size()) {
            throw new KernelDetectException(String.format(
                    "Graph has a cycle: ordered %d of %d reachable nodes", order.size(), reachable.size()));
        }
        return order;
    }

    /**
     * Breadth-first walk along outbound edges, starting with {@code start}
     * itself, stopping after {@code limit} nodes.
     */
    public List<IrNode> breadthFirst(IrNode start, int limit) {
        List<IrNode> seen = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start.index());
        visited.add(start.index());
        while (!queue.isEmpty() && seen.size() < limit) {
            IrNode node = arena.get(queue.poll());
            seen.add(node);
            for (int consumer : node.outbounds()) {
                if (visited.add(consumer)) {
                    queue.add(consumer);
                }
            }
        }
        return seen;
    }

    /**
     * Whether no path between two nodes of the set passes through a node
     * outside it. Only convex sets can be fused without creating a cycle.
     */
    public boolean isConvex(Collection<IrNode> nodes) {
        Set<Integer> inside = new HashSet<>();
        nodes.forEach(n -> inside.add(n.index()));

        // Walk outside nodes downstream of the set; reaching back in breaks convexity.
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (int index : inside) {
            for (int consumer : arena.get(index).outbounds()) {
                if (!inside.contains(consumer) && visited.add(consumer)) {
                    queue.add(consumer);
                }
            }
        }
        while (!queue.isEmpty()) {
            for (int consumer : arena.get(queue.poll()).outbounds()) {
                if (inside.contains(consumer)) {
                    return false;
                }
                if (visited.add(consumer)) {
                    queue.add(consumer);
                }
            }
        }
        return true;
    }

    private Set<Integer> reachableFrom(Collection<IrNode> heads) {
        Set<Integer> reachable = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (IrNode head : heads) {
            if (!head.isRemoved() && reachable.add(head.index())) {
                queue.add(head.index());
            }
        }
        while (!queue.isEmpty()) {
            for (int consumer : arena.get(queue.poll()).outbounds()) {
                if (reachable.add(consumer)) {
                    queue.add(consumer);
                }
            }
        }
        return reachable;
    }

    // ==================== Rewriting ====================

    /**
     * Collapses a set of live nodes into one new node of the given type.
     *
     * <p>Edges between the collapsed nodes disappear. Edges to and from nodes
     * outside the set are moved onto the new node, keeping their position in the
     * outside node's edge list. The new node's members are the union of the
     * collapsed nodes' members; its input shapes come from the first entry node
     * of the set and its output shapes from the last exit node.
     *
     * <p>The set should be {@linkplain #isConvex(Collection) convex}; collapsing
     * a set that a path leaves and re-enters leaves a cycle behind.
     *
     * @param nodes the nodes to collapse (at least one, all live)
     * @param type  the op type of the new node, typically a fusion-unit name
     * @return the new node
     * @throws KernelDetectException if a node is removed or the joined name is
     *                               taken by a node outside the set
     */
    public IrNode fuse(Collection<IrNode> nodes, String type) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Cannot fuse an empty node set");
        }
        List<IrNode> sorted = nodes.stream()
                .distinct()
                .sorted(Comparator.comparingInt(IrNode::index))
                .toList();
        Set<Integer> inside = new HashSet<>();
        for (IrNode node : sorted) {
            if (node.isRemoved()) {
                throw new KernelDetectException("Cannot fuse removed node '" + node.name() + "'");
            }
            inside.add(node.index());
        }

        Set<String> members = new LinkedHashSet<>();
        sorted.forEach(n -> members.addAll(n.members()));
        String name = sorted.stream().map(IrNode::name).collect(Collectors.joining("+"));
        Integer holder = indexByName.get(name);
        if (holder != null && !inside.contains(holder)) {
            throw new KernelDetectException("Duplicate node name '" + name + "'");
        }

        // The collapsed nodes give up their names; a single-node fuse reuses its own.
        sorted.forEach(n -> indexByName.remove(n.name()));
        IrNode fused = addNode(name, type, new Attributes(), members);

        Set<Integer> producers = new LinkedHashSet<>();
        Set<Integer> consumers = new LinkedHashSet<>();
        IrNode entry = null;
        IrNode exit = null;
        for (IrNode node : sorted) {
            boolean internalInput = false;
            for (int producer : node.inbounds()) {
                if (inside.contains(producer)) {
                    internalInput = true;
                } else {
                    producers.add(producer);
                }
            }
            boolean internalOutput = false;
            for (int consumer : node.outbounds()) {
                if (inside.contains(consumer)) {
                    internalOutput = true;
                } else {
                    consumers.add(consumer);
                }
            }
            if (!internalInput && entry == null) {
                entry = node;
            }
            if (!internalOutput) {
                exit = node;
            }
        }

        for (int producer : producers) {
            relink(arena.get(producer).mutableOutbounds(), inside, fused.index());
            fused.mutableInbounds().add(producer);
        }
        for (int consumer : consumers) {
            relink(arena.get(consumer).mutableInbounds(), inside, fused.index());
            fused.mutableOutbounds().add(consumer);
        }

        if (entry != null) {
            fused.setInputShapes(entry.inputShapes());
        }
        if (exit != null) {
            fused.setOutputShapes(exit.outputShapes());
        }

        for (IrNode node : sorted) {
            node.markRemoved();
        }

        LOG.fine("Fused " + members + " into " + type + " node '" + name + "'");
        return fused;
    }

    private static void relink(List<Integer> edges, Set<Integer> inside, int replacement) {
        boolean placed = false;
        for (int i = 0; i < edges.size(); i++) {
            if (!inside.contains(edges.get(i))) {
                continue;
            }
            if (placed) {
                edges.remove(i);
                i--;
            } else {
                edges.set(i, replacement);
                placed = true;
            }
        }
    }

    private IrNode requireReference(String name, String referencedFrom) {
        return find(name).orElseThrow(() -> new KernelDetectException(
                "Node '" + referencedFrom + "' references unknown node '" + name + "'"));
    }

    @Override
    public String toString() {
        return String.format("GraphIr[nodes=%d, heads=%d]", size(), heads().size());
    }

    /**
     * Fluent construction of small graphs; edges may reference nodes declared later.
     */
    public static final class Builder {

        private final Map<String, NodeRecord> records = new LinkedHashMap<>();

        private Builder() {}

        public Builder node(String name, String type, Attributes attributes, String... inbounds) {
            records.put(name, new NodeRecord(type, attributes.asMap(), List.of(inbounds), List.of()));
            return this;
        }

        public Builder node(String name, String type, String... inbounds) {
            return node(name, type, new Attributes(), inbounds);
        }

        public GraphIr build() {
            return fromRecords(records);
        }
    }
}
