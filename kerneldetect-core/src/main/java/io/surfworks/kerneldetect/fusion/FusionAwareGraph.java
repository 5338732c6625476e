package io.surfworks.kerneldetect.fusion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;

/**
 * Fusion state over a {@link GraphIr} for the duration of one split run.
 *
 * <p>Nodes are addressed by their position in the graph's topological order.
 * For every position the view tracks:
 * <ul>
 *   <li>{@code fused}: the node was absorbed into another node's block and is
 *       never again a fusion source</li>
 *   <li>{@code ready}: the node has been visited as a fusion source or absorbed;
 *       the flag is never cleared</li>
 *   <li>the block it belongs to (a union-find forest rooted at the node that
 *       started the block)</li>
 *   <li>for block roots, the fusion frontier: consumers outside the block that
 *       are still candidates, each with the member that feeds it</li>
 * </ul>
 *
 * <p>The underlying graph is not modified.
 */
public final class FusionAwareGraph {

    private final List<IrNode> order;
    private final boolean[] fused;
    private final boolean[] ready;
    private final UnionFind blocks;
    private final List<LinkedHashMap<Integer, Integer>> frontier;
    private final List<Set<Integer>> detached;

    public FusionAwareGraph(GraphIr graph) {
        this.order = graph.traversalOrder();
        int size = order.size();
        this.fused = new boolean[size];
        this.ready = new boolean[size];
        this.blocks = new UnionFind(size);
        this.frontier = new ArrayList<>(size);
        this.detached = new ArrayList<>(size);

        Map<Integer, Integer> positions = new HashMap<>();
        for (int i = 0; i < size; i++) {
            positions.put(order.get(i).index(), i);
        }
        for (int i = 0; i < size; i++) {
            LinkedHashMap<Integer, Integer> consumers = new LinkedHashMap<>();
            for (int consumer : order.get(i).outbounds()) {
                Integer position = positions.get(consumer);
                if (position != null) {
                    consumers.put(position, i);
                }
            }
            frontier.add(consumers);
            detached.add(new LinkedHashSet<>());
        }
    }

    public int size() {
        return order.size();
    }

    public IrNode node(int position) {
        return order.get(position);
    }

    public String type(int position) {
        return order.get(position).type();
    }

    public boolean isFused(int position) {
        return fused[position];
    }

    public boolean isReady(int position) {
        return ready[position];
    }

    public void markReady(int position) {
        ready[position] = true;
    }

    /**
     * The root position of the block containing the given position.
     */
    public int blockOf(int position) {
        return blocks.find(position);
    }

    /**
     * Consumers of the block rooted at {@code position} that are still fusion
     * candidates, in discovery order.
     */
    public List<Integer> outbounds(int position) {
        return frontier.get(position).keySet().stream()
                .filter(c -> !blocks.connected(position, c))
                .toList();
    }

    /**
     * The block member that feeds the given frontier consumer.
     *
     * @throws IllegalArgumentException if {@code consumer} is not on the block's frontier
     */
    public int sourceOf(int position, int consumer) {
        Integer source = frontier.get(position).get(consumer);
        if (source == null) {
            throw new IllegalArgumentException(
                    "Position " + consumer + " is not a consumer of block " + position);
        }
        return source;
    }

    /**
     * Consumers that were split off the block's frontier when it fused into a
     * sibling. They stay graph consumers of the block but are no longer fusion
     * candidates.
     */
    public Set<Integer> detachedConsumers(int position) {
        return detached.get(position).stream()
                .filter(c -> !blocks.connected(position, c))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Absorbs the block of {@code outnode} into the block of {@code node}.
     *
     * <p>The absorbed node's consumers join the frontier. The block's other
     * consumers either stay candidates ({@code keepOtherConsumers}) or are moved
     * to {@link #detachedConsumers(int)}.
     *
     * @param node               a block root that is not fused
     * @param outnode            a frontier consumer of {@code node} that is not fused
     * @param keepOtherConsumers whether the remaining frontier stays fusible
     */
    public void fuse(int node, int outnode, boolean keepOtherConsumers) {
        if (fused[node] || blocks.find(node) != node) {
            throw new IllegalStateException("Position " + node + " is not an unfused block root");
        }
        if (fused[outnode] || blocks.connected(node, outnode)) {
            throw new IllegalStateException("Position " + outnode + " is already fused");
        }

        LinkedHashMap<Integer, Integer> nodeFrontier = frontier.get(node);
        nodeFrontier.remove(outnode);
        if (!keepOtherConsumers) {
            detached.get(node).addAll(nodeFrontier.keySet());
            nodeFrontier.clear();
        }

        blocks.union(node, outnode);
        fused[outnode] = true;

        frontier.get(outnode).forEach((consumer, source) -> {
            if (!blocks.connected(node, consumer)) {
                nodeFrontier.putIfAbsent(consumer, source);
                detached.get(node).remove(consumer);
            }
        });
        frontier.get(outnode).clear();
        detached.get(node).addAll(detached.get(outnode));
        detached.get(outnode).clear();
    }

    /**
     * Reads the current partition off the block forest.
     *
     * <p>Blocks are ordered by their earliest member. Each block lists the
     * original node names of its members.
     */
    public List<BasicBlock> basicBlocks() {
        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            groups.computeIfAbsent(blocks.find(i), k -> new ArrayList<>()).add(i);
        }

        List<BasicBlock> result = new ArrayList<>(groups.size());
        for (List<Integer> members : groups.values()) {
            Set<String> names = new LinkedHashSet<>();
            for (int member : members) {
                names.addAll(order.get(member).members());
            }
            String label = members.stream()
                    .map(this::type)
                    .collect(Collectors.joining("-"));
            result.add(new BasicBlock(label, names));
        }
        return result;
    }

    @Override
    public String toString() {
        int roots = 0;
        for (int i = 0; i < order.size(); i++) {
            if (blocks.find(i) == i) {
                roots++;
            }
        }
        return String.format("FusionAwareGraph[nodes=%d, blocks=%d]", order.size(), roots);
    }
}
