package io.surfworks.kerneldetect.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An operator node in a {@link GraphIr}.
 *
 * <p>Nodes live in the graph's arena and are addressed by a dense integer
 * {@link #index()}. Edges are stored as lists of arena indices in both
 * directions; their order is significant (shape rules read "the first input").
 *
 * <p>{@link #members()} records the original node names this node stands for.
 * It is the node's own name until the node is produced by {@link GraphIr#fuse},
 * after which it is the union of the fused nodes' members.
 */
public final class IrNode {

    private final int index;
    private final String name;
    private final String type;
    private final Attributes attributes;
    private final Set<String> members;
    private final List<Integer> inbounds = new ArrayList<>();
    private final List<Integer> outbounds = new ArrayList<>();
    private List<Shape> inputShapes = List.of();
    private List<Shape> outputShapes = List.of();
    private boolean removed;

    IrNode(int index, String name, String type, Attributes attributes, Set<String> members) {
        this.index = index;
        this.name = name;
        this.type = type;
        this.attributes = attributes;
        this.members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public Attributes attributes() {
        return attributes;
    }

    public Set<String> members() {
        return members;
    }

    public List<Integer> inbounds() {
        return Collections.unmodifiableList(inbounds);
    }

    public List<Integer> outbounds() {
        return Collections.unmodifiableList(outbounds);
    }

    public List<Shape> inputShapes() {
        return inputShapes;
    }

    public List<Shape> outputShapes() {
        return outputShapes;
    }

    /**
     * The first output shape, if shape inference produced one.
     */
    public Optional<Shape> outputShape() {
        return outputShapes.isEmpty() ? Optional.empty() : Optional.of(outputShapes.get(0));
    }

    public boolean hasOutputShape() {
        return !outputShapes.isEmpty();
    }

    public void setInputShapes(List<Shape> shapes) {
        this.inputShapes = List.copyOf(shapes);
    }

    public void setOutputShapes(List<Shape> shapes) {
        this.outputShapes = List.copyOf(shapes);
    }

    public boolean isRemoved() {
        return removed;
    }

    List<Integer> mutableInbounds() {
        return inbounds;
    }

    List<Integer> mutableOutbounds() {
        return outbounds;
    }

    void markRemoved() {
        this.removed = true;
    }

    @Override
    public String toString() {
        return String.format("IrNode[%d %s:%s in=%s out=%s]", index, name, type, inbounds, outbounds);
    }
}
