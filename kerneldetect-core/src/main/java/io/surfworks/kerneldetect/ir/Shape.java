package io.surfworks.kerneldetect.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered sequence of tensor dimensions.
 *
 * <p>Shapes are immutable; every "modifying" method returns a new instance.
 * Tensors flowing through the detector are laid out NHWC, so for a rank-4
 * shape {@code dim(1)} is the height and {@code dim(2)} the width.
 *
 * @param dims the dimension sizes, outermost first
 */
public record Shape(List<Integer> dims) {

    /** Placeholder used when a shape can only be recovered from a downstream node and none was found. */
    public static final Shape UNKNOWN_4D = of(0, 0, 0, 0);

    public Shape {
        dims = List.copyOf(dims);
    }

    public static Shape of(int... dims) {
        List<Integer> list = new ArrayList<>(dims.length);
        for (int d : dims) {
            list.add(d);
        }
        return new Shape(list);
    }

    /**
     * Creates a shape from any list of numbers (JSON decoding yields doubles).
     */
    public static Shape ofNumbers(List<? extends Number> dims) {
        List<Integer> list = new ArrayList<>(dims.size());
        for (Number n : dims) {
            list.add(n.intValue());
        }
        return new Shape(list);
    }

    public int rank() {
        return dims.size();
    }

    public boolean isEmpty() {
        return dims.isEmpty();
    }

    public int dim(int axis) {
        return dims.get(axis);
    }

    /**
     * Total number of elements. Negative (unresolved) dimensions count by magnitude.
     */
    public long elementCount() {
        long count = 1;
        for (int d : dims) {
            count *= Math.abs((long) d);
        }
        return count;
    }

    public Shape withDim(int axis, int value) {
        List<Integer> copy = new ArrayList<>(dims);
        copy.set(axis, value);
        return new Shape(copy);
    }

    public Shape withoutDim(int axis) {
        List<Integer> copy = new ArrayList<>(dims);
        copy.remove(axis);
        return new Shape(copy);
    }

    /**
     * Returns the shape with its axes reordered so that axis {@code i} of the
     * result is axis {@code perm.get(i)} of this shape.
     */
    public Shape permute(List<Integer> perm) {
        List<Integer> out = new ArrayList<>(perm.size());
        for (int axis : perm) {
            out.add(dims.get(axis));
        }
        return new Shape(out);
    }

    /**
     * Normalises a possibly negative axis against this shape's rank.
     */
    public int normalizeAxis(int axis) {
        return axis < 0 ? axis + rank() : axis;
    }

    @Override
    public String toString() {
        return dims.toString();
    }
}
