package io.surfworks.kerneldetect.shape;

/**
 * Output size and padding of one spatial axis of a windowed operator.
 *
 * @param output      output size along the axis
 * @param padBefore   padding added before the first element (top or left)
 * @param padAfter    padding added after the last element (bottom or right)
 */
public record WindowGeometry(int output, int padBefore, int padAfter) {

    /**
     * Computes the geometry of one axis.
     *
     * <p>For {@link Padding#SAME} the total padding is
     * {@code max((output - 1) * stride + kernel - input, 0)}; the smaller half goes
     * before, the larger after.
     *
     * @param input   input size along the axis
     * @param kernel  effective kernel extent (dilation already applied)
     * @param stride  stride along the axis, at least 1
     * @param padding padding mode
     */
    public static WindowGeometry of(int input, int kernel, int stride, Padding padding) {
        if (stride < 1) {
            throw new IllegalArgumentException("Stride must be positive, got " + stride);
        }
        if (padding == Padding.SAME) {
            int output = ceilDiv(input, stride);
            int total = Math.max((output - 1) * stride + kernel - input, 0);
            int before = total / 2;
            return new WindowGeometry(output, before, total - before);
        }
        int output = Math.max(ceilDiv(input - kernel + 1, stride), 0);
        return new WindowGeometry(output, 0, 0);
    }

    /**
     * Kernel extent once dilation is applied.
     */
    public static int effectiveKernel(int kernel, int dilation) {
        return dilation * (kernel - 1) + 1;
    }

    public int totalPadding() {
        return padBefore + padAfter;
    }

    private static int ceilDiv(int value, int divisor) {
        return -Math.floorDiv(-value, divisor);
    }
}
