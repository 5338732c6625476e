package io.surfworks.kerneldetect.shape;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator kinds known to shape inference, each with the op type names
 * (TensorFlow and Keras spellings) that map onto it.
 */
public enum OpKind {
    PROPAGATE(List.of("Relu", "Relu6", "LeakyReLU", "Sigmoid", "Tanh",
            "FusedBatchNorm", "FusedBatchNormV3", "BiasAdd", "Identity")),
    BROADCAST(List.of("Add", "AddV2", "Mul")),
    CONV(List.of("Conv2D")),
    DEPTHWISE_CONV(List.of("DepthwiseConv2dNative")),
    POOL(List.of("MaxPool", "AvgPool", "MaxPooling2D", "AveragePooling2D")),
    MATMUL(List.of("MatMul")),
    REDUCE(List.of("Mean", "GlobalAveragePooling2D", "GlobalMaxPooling2D")),
    RESHAPE(List.of("Reshape")),
    CONCAT(List.of("ConcatV2", "Concat", "Concatenate")),
    SPLIT(List.of("Split")),
    TRANSPOSE(List.of("Transpose")),
    CONST(List.of("Const")),
    PLACEHOLDER(List.of("Placeholder")),
    PACK(List.of("Pack", "Packed")),
    STRIDED_SLICE(List.of("StridedSlice")),
    UNSUPPORTED(List.of());

    private static final Map<String, OpKind> BY_TYPE = new HashMap<>();

    static {
        for (OpKind kind : values()) {
            for (String type : kind.typeNames) {
                BY_TYPE.put(type, kind);
            }
        }
    }

    private final List<String> typeNames;

    OpKind(List<String> typeNames) {
        this.typeNames = typeNames;
    }

    public List<String> typeNames() {
        return typeNames;
    }

    /**
     * Kinds whose shape can only be recovered from a downstream reshape and are
     * therefore revisited by the patch pass.
     */
    public boolean needsDownstreamPatch() {
        return this == PACK || this == STRIDED_SLICE;
    }

    /**
     * Resolves an op type tag; unknown tags map to {@link #UNSUPPORTED}.
     */
    public static OpKind fromType(String type) {
        return BY_TYPE.getOrDefault(type, UNSUPPORTED);
    }
}
