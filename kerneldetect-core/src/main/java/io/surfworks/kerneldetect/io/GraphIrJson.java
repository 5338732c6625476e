package io.surfworks.kerneldetect.io;

import io.surfworks.kerneldetect.KernelDetectException;
import io.surfworks.kerneldetect.fusion.BasicBlock;
import io.surfworks.kerneldetect.ir.GraphIr;
import io.surfworks.kerneldetect.ir.IrNode;
import io.surfworks.kerneldetect.ir.NodeRecord;
import io.surfworks.kerneldetect.ir.Shape;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of the graph IR as exchanged with the graph converter and the
 * downstream benchmarking and prediction tools.
 *
 * <p>A graph is an object keyed by node name:
 * <pre>{@code
 * {
 *   "conv": {
 *     "inbounds": ["input", "weights"],
 *     "outbounds": ["relu"],
 *     "attr": {
 *       "type": "Conv2D",
 *       "attr": {"strides": [1, 1, 1, 1], "padding": "SAME"},
 *       "input_shape": [[1, 32, 32, 3]],
 *       "output_shape": [[1, 32, 32, 16]]
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Shapes are optional on input and written when present. Basic blocks are
 * written as {@code [{"type": ..., "nodes": [...]}]}.
 */
public final class GraphIrJson {

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .setPrettyPrinting()
            .create();

    private static final Type ATTRIBUTE_MAP = new TypeToken<Map<String, Object>>() {}.getType();

    private GraphIrJson() {}

    public static GraphIr read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new KernelDetectException("Failed to read graph " + path, e);
        }
    }

    public static GraphIr parse(String json) {
        return read(new StringReader(json));
    }

    /**
     * Reads a graph in converter form. Recorded shapes are restored.
     *
     * @throws KernelDetectException if the document is not a graph or references unknown nodes
     */
    public static GraphIr read(Reader reader) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new KernelDetectException("Expected a graph object, got " + element);
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new KernelDetectException("Malformed graph JSON: " + e.getMessage(), e);
        }

        Map<String, NodeRecord> records = new LinkedHashMap<>();
        Map<String, JsonObject> nodeAttrs = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
                JsonObject node = entry.getValue().getAsJsonObject();
                JsonObject attr = node.has("attr") ? node.getAsJsonObject("attr") : new JsonObject();
                if (!attr.has("type")) {
                    throw new KernelDetectException("Node '" + entry.getKey() + "' has no type");
                }
                Map<String, Object> attributes = attr.has("attr")
                        ? GSON.fromJson(attr.get("attr"), ATTRIBUTE_MAP)
                        : Map.of();
                records.put(entry.getKey(), new NodeRecord(
                        attr.get("type").getAsString(),
                        attributes,
                        names(node, "inbounds"),
                        names(node, "outbounds")));
                nodeAttrs.put(entry.getKey(), attr);
            }
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            throw new KernelDetectException("Invalid graph JSON: " + e.getMessage(), e);
        }

        GraphIr graph = GraphIr.fromRecords(records);
        nodeAttrs.forEach((name, attr) -> {
            IrNode node = graph.require(name);
            if (attr.has("input_shape")) {
                node.setInputShapes(shapes(attr.get("input_shape")));
            }
            if (attr.has("output_shape")) {
                node.setOutputShapes(shapes(attr.get("output_shape")));
            }
        });
        return graph;
    }

    /**
     * Writes the live nodes of a graph in converter form, with shapes.
     */
    public static String write(GraphIr graph) {
        JsonObject root = new JsonObject();
        for (IrNode node : graph.nodes()) {
            JsonObject entry = new JsonObject();
            entry.add("inbounds", nameArray(graph.inbounds(node)));
            entry.add("outbounds", nameArray(graph.outbounds(node)));

            JsonObject attr = new JsonObject();
            attr.addProperty("type", node.type());
            JsonObject values = new JsonObject();
            node.attributes().asMap().forEach((key, value) -> values.add(key, attributeValue(value)));
            attr.add("attr", values);
            if (!node.inputShapes().isEmpty()) {
                attr.add("input_shape", shapeArray(node.inputShapes()));
            }
            if (!node.outputShapes().isEmpty()) {
                attr.add("output_shape", shapeArray(node.outputShapes()));
            }
            entry.add("attr", attr);
            root.add(node.name(), entry);
        }
        return GSON.toJson(root);
    }

    public static void write(GraphIr graph, Path path) throws IOException {
        Files.writeString(path, write(graph), StandardCharsets.UTF_8);
    }

    /**
     * Writes basic blocks in partition order.
     */
    public static String writeBlocks(List<BasicBlock> blocks) {
        JsonArray array = new JsonArray();
        for (BasicBlock block : blocks) {
            JsonObject object = new JsonObject();
            object.addProperty("type", block.type());
            JsonArray nodes = new JsonArray();
            block.nodes().forEach(nodes::add);
            object.add("nodes", nodes);
            array.add(object);
        }
        return GSON.toJson(array);
    }

    private static List<String> names(JsonObject node, String key) {
        List<String> names = new ArrayList<>();
        if (node.has(key) && !node.get(key).isJsonNull()) {
            node.getAsJsonArray(key).forEach(e -> names.add(e.getAsString()));
        }
        return names;
    }

    private static List<Shape> shapes(JsonElement element) {
        List<Shape> shapes = new ArrayList<>();
        for (JsonElement shape : element.getAsJsonArray()) {
            List<Integer> dims = new ArrayList<>();
            shape.getAsJsonArray().forEach(d -> dims.add(d.getAsInt()));
            shapes.add(new Shape(dims));
        }
        return shapes;
    }

    private static JsonArray nameArray(List<IrNode> nodes) {
        JsonArray array = new JsonArray();
        nodes.forEach(n -> array.add(n.name()));
        return array;
    }

    private static JsonArray shapeArray(List<Shape> shapes) {
        JsonArray array = new JsonArray();
        for (Shape shape : shapes) {
            JsonArray dims = new JsonArray();
            shape.dims().forEach(dims::add);
            array.add(dims);
        }
        return array;
    }

    // TensorFlow string attributes may arrive as bytes.
    private static JsonElement attributeValue(Object value) {
        if (value instanceof byte[] bytes) {
            return GSON.toJsonTree(new String(bytes, StandardCharsets.UTF_8));
        }
        return GSON.toJsonTree(value);
    }
}
