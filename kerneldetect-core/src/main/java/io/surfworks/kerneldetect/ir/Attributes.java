package io.surfworks.kerneldetect.ir;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The op-specific parameter bag of an {@link IrNode}.
 *
 * <p>Values arrive from the graph converter in loosely typed form: numbers may be
 * integers or doubles (JSON), lists may be nested, strings may be raw bytes.
 * The typed accessors normalise these so that shape rules can read
 * {@code strides}, {@code padding}, {@code tensor_shape} and friends without
 * caring how the converter encoded them.
 */
public final class Attributes {

    private final Map<String, Object> values;

    public Attributes() {
        this.values = new LinkedHashMap<>();
    }

    public Attributes(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public static Attributes of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keyValues.length + " arguments");
        }
        Attributes attrs = new Attributes();
        for (int i = 0; i < keyValues.length; i += 2) {
            attrs.put((String) keyValues[i], keyValues[i + 1]);
        }
        return attrs;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Attributes put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    /**
     * Reads a string attribute. Byte arrays are decoded as UTF-8, which is how
     * TensorFlow stores {@code padding} and {@code data_format}.
     */
    public Optional<String> string(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof byte[] bytes) {
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        }
        return Optional.of(value.toString());
    }

    /**
     * Reads an integer attribute. A list attribute yields its first element,
     * matching converters that store scalars like {@code axis} as {@code [3]}.
     */
    public Optional<Integer> integer(String key) {
        Object value = values.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.intValue());
        }
        List<Integer> list = toIntList(value);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * Reads a flat integer list attribute. Returns empty if the key is absent.
     */
    public Optional<List<Integer>> intList(String key) {
        if (!values.containsKey(key)) {
            return Optional.empty();
        }
        return Optional.of(toIntList(values.get(key)));
    }

    /**
     * Reads a possibly nested list attribute and flattens it in row-major order.
     */
    public Optional<List<Integer>> flatIntList(String key) {
        if (!values.containsKey(key)) {
            return Optional.empty();
        }
        List<Integer> out = new ArrayList<>();
        flatten(values.get(key), out);
        return Optional.of(out);
    }

    public Optional<Shape> shape(String key) {
        return intList(key).map(Shape::new);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public Attributes copy() {
        return new Attributes(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static List<Integer> toIntList(Object value) {
        List<Integer> out = new ArrayList<>();
        if (value instanceof Number n) {
            out.add(n.intValue());
        } else if (value instanceof int[] ints) {
            for (int i : ints) {
                out.add(i);
            }
        } else if (value instanceof long[] longs) {
            for (long l : longs) {
                out.add((int) l);
            }
        } else if (value instanceof List<?> list) {
            for (Object o : list) {
                if (o instanceof Number n) {
                    out.add(n.intValue());
                }
            }
        }
        return out;
    }

    private static void flatten(Object value, List<Integer> out) {
        if (value instanceof List<?> list) {
            for (Object o : list) {
                flatten(o, out);
            }
        } else if (value instanceof Number || value instanceof int[] || value instanceof long[]) {
            out.addAll(toIntList(value));
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
