package io.surfworks.kerneldetect.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import io.surfworks.kerneldetect.KernelDetectException;
import io.surfworks.kerneldetect.fusion.FusibilityTable;
import io.surfworks.kerneldetect.fusion.FusionPolicy;
import io.surfworks.kerneldetect.fusion.FusionUnit;
import io.surfworks.kerneldetect.fusion.Multiplicity;
import io.surfworks.kerneldetect.fusion.RuleFlags;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads {@link FusionPolicy} documents.
 *
 * <p>Two formats are understood:
 * <ul>
 *   <li>Policy documents with {@code fusionUnits}, {@code fusible} and
 *       {@code rules} sections.</li>
 *   <li>Rule-test results as produced by the backend fusion-rule tester:
 *       {@code BF_<producer>_<consumer>}, {@code MON} and {@code RT} entries,
 *       each holding an {@code obey} value. Operator names in these entries
 *       are short names such as {@code conv} or {@code relu} and are mapped
 *       to graph op types.</li>
 * </ul>
 *
 * <p>Malformed documents are rejected with a {@link KernelDetectException}.
 */
public final class FusionPolicyLoader {

    private static final Logger LOG = Logger.getLogger(FusionPolicyLoader.class.getName());

    private static final String BASIC_FUSION_PREFIX = "BF_";

    /**
     * Short operator names used in rule-test results, mapped to the op types
     * they stand for in a graph.
     */
    static final Map<String, List<String>> OPERATOR_ALIASES = Map.ofEntries(
            Map.entry("conv", List.of("Conv2D")),
            Map.entry("dwconv", List.of("DepthwiseConv2dNative")),
            Map.entry("bn", List.of("FusedBatchNorm", "FusedBatchNormV3")),
            Map.entry("bias", List.of("BiasAdd")),
            Map.entry("relu", List.of("Relu")),
            Map.entry("relu6", List.of("Relu6")),
            Map.entry("sigmoid", List.of("Sigmoid")),
            Map.entry("tanh", List.of("Tanh")),
            Map.entry("add", List.of("Add", "AddV2")),
            Map.entry("mul", List.of("Mul")),
            Map.entry("fc", List.of("MatMul")),
            Map.entry("maxpool", List.of("MaxPool")),
            Map.entry("avgpool", List.of("AvgPool")),
            Map.entry("global-avgpool", List.of("Mean")),
            Map.entry("concat", List.of("ConcatV2")),
            Map.entry("reshape", List.of("Reshape")),
            Map.entry("split", List.of("Split")),
            Map.entry("transpose", List.of("Transpose")));

    private FusionPolicyLoader() {}

    /**
     * Picks the policy configured through {@link DetectorConfig}: a policy
     * file, else a rule-test result file, else the bundled default.
     */
    public static FusionPolicy resolve() {
        Optional<Path> policyFile = DetectorConfig.policyFile();
        if (policyFile.isPresent()) {
            LOG.info("Using fusion policy " + policyFile.get());
            return load(policyFile.get());
        }
        Optional<Path> ruleFile = DetectorConfig.ruleFile();
        if (ruleFile.isPresent()) {
            LOG.info("Using fusion rule results " + ruleFile.get());
            return loadRuleResults(ruleFile.get());
        }
        LOG.fine("Using bundled fusion policy");
        return loadDefault();
    }

    /**
     * The policy bundled on the classpath.
     */
    public static FusionPolicy loadDefault() {
        InputStream in = FusionPolicyLoader.class.getResourceAsStream(DetectorConfig.DEFAULT_POLICY_RESOURCE);
        if (in == null) {
            throw new KernelDetectException("Missing resource " + DetectorConfig.DEFAULT_POLICY_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new KernelDetectException("Failed to read " + DetectorConfig.DEFAULT_POLICY_RESOURCE, e);
        }
    }

    public static FusionPolicy load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new KernelDetectException("Failed to read fusion policy " + path, e);
        }
    }

    public static FusionPolicy parse(String json) {
        return parse(new StringReader(json));
    }

    /**
     * Parses a policy document. Missing sections default to empty, and
     * missing rules to {@link RuleFlags#DEFAULT}.
     */
    public static FusionPolicy parse(Reader reader) {
        JsonObject root = readObject(reader);
        try {
            List<FusionUnit> units = new ArrayList<>();
            JsonArray unitArray = arrayOrEmpty(root, "fusionUnits");
            for (JsonElement element : unitArray) {
                units.add(parseUnit(element.getAsJsonObject()));
            }

            FusibilityTable.Builder table = FusibilityTable.builder();
            for (JsonElement element : arrayOrEmpty(root, "fusible")) {
                JsonArray pair = element.getAsJsonArray();
                if (pair.size() != 2) {
                    throw new KernelDetectException("Fusible entry must be a [producer, consumer] pair: " + pair);
                }
                table.allow(pair.get(0).getAsString(), pair.get(1).getAsString());
            }

            RuleFlags flags = RuleFlags.DEFAULT;
            if (root.has("rules")) {
                flags = parseFlags(root.getAsJsonObject("rules"));
            }

            FusionPolicy policy = new FusionPolicy(units, table.build(), flags);
            LOG.fine("Loaded " + policy);
            return policy;
        } catch (IllegalStateException | IllegalArgumentException | UnsupportedOperationException | ClassCastException e) {
            throw new KernelDetectException("Invalid fusion policy: " + e.getMessage(), e);
        }
    }

    public static FusionPolicy loadRuleResults(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseRuleResults(reader);
        } catch (IOException e) {
            throw new KernelDetectException("Failed to read rule results " + path, e);
        }
    }

    public static FusionPolicy parseRuleResults(String json) {
        return parseRuleResults(new StringReader(json));
    }

    /**
     * Builds a policy from rule-test results.
     *
     * <p>A {@code BF_a_b} entry that is obeyed makes every op type of
     * {@code a} fusible into every op type of {@code b}. An obeyed entry naming
     * three or more operators becomes a chain template instead. {@code MON}
     * gives the multiplicity code and {@code RT} the readiness switch.
     */
    public static FusionPolicy parseRuleResults(Reader reader) {
        JsonObject root = readObject(reader);
        FusibilityTable.Builder table = FusibilityTable.builder();
        List<FusionUnit> units = new ArrayList<>();
        RuleFlags flags = RuleFlags.DEFAULT;

        try {
            for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
                String name = entry.getKey();
                JsonElement obey = obeyValue(name, entry.getValue());

                if (name.equals("MON")) {
                    flags = flags.withMultiplicity(Multiplicity.fromCode(obey.getAsInt()));
                } else if (name.equals("RT")) {
                    flags = flags.withRequireReady(obey.getAsBoolean());
                } else if (name.startsWith(BASIC_FUSION_PREFIX)) {
                    if (!obey.getAsBoolean()) {
                        continue;
                    }
                    List<String> operators = Arrays.asList(name.substring(BASIC_FUSION_PREFIX.length()).split("_"));
                    if (operators.size() < 2 || operators.stream().anyMatch(String::isEmpty)) {
                        throw new KernelDetectException("Cannot read operators from rule " + name);
                    }
                    if (operators.size() == 2) {
                        for (String producer : opTypes(operators.get(0))) {
                            for (String consumer : opTypes(operators.get(1))) {
                                table.allow(producer, consumer);
                            }
                        }
                    } else {
                        units.add(chainUnit(operators));
                    }
                } else {
                    LOG.fine("Ignoring rule " + name);
                }
            }
        } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException | ClassCastException e) {
            throw new KernelDetectException("Invalid rule results: " + e.getMessage(), e);
        }

        FusionPolicy policy = new FusionPolicy(units, table.build(), flags);
        LOG.fine("Loaded rule results as " + policy);
        return policy;
    }

    /**
     * Graph op types a rule-test operator name stands for.
     */
    static List<String> opTypes(String operator) {
        return OPERATOR_ALIASES.getOrDefault(operator.toLowerCase(Locale.ROOT), List.of(operator));
    }

    private static FusionUnit chainUnit(List<String> operators) {
        FusionUnit.Builder builder = FusionUnit.builder(String.join("-", operators));
        for (int i = 0; i < operators.size(); i++) {
            builder.alias("op" + i, opTypes(operators.get(i)).toArray(new String[0]));
            if (i > 0) {
                builder.edge("op" + (i - 1), "op" + i);
            }
        }
        return builder.build();
    }

    private static FusionUnit parseUnit(JsonObject object) {
        if (!object.has("name") || !object.has("nodes")) {
            throw new KernelDetectException("Fusion unit needs 'name' and 'nodes': " + object);
        }
        FusionUnit.Builder builder = FusionUnit.builder(object.get("name").getAsString());
        for (Map.Entry<String, JsonElement> node : object.getAsJsonObject("nodes").entrySet()) {
            JsonElement value = node.getValue();
            List<String> types = new ArrayList<>();
            if (value.isJsonArray()) {
                value.getAsJsonArray().forEach(t -> types.add(t.getAsString()));
            } else {
                types.add(value.getAsString());
            }
            builder.alias(node.getKey(), types.toArray(new String[0]));
        }
        for (JsonElement element : arrayOrEmpty(object, "edges")) {
            JsonArray edge = element.getAsJsonArray();
            if (edge.size() != 2) {
                throw new KernelDetectException("Fusion unit edge must be a [from, to] pair: " + edge);
            }
            builder.edge(edge.get(0).getAsString(), edge.get(1).getAsString());
        }
        return builder.build();
    }

    private static RuleFlags parseFlags(JsonObject rules) {
        RuleFlags flags = RuleFlags.DEFAULT;
        if (rules.has("multiplicity")) {
            JsonPrimitive value = rules.getAsJsonPrimitive("multiplicity");
            Multiplicity multiplicity = value.isNumber()
                    ? Multiplicity.fromCode(value.getAsInt())
                    : Multiplicity.valueOf(value.getAsString().toUpperCase(Locale.ROOT));
            flags = flags.withMultiplicity(multiplicity);
        }
        if (rules.has("requireReady")) {
            flags = flags.withRequireReady(rules.get("requireReady").getAsBoolean());
        }
        return flags;
    }

    // Accepts both {"obey": v} and a bare v.
    private static JsonElement obeyValue(String name, JsonElement value) {
        if (value.isJsonObject()) {
            JsonElement obey = value.getAsJsonObject().get("obey");
            if (obey == null || obey.isJsonNull()) {
                throw new KernelDetectException("Rule " + name + " has no 'obey' value");
            }
            return obey;
        }
        return value;
    }

    private static JsonArray arrayOrEmpty(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || value.isJsonNull()) {
            return new JsonArray();
        }
        return value.getAsJsonArray();
    }

    private static JsonObject readObject(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new KernelDetectException("Malformed JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new KernelDetectException("Expected a JSON object, got " + root);
        }
        return root.getAsJsonObject();
    }
}
