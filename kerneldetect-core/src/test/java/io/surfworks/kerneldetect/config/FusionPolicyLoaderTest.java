package io.surfworks.kerneldetect.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.surfworks.kerneldetect.KernelDetectException;
import io.surfworks.kerneldetect.fusion.FusionPolicy;
import io.surfworks.kerneldetect.fusion.FusionUnit;
import io.surfworks.kerneldetect.fusion.Multiplicity;
import io.surfworks.kerneldetect.fusion.RuleFlags;

@DisplayName("FusionPolicyLoader")
class FusionPolicyLoaderTest {

    private static final String POLICY = """
            {
              "fusionUnits": [
                {"name": "conv-bn-relu",
                 "nodes": {"conv": ["Conv2D"], "bn": ["FusedBatchNormV3"], "relu": "Relu"},
                 "edges": [["conv", "bn"], ["bn", "relu"]]}
              ],
              "fusible": [["Conv2D", "BiasAdd"], ["BiasAdd", "Relu"]],
              "rules": {"multiplicity": "first_consumer", "requireReady": true}
            }
            """;

    @BeforeEach
    void setUp() {
        DetectorConfig.reset();
    }

    @AfterEach
    void tearDown() {
        DetectorConfig.reset();
    }

    @Nested
    @DisplayName("Policy documents")
    class PolicyDocuments {

        @Test
        @DisplayName("all sections are read")
        void fullDocument() {
            FusionPolicy policy = FusionPolicyLoader.parse(POLICY);

            assertEquals(1, policy.fusionUnits().size());
            FusionUnit unit = policy.fusionUnits().get(0);
            assertEquals("conv-bn-relu", unit.name());
            assertEquals(Set.of("Relu"), unit.aliases().get("relu"));
            assertEquals(List.of(new FusionUnit.Edge("conv", "bn"), new FusionUnit.Edge("bn", "relu")), unit.edges());
            assertTrue(policy.fusibility().isFusible("Conv2D", "BiasAdd"));
            assertFalse(policy.fusibility().isFusible("BiasAdd", "Conv2D"));
            assertEquals(new RuleFlags(Multiplicity.FIRST_CONSUMER, true), policy.flags());
        }

        @Test
        @DisplayName("missing sections default to empty")
        void emptyDocument() {
            FusionPolicy policy = FusionPolicyLoader.parse("{}");

            assertTrue(policy.fusionUnits().isEmpty());
            assertEquals(0, policy.fusibility().size());
            assertEquals(RuleFlags.DEFAULT, policy.flags());
        }

        @Test
        @DisplayName("multiplicity may be given as a numeric code")
        void numericMultiplicity() {
            FusionPolicy policy = FusionPolicyLoader.parse("{\"rules\": {\"multiplicity\": 2}}");

            assertEquals(Multiplicity.ALL_CONSUMERS, policy.flags().multiplicity());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "not json {",
                "[1, 2]",
                "{\"fusible\": [[\"Conv2D\"]]}",
                "{\"fusible\": {\"Conv2D\": \"Relu\"}}",
                "{\"fusionUnits\": [{\"name\": \"x\", \"nodes\": {\"a\": [\"Relu\"]}, \"edges\": [[\"a\", \"b\"]]}]}",
                "{\"fusionUnits\": [{\"nodes\": {\"a\": [\"Relu\"]}}]}",
                "{\"rules\": {\"multiplicity\": \"SOMETIMES\"}}"
        })
        @DisplayName("invalid documents are rejected")
        void invalidDocuments(String json) {
            assertThrows(KernelDetectException.class, () -> FusionPolicyLoader.parse(json));
        }

        @Test
        @DisplayName("bundled default covers convolution chains")
        void bundledDefault() {
            FusionPolicy policy = FusionPolicyLoader.loadDefault();

            assertFalse(policy.fusionUnits().isEmpty());
            assertTrue(policy.fusibility().isFusible("Conv2D", "BiasAdd"));
            assertTrue(policy.fusibility().isFusible("BiasAdd", "Relu"));
            assertEquals(RuleFlags.DEFAULT, policy.flags());
        }

        @Test
        @DisplayName("missing file is reported")
        void missingFile(@TempDir Path dir) {
            assertThrows(KernelDetectException.class, () -> FusionPolicyLoader.load(dir.resolve("absent.json")));
        }
    }

    @Nested
    @DisplayName("Rule-test results")
    class RuleResults {

        private FusionPolicy fromResource() throws IOException {
            try (InputStream in = getClass().getResourceAsStream("/mobilenet-rules.json");
                 Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return FusionPolicyLoader.parseRuleResults(reader);
            }
        }

        @Test
        @DisplayName("obeyed pairs become fusible for every aliased op type")
        void obeyedPairs() throws IOException {
            FusionPolicy policy = fromResource();

            assertTrue(policy.fusibility().isFusible("Conv2D", "Relu"));
            assertTrue(policy.fusibility().isFusible("DepthwiseConv2dNative", "Relu6"));
            assertTrue(policy.fusibility().isFusible("Add", "Relu"));
            assertTrue(policy.fusibility().isFusible("AddV2", "Relu"));
            assertFalse(policy.fusibility().isFusible("Conv2D", "FusedBatchNormV3"));
        }

        @Test
        @DisplayName("unknown operator names are used verbatim")
        void unknownNamesVerbatim() throws IOException {
            assertTrue(fromResource().fusibility().isFusible("FancyOp", "Relu"));
        }

        @Test
        @DisplayName("longer rules become chain templates")
        void chainTemplates() throws IOException {
            FusionPolicy policy = fromResource();

            assertEquals(1, policy.fusionUnits().size());
            FusionUnit unit = policy.fusionUnits().get(0);
            assertEquals("conv-bn-relu", unit.name());
            assertEquals(3, unit.size());
            assertEquals(Set.of("FusedBatchNorm", "FusedBatchNormV3"), unit.aliases().get("op1"));
        }

        @Test
        @DisplayName("MON and RT set the rule flags")
        void flags() throws IOException {
            assertEquals(new RuleFlags(Multiplicity.FIRST_CONSUMER, false), fromResource().flags());
            assertEquals(Multiplicity.SINGLE_CONSUMER,
                    FusionPolicyLoader.parseRuleResults("{\"MON\": 0, \"RT\": true}").flags().multiplicity());
            assertTrue(FusionPolicyLoader.parseRuleResults("{\"RT\": {\"obey\": true}}").flags().requireReady());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"BF_conv\": {\"obey\": true}}",
                "{\"BF_conv__relu\": {\"obey\": true}}",
                "{\"MON\": {\"obey\": true}}",
                "{\"MON\": {}}"
        })
        @DisplayName("unreadable rules are rejected")
        void invalidRules(String json) {
            assertThrows(KernelDetectException.class, () -> FusionPolicyLoader.parseRuleResults(json));
        }

        @Test
        @DisplayName("operator aliases are case-insensitive")
        void aliasLookup() {
            assertEquals(List.of("Conv2D"), FusionPolicyLoader.opTypes("CONV"));
            assertEquals(List.of("Softmax"), FusionPolicyLoader.opTypes("Softmax"));
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("configured policy file wins over rule file")
        void policyFileWins(@TempDir Path dir) throws IOException {
            Path policy = Files.writeString(dir.resolve("policy.json"), POLICY);
            Path rules = Files.writeString(dir.resolve("rules.json"), "{\"MON\": 2}");
            DetectorConfig.usePolicyFile(policy);
            DetectorConfig.useRuleFile(rules);

            assertEquals(Multiplicity.FIRST_CONSUMER, FusionPolicyLoader.resolve().flags().multiplicity());
        }

        @Test
        @DisplayName("configured rule file is used when no policy file is set")
        void ruleFileUsed(@TempDir Path dir) throws IOException {
            Path rules = Files.writeString(dir.resolve("rules.json"), "{\"MON\": 2, \"BF_fc_relu\": true}");
            DetectorConfig.useRuleFile(rules);

            FusionPolicy policy = FusionPolicyLoader.resolve();

            assertEquals(Multiplicity.ALL_CONSUMERS, policy.flags().multiplicity());
            assertTrue(policy.fusibility().isFusible("MatMul", "Relu"));
        }
    }
}
