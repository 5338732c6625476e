package io.surfworks.kerneldetect.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Configuration for kernel detection.
 *
 * <p>The bundled default fusion policy is used unless a policy file or a
 * rule-test result file is configured through the environment, a system
 * property or {@link #usePolicyFile(Path)} / {@link #useRuleFile(Path)}.
 * A policy file wins over a rule file.
 */
public final class DetectorConfig {

    /**
     * Environment variable naming a fusion policy JSON file.
     */
    public static final String ENV_POLICY_FILE = "KERNELDETECT_POLICY_FILE";

    /**
     * System property naming a fusion policy JSON file.
     */
    public static final String PROP_POLICY_FILE = "kerneldetect.policy.file";

    /**
     * Environment variable naming a rule-test result JSON file.
     */
    public static final String ENV_RULE_FILE = "KERNELDETECT_RULE_FILE";

    /**
     * System property naming a rule-test result JSON file.
     */
    public static final String PROP_RULE_FILE = "kerneldetect.rule.file";

    /**
     * Classpath location of the bundled policy.
     */
    public static final String DEFAULT_POLICY_RESOURCE = "/default-fusion-policy.json";

    // Programmatic overrides
    private static volatile Path policyFile;
    private static volatile Path ruleFile;

    private DetectorConfig() {}

    /**
     * The configured fusion policy file, if any.
     *
     * <p>Checked in order: {@link #usePolicyFile(Path)}, the
     * {@value #PROP_POLICY_FILE} system property, the {@value #ENV_POLICY_FILE}
     * environment variable.
     */
    public static Optional<Path> policyFile() {
        return resolve(policyFile, PROP_POLICY_FILE, ENV_POLICY_FILE);
    }

    /**
     * The configured rule-test result file, if any, checked in the same order
     * as {@link #policyFile()}.
     */
    public static Optional<Path> ruleFile() {
        return resolve(ruleFile, PROP_RULE_FILE, ENV_RULE_FILE);
    }

    /**
     * Use the given policy file regardless of environment and properties.
     */
    public static void usePolicyFile(Path path) {
        policyFile = path;
    }

    /**
     * Use the given rule-test result file regardless of environment and properties.
     */
    public static void useRuleFile(Path path) {
        ruleFile = path;
    }

    private static Optional<Path> resolve(Path override, String property, String env) {
        if (override != null) {
            return Optional.of(override);
        }
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(value.trim()));
    }

    /**
     * Reset state (for testing).
     */
    static void reset() {
        policyFile = null;
        ruleFile = null;
    }
}
