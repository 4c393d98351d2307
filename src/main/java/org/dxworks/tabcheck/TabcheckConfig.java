package org.dxworks.tabcheck;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.tabcheck.model.Rule;
import org.dxworks.tabcheck.model.Severity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class TabcheckConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "tabcheck-config.yml";
    private static final List<String> DEFAULT_SCOPE_METHODS = List.of("InitializeComponent");

    private final int maxFileLines;
    private final Set<String> scopeMethods;
    private final List<String> excludes;
    private final Set<Rule> disabledRules;
    private final Map<Rule, Severity> severities;

    private TabcheckConfig(int maxFileLines, Set<String> scopeMethods, List<String> excludes,
                           Set<Rule> disabledRules, Map<Rule, Severity> severities) {
        this.maxFileLines = maxFileLines;
        this.scopeMethods = Collections.unmodifiableSet(new LinkedHashSet<>(scopeMethods));
        this.excludes = List.copyOf(excludes);
        this.disabledRules = disabledRules.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(disabledRules));
        this.severities = severities.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(severities));
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Names of the methods whose bodies are analyzed.
     */
    public Set<String> getScopeMethods() {
        return scopeMethods;
    }

    public List<String> getExcludes() {
        return excludes;
    }

    public boolean isRuleEnabled(Rule rule) {
        return !disabledRules.contains(rule);
    }

    public Severity severityOf(Rule rule) {
        return severities.getOrDefault(rule, rule.getDefaultSeverity());
    }

    public static TabcheckConfig defaults() {
        return new TabcheckConfig(DEFAULT_MAX_FILE_LINES, new LinkedHashSet<>(DEFAULT_SCOPE_METHODS),
                List.of(), EnumSet.noneOf(Rule.class), new EnumMap<>(Rule.class));
    }

    public static TabcheckConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static TabcheckConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig, configPath);
            }
        } catch (IOException e) {
            System.err.println("Warning: Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    private static TabcheckConfig fromYaml(YamlConfig yamlConfig, Path configPath) {
        int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                ? yamlConfig.maxFileLines
                : DEFAULT_MAX_FILE_LINES;

        Set<String> effectiveScopeMethods = new LinkedHashSet<>();
        if (yamlConfig.scopeMethods != null) {
            for (String method : yamlConfig.scopeMethods) {
                if (method != null && !method.isBlank()) {
                    effectiveScopeMethods.add(method.trim());
                }
            }
        }
        if (effectiveScopeMethods.isEmpty()) {
            effectiveScopeMethods.addAll(DEFAULT_SCOPE_METHODS);
        }

        List<String> effectiveExcludes = yamlConfig.excludes != null ? yamlConfig.excludes : List.of();

        Set<Rule> disabled = EnumSet.noneOf(Rule.class);
        Map<Rule, Severity> severities = new EnumMap<>(Rule.class);
        if (yamlConfig.rules != null) {
            for (Map.Entry<String, YamlRule> entry : yamlConfig.rules.entrySet()) {
                Optional<Rule> rule = Rule.fromKey(entry.getKey());
                if (rule.isEmpty()) {
                    System.err.println("Warning: Unknown rule '" + entry.getKey() + "' in " + configPath);
                    continue;
                }
                YamlRule yamlRule = entry.getValue();
                if (yamlRule == null) {
                    continue;
                }
                if (Boolean.FALSE.equals(yamlRule.enabled)) {
                    disabled.add(rule.get());
                }
                if (yamlRule.severity != null) {
                    Optional<Severity> severity = Severity.fromName(yamlRule.severity);
                    if (severity.isPresent()) {
                        severities.put(rule.get(), severity.get());
                    } else {
                        System.err.println("Warning: Unknown severity '" + yamlRule.severity
                                + "' for rule " + rule.get().getId() + " in " + configPath);
                    }
                }
            }
        }

        return new TabcheckConfig(effectiveMaxFileLines, effectiveScopeMethods, effectiveExcludes, disabled, severities);
    }

    public static TabcheckConfig with(int maxFileLines, Set<String> scopeMethods) {
        return with(maxFileLines, scopeMethods, EnumSet.noneOf(Rule.class), new EnumMap<>(Rule.class));
    }

    public static TabcheckConfig with(int maxFileLines, Set<String> scopeMethods,
                                     Set<Rule> disabledRules, Map<Rule, Severity> severities) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        Set<String> effectiveScopeMethods = (scopeMethods == null || scopeMethods.isEmpty())
                ? new LinkedHashSet<>(DEFAULT_SCOPE_METHODS)
                : scopeMethods;
        return new TabcheckConfig(effectiveMaxFileLines, effectiveScopeMethods, List.of(),
                disabledRules, severities);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<String> scopeMethods;
        public List<String> excludes;
        public Map<String, YamlRule> rules;
    }

    private static class YamlRule {
        public Boolean enabled;
        public String severity;
    }
}
