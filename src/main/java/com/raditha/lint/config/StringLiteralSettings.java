package com.raditha.lint.config;

import com.raditha.lint.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads string literal rule configuration from YAML.
 *
 * <pre>
 * string_literal:
 *   preset: java
 *   severity: error
 *   min_length: 3
 *   whitelist:
 *     exact: [print]
 *     suffix: [.localizedStringForKey]
 *     prefix: [XCTAssert]
 * </pre>
 *
 * Explicit keys override the preset; each whitelist table given replaces the
 * preset's table of the same name.
 */
public class StringLiteralSettings {

    private static final Logger logger = LoggerFactory.getLogger(StringLiteralSettings.class);

    private static final String CONFIG_KEY = "string_literal";

    private StringLiteralSettings() {
    }

    /**
     * Load configuration from a YAML file.
     *
     * @param file YAML file
     * @return configuration, the defaults when the file has no rule section
     * @throws IOException if the file cannot be read
     */
    public static StringLiteralConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file)) {
            return fromYaml(reader);
        }
    }

    /**
     * Load configuration from YAML text.
     */
    public static StringLiteralConfig fromYaml(Reader reader) {
        Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Malformed configuration: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            return StringLiteralConfig.defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> root = (Map<String, Object>) document;
        return fromMap(root);
    }

    /**
     * Build configuration from an already parsed settings map.
     *
     * @param settings top-level settings, the rule section is read from
     *                 {@code string_literal}
     */
    public static StringLiteralConfig fromMap(Map<String, Object> settings) {
        Object section = settings.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return StringLiteralConfig.defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;

        StringLiteralConfig base = preset(getString(config, "preset", null));

        Severity severity = parseSeverity(getString(config, "severity", null), base.severity());
        int minLength = getInt(config, "min_length", base.minimumTokenLength());
        CallWhitelist whitelist = buildWhitelist(config, base.whitelist());

        return new StringLiteralConfig(whitelist, severity, minLength);
    }

    private static StringLiteralConfig preset(String name) {
        if (name == null) {
            return StringLiteralConfig.defaults();
        }
        return switch (name) {
            case "java" -> StringLiteralConfig.java();
            case "default" -> StringLiteralConfig.defaults();
            default -> {
                logger.warn("Unknown preset '{}', using defaults", name);
                yield StringLiteralConfig.defaults();
            }
        };
    }

    private static Severity parseSeverity(String value, Severity defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown severity '{}', using {}", value, defaultValue);
            return defaultValue;
        }
    }

    private static CallWhitelist buildWhitelist(Map<String, Object> config, CallWhitelist base) {
        Object whitelistObj = config.get("whitelist");
        if (whitelistObj instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> tables = (Map<String, Object>) whitelistObj;
            return new CallWhitelist(
                    getListString(tables, "exact", base.exact()),
                    getListString(tables, "suffix", base.suffix()),
                    getListString(tables, "prefix", base.prefix()));
        }
        return base;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return defaultValue;
    }
}
