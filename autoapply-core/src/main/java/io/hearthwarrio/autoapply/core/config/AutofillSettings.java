package io.hearthwarrio.autoapply.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable set of tuning values.
 * <p>
 * Resolution order (later wins):
 * <ul>
 *   <li>classpath {@code autoapply-defaults.json}</li>
 *   <li>an optional user JSON file with any subset of keys</li>
 *   <li>{@code autoapply.<key>} system properties</li>
 * </ul>
 */
public final class AutofillSettings {

    public static final String DEFAULTS_RESOURCE = "autoapply-defaults.json";
    public static final String PROPERTY_PREFIX = "autoapply.";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Setting, Double> values;

    private AutofillSettings(Map<Setting, Double> values) {
        this.values = values;
    }

    /**
     * Classpath defaults only, without system property overrides.
     */
    public static AutofillSettings defaults() {
        return new AutofillSettings(readDefaults());
    }

    /**
     * Defaults, then the optional overlay file, then system properties.
     *
     * @param overlay user file; may be null
     */
    public static AutofillSettings load(Path overlay) {
        EnumMap<Setting, Double> v = readDefaults();
        if (overlay != null) {
            try (InputStream in = Files.newInputStream(overlay)) {
                apply(v, MAPPER.readTree(in), overlay.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read settings file " + overlay, e);
            }
        }
        applyProperties(v, System.getProperties());
        return new AutofillSettings(v);
    }

    public AutofillSettings with(Setting setting, double value) {
        EnumMap<Setting, Double> v = new EnumMap<>(values);
        v.put(Objects.requireNonNull(setting, "setting must not be null"), value);
        return new AutofillSettings(v);
    }

    public int getInt(Setting setting) {
        return (int) Math.round(values.get(setting));
    }

    public double getDouble(Setting setting) {
        return values.get(setting);
    }

    public Duration seconds(Setting setting) {
        return Duration.ofMillis(Math.round(values.get(setting) * 1000));
    }

    public Duration minutes(Setting setting) {
        return Duration.ofSeconds(Math.round(values.get(setting) * 60));
    }

    private static EnumMap<Setting, Double> readDefaults() {
        EnumMap<Setting, Double> v = new EnumMap<>(Setting.class);
        try (InputStream in = AutofillSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            apply(v, MAPPER.readTree(in), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
        for (Setting s : Setting.values()) {
            if (!v.containsKey(s)) {
                throw new ConfigurationException(DEFAULTS_RESOURCE + " has no value for '" + s.key() + "'");
            }
        }
        return v;
    }

    private static void apply(EnumMap<Setting, Double> target, JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException(source + " must contain a JSON object");
        }
        for (Setting s : Setting.values()) {
            JsonNode n = root.get(s.key());
            if (n == null || n.isNull()) {
                continue;
            }
            if (!n.isNumber()) {
                throw new ConfigurationException(source + ": '" + s.key() + "' must be a number");
            }
            target.put(s, n.asDouble());
        }
    }

    static void applyProperties(EnumMap<Setting, Double> target, Properties properties) {
        for (Setting s : Setting.values()) {
            String raw = properties.getProperty(PROPERTY_PREFIX + s.key());
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                target.put(s, Double.parseDouble(raw.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("System property " + PROPERTY_PREFIX + s.key()
                        + " is not a number: " + raw, e);
            }
        }
    }
}
