package io.hearthwarrio.autoapply.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keyword, identifier and blacklist tables used by extraction, answering and navigation.
 * <p>
 * Loaded from the classpath resource {@code keyword-tables.json}; a user file may replace
 * individual tables (same JSON shape, any subset of keys).
 */
public final class KeywordTables {

    public static final String RESOURCE = "keyword-tables.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<KeywordTable, List<String>> tables;
    private final List<ProfileFieldRule> profileFieldRules;

    private KeywordTables(Map<KeywordTable, List<String>> tables, List<ProfileFieldRule> profileFieldRules) {
        this.tables = tables;
        this.profileFieldRules = profileFieldRules;
    }

    public static KeywordTables defaults() {
        return load(null);
    }

    /**
     * @param overlay user file replacing individual tables; may be null
     */
    public static KeywordTables load(Path overlay) {
        EnumMap<KeywordTable, List<String>> tables = new EnumMap<>(KeywordTable.class);
        List<ProfileFieldRule> rules = new ArrayList<>();

        try (InputStream in = KeywordTables.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Missing classpath resource " + RESOURCE);
            }
            read(MAPPER.readTree(in), RESOURCE, tables, rules);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + RESOURCE, e);
        }

        if (overlay != null) {
            try (InputStream in = Files.newInputStream(overlay)) {
                read(MAPPER.readTree(in), overlay.toString(), tables, rules);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read keyword tables " + overlay, e);
            }
        }

        for (KeywordTable t : KeywordTable.values()) {
            if (!tables.containsKey(t)) {
                throw new ConfigurationException(RESOURCE + " has no table '" + t.key() + "'");
            }
        }
        return new KeywordTables(tables, List.copyOf(rules));
    }

    private static void read(JsonNode root,
                             String source,
                             EnumMap<KeywordTable, List<String>> tables,
                             List<ProfileFieldRule> rules) throws IOException {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException(source + " must contain a JSON object");
        }
        JsonNode t = root.path("tables");
        for (KeywordTable table : KeywordTable.values()) {
            JsonNode n = t.get(table.key());
            if (n == null) {
                continue;
            }
            if (!n.isArray()) {
                throw new ConfigurationException(source + ": table '" + table.key() + "' must be an array");
            }
            List<String> values = new ArrayList<>(n.size());
            n.forEach(v -> values.add(v.asText()));
            tables.put(table, List.copyOf(values));
        }
        JsonNode r = root.get("profile_field_rules");
        if (r != null) {
            rules.clear();
            rules.addAll(MAPPER.readerFor(new TypeReference<List<ProfileFieldRule>>() {
            }).readValue(r));
        }
    }

    public List<String> get(KeywordTable table) {
        return tables.get(Objects.requireNonNull(table, "table must not be null"));
    }

    /**
     * Returns a copy with one table replaced. Mostly useful in tests.
     */
    public KeywordTables with(KeywordTable table, List<String> values) {
        EnumMap<KeywordTable, List<String>> t = new EnumMap<>(tables);
        t.put(table, List.copyOf(values));
        return new KeywordTables(t, profileFieldRules);
    }

    public List<ProfileFieldRule> profileFieldRules() {
        return profileFieldRules;
    }
}
