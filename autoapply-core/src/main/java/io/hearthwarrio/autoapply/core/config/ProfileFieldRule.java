package io.hearthwarrio.autoapply.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.hearthwarrio.autoapply.core.model.SearchKey;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a free-text field to a top-level profile value by label vocabulary.
 * <p>
 * Loaded from the {@code profile_field_rules} array of {@code keyword-tables.json}; rules are tried in file order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ProfileFieldRule {

    private final String profileKey;
    private final List<String> identifiers;
    private final List<SearchKey> keys;
    private final boolean caseSensitive;
    private final boolean normalizeWhitespace;
    private final boolean exact;
    private final boolean requiredOnly;
    private final List<String> vetoes;
    private final List<String> skipWhenOptionalAnd;
    private final List<String> alsoRequires;
    private final String fieldType;

    @JsonCreator
    public ProfileFieldRule(@JsonProperty("profileKey") String profileKey,
                            @JsonProperty("identifiers") List<String> identifiers,
                            @JsonProperty("keys") String keys,
                            @JsonProperty("caseSensitive") boolean caseSensitive,
                            @JsonProperty("normalizeWhitespace") boolean normalizeWhitespace,
                            @JsonProperty("exact") boolean exact,
                            @JsonProperty("requiredOnly") boolean requiredOnly,
                            @JsonProperty("vetoes") List<String> vetoes,
                            @JsonProperty("skipWhenOptionalAnd") List<String> skipWhenOptionalAnd,
                            @JsonProperty("alsoRequires") List<String> alsoRequires,
                            @JsonProperty("fieldType") String fieldType) {
        this.profileKey = Objects.requireNonNull(profileKey, "profileKey must not be null");
        this.identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
        this.keys = keyGroup(keys);
        this.caseSensitive = caseSensitive;
        this.normalizeWhitespace = normalizeWhitespace;
        this.exact = exact;
        this.requiredOnly = requiredOnly;
        this.vetoes = vetoes == null ? List.of() : List.copyOf(vetoes);
        this.skipWhenOptionalAnd = skipWhenOptionalAnd == null ? List.of() : List.copyOf(skipWhenOptionalAnd);
        this.alsoRequires = alsoRequires == null ? List.of() : List.copyOf(alsoRequires);
        this.fieldType = fieldType == null ? "" : fieldType;
    }

    private static List<SearchKey> keyGroup(String name) {
        String n = name == null ? "LABELS" : name.trim().toUpperCase(Locale.ROOT);
        return switch (n) {
            case "LABELS" -> SearchKey.LABELS;
            case "FIELD" -> SearchKey.FIELD;
            case "FIELD_AND_PLACEHOLDER" -> SearchKey.FIELD_AND_PLACEHOLDER;
            default -> throw new ConfigurationException("Unknown key group in profile field rule: " + name);
        };
    }

    public String getProfileKey() {
        return profileKey;
    }

    public List<String> getIdentifiers() {
        return identifiers;
    }

    public List<SearchKey> getKeys() {
        return keys;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public boolean isNormalizeWhitespace() {
        return normalizeWhitespace;
    }

    public boolean isExact() {
        return exact;
    }

    public boolean isRequiredOnly() {
        return requiredOnly;
    }

    /**
     * Identifiers that disqualify the rule (e.g. "Middle" for a full-name rule).
     */
    public List<String> getVetoes() {
        return vetoes;
    }

    /**
     * Identifiers that make an optional field not worth filling (e.g. "preferred" first name).
     */
    public List<String> getSkipWhenOptionalAnd() {
        return skipWhenOptionalAnd;
    }

    /**
     * At least one of these must also be present.
     */
    public List<String> getAlsoRequires() {
        return alsoRequires;
    }

    /**
     * Field type code that matches the rule on its own (e.g. "password"); empty for none.
     */
    public String getFieldType() {
        return fieldType;
    }
}
