package io.hearthwarrio.autoapply.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.hearthwarrio.autoapply.core.model.SectionCategory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only applicant profile.
 * <p>
 * Top-level keys hold contact values ("First Name", "Email", ...). Repeated sections
 * ("Work Experience", "Education") are arrays indexed by the 1-based section ordinal the
 * extractor assigns. Self-identification answers live under {@link #SELF_IDENTIFICATION}.
 */
public final class Profile {

    public static final String RESUME = "Resume";
    public static final String SELF_IDENTIFICATION = "Self Identification";
    public static final String SEARCH_TERMS = "Search Terms";
    public static final String EMAIL = "Email";
    public static final String PASSWORD = "Password";
    public static final String CITY = "City";
    public static final String STATE = "State";
    public static final String COUNTRY = "Country";
    public static final String PHONE_DEVICE_TYPE = "Phone Device Type";
    public static final String SALARY_EXPECTATION = "Salary Expectation";

    private final JsonNode root;

    Profile(JsonNode root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        if (!root.isObject()) {
            throw new ConfigurationException("profile must be a JSON object");
        }
    }

    public boolean has(String key) {
        JsonNode n = root.get(key);
        return n != null && !n.isNull() && !n.asText().isEmpty();
    }

    /**
     * @return top-level value as text, or an empty string
     */
    public String text(String key) {
        return asText(root.get(key));
    }

    public int entryCount(SectionCategory category) {
        JsonNode n = root.get(category.label());
        return n != null && n.isArray() ? n.size() : 0;
    }

    /**
     * @param ordinal 1-based section ordinal
     * @return value of the entry's key as text, or an empty string when the entry or the key is missing
     */
    public String entryValue(SectionCategory category, int ordinal, String key) {
        return asText(entry(category, ordinal).get(key));
    }

    public boolean entryFlag(SectionCategory category, int ordinal, String key) {
        JsonNode n = entry(category, ordinal).get(key);
        if (n == null || n.isNull()) {
            return false;
        }
        return n.isBoolean() ? n.booleanValue() : "true".equalsIgnoreCase(n.asText().trim());
    }

    /**
     * String array stored in an entry (e.g. "Degree Aliases"); empty when missing.
     */
    public List<String> entryList(SectionCategory category, int ordinal, String key) {
        return asList(entry(category, ordinal).get(key));
    }

    /**
     * Alternative texts to type into a search box for an entry value, in priority order.
     * Falls back to the value itself.
     */
    public List<String> searchTerms(SectionCategory category, int ordinal, String subtype) {
        List<String> terms = asList(entry(category, ordinal).path(SEARCH_TERMS).get(subtype));
        if (!terms.isEmpty()) {
            return terms;
        }
        String v = entryValue(category, ordinal, subtype);
        return v.isEmpty() ? List.of() : List.of(v);
    }

    /**
     * Preferred answer for a self-identification question (e.g. "Gender", "Veteran Status").
     */
    public String selfIdentification(String key) {
        return asText(root.path(SELF_IDENTIFICATION).get(key));
    }

    public Optional<Path> resumePath() {
        String v = text(RESUME);
        return v.isBlank() ? Optional.empty() : Optional.of(Path.of(v.trim()));
    }

    private JsonNode entry(SectionCategory category, int ordinal) {
        JsonNode arr = root.get(category.label());
        if (arr == null || !arr.isArray() || ordinal < 1 || ordinal > arr.size()) {
            return MissingNode.getInstance();
        }
        return arr.get(ordinal - 1);
    }

    private static String asText(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode() || n.isContainerNode()) {
            return "";
        }
        return n.asText();
    }

    private static List<String> asList(JsonNode n) {
        if (n == null || !n.isArray()) {
            return List.of();
        }
        List<String> out = new ArrayList<>(n.size());
        n.forEach(v -> out.add(v.asText()));
        return List.copyOf(out);
    }
}
