package io.hearthwarrio.autoapply.core.text;

import io.hearthwarrio.autoapply.core.config.ConfigurationException;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.LabelSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether label-like metadata is natural language worth asking about, or an internal
 * identifier ({@code workExperience--startDate}, {@code input-7f3a}) to discard.
 */
public final class TextRelevanceEvaluator {

    public static final String LEXICON_RESOURCE = "lexicon/english-words.txt";

    private static final Pattern SEPARATORS = Pattern.compile("[_\\-]+");
    private static final Pattern CAMEL = Pattern.compile("(?<=[a-z])(?=[A-Z])");
    private static final Pattern LETTER_DIGIT = Pattern.compile("(?<=[a-zA-Z])(?=[0-9])");
    private static final Pattern DIGIT_LETTER = Pattern.compile("(?<=[0-9])(?=[a-zA-Z])");
    private static final Pattern ALPHA_TOKEN = Pattern.compile("[a-zA-Z]{2,}");
    private static final Pattern HASH = Pattern.compile("[a-fA-F0-9]{32,}");
    private static final Pattern UUID = Pattern.compile(
            "[a-fA-F0-9]{8}-[a-fA-F0-9]{4}-[a-fA-F0-9]{4}-[a-fA-F0-9]{4}-[a-fA-F0-9]{12}");
    private static final Pattern IDENTIFIER_WORD = Pattern.compile("[_\\-]|[a-z][A-Z]|\\w+\\d+\\w*");

    private static final Set<String> TECHNICAL = Set.of(
            "id", "uuid", "input", "field", "div", "span", "btn", "src", "ref", "val", "idx", "elem", "el");

    private static final List<String> SUFFIXES = List.of(
            "ments", "ment", "ings", "ing", "ions", "ion", "ies", "ers", "er", "ed", "es", "ly", "al", "s");

    /**
     * Default token-ratio threshold for label relevance.
     */
    public static final double DEFAULT_THRESHOLD = 0.3;

    private static final int MIN_TOKEN_LENGTH = 3;

    private final Set<String> lexicon;

    public TextRelevanceEvaluator(Set<String> lexicon) {
        this.lexicon = Set.copyOf(Objects.requireNonNull(lexicon, "lexicon must not be null"));
    }

    /**
     * Evaluator over the bundled lexicon.
     */
    public static TextRelevanceEvaluator withBundledLexicon() {
        Set<String> words = new HashSet<>();
        try (InputStream in = TextRelevanceEvaluator.class.getClassLoader().getResourceAsStream(LEXICON_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Missing classpath resource " + LEXICON_RESOURCE);
            }
            BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = r.readLine()) != null) {
                String w = line.trim().toLowerCase(Locale.ROOT);
                if (!w.isEmpty() && !w.startsWith("#")) {
                    words.add(w);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + LEXICON_RESOURCE, e);
        }
        return new TextRelevanceEvaluator(words);
    }

    /**
     * @param threshold          share of tokens that must be valid English words
     * @param minWords           minimum number of valid words
     * @param minPhrases         minimum number of adjacent valid-word pairs
     * @param rejectIdentifiers  reject strings that look like identifiers as a whole
     */
    public boolean isRelevant(String text, double threshold, int minWords, int minPhrases, boolean rejectIdentifiers) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (rejectIdentifiers && isIdentifierLike(text)) {
            return false;
        }
        List<String> tokens = splitTokens(text);
        if (tokens.isEmpty()) {
            return false;
        }
        int valid = 0;
        int phrases = 0;
        boolean previousValid = false;
        for (String token : tokens) {
            boolean ok = !isTechnicalToken(token)
                    && ALPHA_TOKEN.matcher(token).matches()
                    && token.length() >= MIN_TOKEN_LENGTH
                    && isWord(token);
            if (ok) {
                valid++;
                if (previousValid) {
                    phrases++;
                }
            }
            previousValid = ok;
        }
        return (double) valid / tokens.size() >= threshold && valid >= minWords && phrases >= minPhrases;
    }

    /**
     * Label relevance as used for oracle questions: two valid words forming at least one phrase.
     */
    public boolean isRelevantLabel(String text, double threshold) {
        return isRelevant(text, threshold, 2, 1, true);
    }

    /**
     * Renders the relevant parts of a field's metadata, one "Kind: values" line each.
     *
     * @return rendered metadata, or an empty string when nothing is relevant
     */
    public String normalizedMetadata(FieldDescriptor field, double threshold) {
        Objects.requireNonNull(field, "field must not be null");
        List<String> lines = new ArrayList<>();

        Set<String> labels = new LinkedHashSet<>();
        for (LabelSource s : new LabelSource[]{LabelSource.TAG, LabelSource.TEXT, LabelSource.ATTRIBUTE, LabelSource.CUSTOM}) {
            String l = field.label(s);
            if (!l.isEmpty() && isRelevantLabel(l, threshold)) {
                labels.add(l);
            }
        }
        if (!labels.isEmpty()) {
            lines.add("Label(s): " + String.join(", ", labels));
        }

        Set<String> ids = new LinkedHashSet<>();
        for (String id : new String[]{field.getId(), field.getCustomId()}) {
            if (!id.isEmpty() && isRelevant(id, threshold, 2, 0, false)) {
                ids.add(id);
            }
        }
        if (!ids.isEmpty()) {
            lines.add("Id(s): " + String.join(", ", ids));
        }

        if (!field.getName().isEmpty() && isRelevant(field.getName(), threshold, 1, 0, false)) {
            lines.add("Name: " + field.getName());
        }
        if (!field.getPlaceholder().isEmpty() && isRelevant(field.getPlaceholder(), threshold, 1, 0, false)) {
            lines.add("Placeholder: " + field.getPlaceholder());
        }
        return String.join("\n", lines);
    }

    static List<String> splitTokens(String text) {
        String t = SEPARATORS.matcher(text).replaceAll(" ");
        t = CAMEL.matcher(t).replaceAll(" ");
        t = LETTER_DIGIT.matcher(t).replaceAll(" ");
        t = DIGIT_LETTER.matcher(t).replaceAll(" ");
        String lower = t.toLowerCase(Locale.ROOT).trim();
        if (lower.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String s : lower.split("\\s+")) {
            String w = s.replaceAll("^[^a-z0-9]+|[^a-z0-9]+$", "");
            if (!w.isEmpty()) {
                out.add(w);
            }
        }
        return out;
    }

    boolean isWord(String token) {
        if (lexicon.contains(token)) {
            return true;
        }
        for (String suffix : SUFFIXES) {
            if (token.length() > suffix.length() + 2 && token.endsWith(suffix)) {
                String stem = token.substring(0, token.length() - suffix.length());
                if (lexicon.contains(stem) || lexicon.contains(stem + "e")
                        || ("ies".equals(suffix) && lexicon.contains(stem + "y"))) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isTechnicalToken(String token) {
        if (token == null || token.isBlank()) {
            return true;
        }
        String t = token.strip();
        if (TECHNICAL.contains(t.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (HASH.matcher(t).matches() || UUID.matcher(t).matches()) {
            return true;
        }
        if (!t.chars().anyMatch(Character::isLetter)) {
            return true;
        }
        long digits = t.chars().filter(Character::isDigit).count();
        return digits * 2 > t.length();
    }

    /**
     * Whole-string check for machine-generated names (camelCase, snake_case, kebab-case, embedded digits).
     */
    static boolean isIdentifierLike(String text) {
        String t = text.strip();
        if (t.length() < 5) {
            return true;
        }
        List<String> words = Arrays.asList(t.split("\\s+"));
        List<String> identifierWords = new ArrayList<>();
        for (String w : words) {
            if (IDENTIFIER_WORD.matcher(w).find()) {
                identifierWords.add(w);
            }
        }
        if ((double) identifierWords.size() / words.size() > 0.3) {
            return true;
        }
        if (words.size() > 5 && identifierWords.size() == 1
                && words.get(words.size() - 1).equals(identifierWords.get(0))) {
            return false;
        }
        String compact = t.replaceAll("\\s+", "");
        long nonAlpha = compact.chars().filter(c -> !Character.isLetter(c)).count();
        return nonAlpha * 2 > compact.length() && words.size() <= 3;
    }
}
