package io.hearthwarrio.autoapply.runner;

import io.hearthwarrio.autoapply.core.config.ConfigurationException;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Environment variables read by the runner.
 */
public final class RunnerEnvironment {

    public static final String JOB_API_URL = "AUTOAPPLY_JOB_API_URL";
    public static final String ORACLE_URL = "AUTOAPPLY_ORACLE_URL";
    public static final String PROFILE = "AUTOAPPLY_PROFILE";
    public static final String REMOTE_URL = "AUTOAPPLY_REMOTE_URL";
    public static final String SETTINGS = "AUTOAPPLY_SETTINGS";
    public static final String KEYWORDS = "AUTOAPPLY_KEYWORDS";
    public static final String DECISION_LOG = "AUTOAPPLY_DECISION_LOG";
    public static final String BROWSER_BINARY = "AUTOAPPLY_BROWSER_BINARY";
    public static final String HEADLESS = "AUTOAPPLY_HEADLESS";

    static final String DEFAULT_JOB_API_URL = "http://127.0.0.1:8000";
    static final List<String> DECISION_LOGS = List.of("stdout", "allure", "none");

    private final Map<String, String> env;

    public RunnerEnvironment(Map<String, String> env) {
        this.env = Map.copyOf(Objects.requireNonNull(env, "env must not be null"));
    }

    public static RunnerEnvironment system() {
        return new RunnerEnvironment(System.getenv());
    }

    public URI jobApiUrl() {
        return uri(JOB_API_URL, optional(JOB_API_URL).orElse(DEFAULT_JOB_API_URL));
    }

    public URI oracleUrl() {
        return uri(ORACLE_URL, required(ORACLE_URL));
    }

    public Path profile() {
        return Path.of(required(PROFILE));
    }

    public Optional<Path> settingsOverlay() {
        return optional(SETTINGS).map(Path::of);
    }

    public Optional<Path> keywordOverlay() {
        return optional(KEYWORDS).map(Path::of);
    }

    public Optional<URL> remoteUrl() {
        Optional<String> raw = optional(REMOTE_URL);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new URL(raw.get()));
        } catch (MalformedURLException e) {
            throw new ConfigurationException(REMOTE_URL + " is not a URL: " + raw.get(), e);
        }
    }

    /**
     * Chromium-family executable to launch instead of the installed Chrome, e.g. Brave.
     */
    public Optional<Path> browserBinary() {
        return optional(BROWSER_BINARY).map(Path::of);
    }

    public boolean headless() {
        String value = optional(HEADLESS).orElse("false").toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new ConfigurationException(HEADLESS + " must be true or false: " + value);
        };
    }

    /**
     * {@code stdout} (default), {@code allure} or {@code none}.
     */
    public String decisionLog() {
        String value = optional(DECISION_LOG).orElse("stdout").toLowerCase(Locale.ROOT);
        if (!DECISION_LOGS.contains(value)) {
            throw new ConfigurationException(DECISION_LOG + " must be one of " + DECISION_LOGS + ": " + value);
        }
        return value;
    }

    private Optional<String> optional(String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private String required(String name) {
        return optional(name).orElseThrow(() -> new ConfigurationException(name + " must be set"));
    }

    private static URI uri(String name, String raw) {
        try {
            return URI.create(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + " is not a URI: " + raw, e);
        }
    }
}
