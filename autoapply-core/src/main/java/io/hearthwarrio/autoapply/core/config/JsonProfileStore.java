package io.hearthwarrio.autoapply.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads the applicant {@link Profile} from a JSON document.
 */
public final class JsonProfileStore {

    private static final Logger log = LoggerFactory.getLogger(JsonProfileStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonProfileStore() {
        // utility class
    }

    public static Profile load(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            Profile p = new Profile(MAPPER.readTree(in));
            log.info("Loaded profile from {}", file);
            return p;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read profile " + file, e);
        }
    }

    public static Profile parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return new Profile(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed profile JSON", e);
        }
    }

    public static Profile fromClasspath(String resource) {
        try (InputStream in = JsonProfileStore.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Missing classpath resource " + resource);
            }
            return new Profile(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read profile " + resource, e);
        }
    }
}
