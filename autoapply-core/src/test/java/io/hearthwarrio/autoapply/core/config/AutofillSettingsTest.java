package io.hearthwarrio.autoapply.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class AutofillSettingsTest {

    @TempDir
    Path dir;

    @Test
    void defaultsCoverEverySetting() {
        AutofillSettings settings = AutofillSettings.defaults();

        assertEquals(90, settings.getInt(Setting.ORACLE_HIGH_SIMILARITY));
        assertEquals(80, settings.getInt(Setting.ORACLE_MID_SIMILARITY));
        assertEquals(40, settings.getInt(Setting.ORACLE_FLOOR_SIMILARITY));
        assertEquals(66, settings.getInt(Setting.LABEL_SIMILARITY));
        assertEquals(50, settings.getInt(Setting.MERGE_ID_SIMILARITY));
        assertEquals(0.69, settings.getDouble(Setting.PRESERVED_RATIO), 1e-9);
        assertEquals(Duration.ofMinutes(30), settings.minutes(Setting.JOB_MAX_MINUTES));
        assertEquals(18, settings.getInt(Setting.JOB_MAX_ITERATIONS));
    }

    @Test
    void overlayReplacesOnlyGivenKeys() throws IOException {
        Path overlay = dir.resolve("settings.json");
        Files.writeString(overlay, "{\"oracleHighSimilarity\": 85, \"workerCount\": 3}");

        AutofillSettings settings = AutofillSettings.load(overlay);

        assertEquals(85, settings.getInt(Setting.ORACLE_HIGH_SIMILARITY));
        assertEquals(3, settings.getInt(Setting.WORKER_COUNT));
        assertEquals(40, settings.getInt(Setting.ORACLE_FLOOR_SIMILARITY));
    }

    @Test
    void nonNumericOverlayValueIsRejected() throws IOException {
        Path overlay = dir.resolve("settings.json");
        Files.writeString(overlay, "{\"workerCount\": \"many\"}");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> AutofillSettings.load(overlay));
        assertTrue(ex.getMessage().contains("workerCount"));
    }

    @Test
    void missingOverlayFileIsRejected() {
        assertThrows(ConfigurationException.class, () -> AutofillSettings.load(dir.resolve("absent.json")));
    }

    @Test
    void systemPropertiesOverrideValues() {
        EnumMap<Setting, Double> values = new EnumMap<>(Setting.class);
        Properties properties = new Properties();
        properties.setProperty("autoapply.queuePollSeconds", "5");
        properties.setProperty("autoapply.oracleTopK", " ");

        AutofillSettings.applyProperties(values, properties);

        assertEquals(5.0, values.get(Setting.QUEUE_POLL_SECONDS));
        assertFalse(values.containsKey(Setting.ORACLE_TOP_K));
    }

    @Test
    void malformedSystemPropertyIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("autoapply.workerCount", "two");

        assertThrows(ConfigurationException.class,
                () -> AutofillSettings.applyProperties(new EnumMap<>(Setting.class), properties));
    }

    @Test
    void withReturnsModifiedCopy() {
        AutofillSettings base = AutofillSettings.defaults();
        AutofillSettings changed = base.with(Setting.WORKER_COUNT, 4);

        assertEquals(1, base.getInt(Setting.WORKER_COUNT));
        assertEquals(4, changed.getInt(Setting.WORKER_COUNT));
    }
}
