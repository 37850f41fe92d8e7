package io.hearthwarrio.autoapply.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeywordTablesTest {

    @TempDir
    Path dir;

    @Test
    void bundledTablesAreComplete() {
        KeywordTables tables = KeywordTables.defaults();

        for (KeywordTable t : KeywordTable.values()) {
            assertNotNull(tables.get(t), t.key());
        }
        assertTrue(tables.get(KeywordTable.PAIRED_YES_QUESTIONS).contains("require sponsorship now or in future"));
        assertFalse(tables.profileFieldRules().isEmpty());
    }

    @Test
    void overlayReplacesSingleTable() throws IOException {
        Path overlay = dir.resolve("tables.json");
        Files.writeString(overlay, "{\"tables\": {\"sign_in_identifiers\": [\"anmelden\"]}}");

        KeywordTables tables = KeywordTables.load(overlay);

        assertEquals(List.of("anmelden"), tables.get(KeywordTable.SIGN_IN_IDENTIFIERS));
        assertEquals(KeywordTables.defaults().get(KeywordTable.SIGN_UP_IDENTIFIERS),
                tables.get(KeywordTable.SIGN_UP_IDENTIFIERS));
        assertEquals(KeywordTables.defaults().profileFieldRules().size(), tables.profileFieldRules().size());
    }

    @Test
    void tableThatIsNotAnArrayIsRejected() throws IOException {
        Path overlay = dir.resolve("tables.json");
        Files.writeString(overlay, "{\"tables\": {\"sign_in_identifiers\": \"login\"}}");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> KeywordTables.load(overlay));
        assertTrue(ex.getMessage().contains("sign_in_identifiers"));
    }

    @Test
    void withReplacesTableInCopy() {
        KeywordTables base = KeywordTables.defaults();
        KeywordTables changed = base.with(KeywordTable.SIGN_IN_IDENTIFIERS, List.of("connexion"));

        assertEquals(List.of("connexion"), changed.get(KeywordTable.SIGN_IN_IDENTIFIERS));
        assertNotEquals(List.of("connexion"), base.get(KeywordTable.SIGN_IN_IDENTIFIERS));
    }
}
