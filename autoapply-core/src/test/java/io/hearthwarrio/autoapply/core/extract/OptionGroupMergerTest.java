package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OptionGroupMergerTest {

    private final OptionGroupMerger merger = new OptionGroupMerger(KeywordTables.defaults(), AutofillSettings.defaults());

    @Test
    void itemsSharingANameBecomeOneGroup() {
        List<FieldDescriptor> merged = merger.mergeAll(raw());

        assertEquals(3, merged.size());
        assertEquals(List.of("Yes", "No"), List.copyOf(merged.get(0).getChoices().keySet()));
        assertEquals("", merged.get(0).label(LabelSource.TAG));
        assertEquals(List.of("Java", "Kotlin"), List.copyOf(merged.get(2).getChoices().keySet()));
    }

    @Test
    void mergingIsIdempotent() {
        List<FieldDescriptor> once = merger.mergeAll(raw());
        List<FieldDescriptor> twice = merger.mergeAll(once);

        assertEquals(once.size(), twice.size());
        for (int i = 0; i < once.size(); i++) {
            assertTrue(once.get(i).sameAs(twice.get(i)), once.get(i) + " vs " + twice.get(i));
        }
    }

    @Test
    void rawExtractionIsLeftUntouched() {
        List<FieldDescriptor> raw = raw();

        merger.mergeAll(raw);

        assertEquals(6, raw.size());
        assertEquals(1, raw.get(0).getChoices().size());
        assertEquals("Yes", raw.get(0).label(LabelSource.TAG));
    }

    @Test
    void textFieldsAreNeverMerged() {
        FieldDescriptor a = item(FieldType.TEXT, "city", "City", "//input[1]");
        FieldDescriptor b = item(FieldType.TEXT, "city", "City", "//input[2]");

        assertEquals(2, merger.mergeAll(List.of(a, b)).size());
    }

    private static List<FieldDescriptor> raw() {
        return List.of(
                item(FieldType.RADIO, "sponsor", "Yes", "//input[@value='sy']"),
                item(FieldType.RADIO, "sponsor", "No", "//input[@value='sn']"),
                item(FieldType.RADIO, "relocate", "Yes", "//input[@value='ry']"),
                item(FieldType.RADIO, "relocate", "No", "//input[@value='rn']"),
                item(FieldType.CHECKBOX, "languages", "Java", "//input[@value='java']"),
                item(FieldType.CHECKBOX, "languages", "Kotlin", "//input[@value='kotlin']"));
    }

    private static FieldDescriptor item(FieldType type, String name, String label, String xpath) {
        FieldDescriptor f = new FieldDescriptor("input", Locator.of(xpath), type);
        f.setName(name);
        f.setLabel(LabelSource.TAG, label);
        f.addChoice(label, Locator.of(xpath));
        return f;
    }
}
