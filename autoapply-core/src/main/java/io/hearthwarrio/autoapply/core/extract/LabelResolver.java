package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.strategy.FirstSuccess;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the {@code <label>} text of a control: an explicit {@code for}/{@code id} association, then an
 * enclosing label, then a label right before the control.
 */
public final class LabelResolver {

    private final FirstSuccess<Element, String> chain = FirstSuccess.<Element, String>named("tag label")
            .then("label-association", LabelResolver::associated)
            .then("ancestor-label", LabelResolver::enclosing)
            .then("preceding-label", LabelResolver::preceding);

    /**
     * @return cleaned label text, or empty
     */
    public Optional<String> tagLabel(Element element) {
        Outcome<String> outcome = chain.evaluate(element);
        return outcome.toOptional();
    }

    private static Optional<String> associated(Element element) {
        Document doc = element.ownerDocument();
        if (doc == null) {
            return Optional.empty();
        }
        Set<String> ids = new LinkedHashSet<>();
        addTokens(ids, ElementAttributes.custom(element, "label"));
        addTokens(ids, ElementAttributes.get(element, "id"));
        addTokens(ids, ElementAttributes.custom(element, "id"));
        for (String id : ids) {
            for (String attr : new String[]{"for", "id"}) {
                Element label = firstLabel(doc, attr, id);
                if (label != null) {
                    String text = TextCleaner.clean(label.text());
                    if (!text.isEmpty()) {
                        return Optional.of(text);
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static Element firstLabel(Document doc, String attribute, String value) {
        for (Element l : doc.getElementsByTag("label")) {
            if (value.equals(l.attr(attribute))) {
                return l;
            }
        }
        return null;
    }

    private static Optional<String> enclosing(Element element) {
        Element label = element.closest("label");
        if (label == null || label == element) {
            return Optional.empty();
        }
        return nonEmpty(TextCleaner.clean(label.text()));
    }

    private static Optional<String> preceding(Element element) {
        Element prev = element.previousElementSibling();
        if (prev == null || !"label".equals(prev.normalName())) {
            return Optional.empty();
        }
        return nonEmpty(TextCleaner.clean(prev.text()));
    }

    private static void addTokens(Set<String> target, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        for (String t : value.split(" ")) {
            if (!t.isEmpty()) {
                target.add(t);
            }
        }
    }

    private static Optional<String> nonEmpty(String s) {
        return s == null || s.isEmpty() ? Optional.empty() : Optional.of(s);
    }
}
