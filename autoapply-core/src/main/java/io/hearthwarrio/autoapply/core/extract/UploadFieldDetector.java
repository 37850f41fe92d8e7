package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.PageItem;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.UploadKind;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;

/**
 * Recognizes file-upload controls and tells resume uploads from other attachments.
 * Cloud-storage pickers (Drive, Dropbox) and "enter manually" switches are reported so they can be dropped.
 */
public final class UploadFieldDetector {

    public enum Verdict {
        NOT_UPLOAD,
        CLOUD,
        RESUME,
        OTHER;

        public UploadKind kind() {
            return this == RESUME ? UploadKind.RESUME : UploadKind.OTHER;
        }

        public boolean isUpload() {
            return this == RESUME || this == OTHER;
        }
    }

    private final List<String> resumeWords;
    private final List<String> uploadWords;
    private final List<String> cloudWords;

    public UploadFieldDetector(KeywordTables tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        this.resumeWords = tables.get(KeywordTable.RESUME_IDENTIFIERS);
        this.uploadWords = tables.get(KeywordTable.UPLOAD_IDENTIFIERS);
        this.cloudWords = tables.get(KeywordTable.CLOUD_UPLOAD_IDENTIFIERS);
    }

    /**
     * @param declaredType lower-cased {@code type} of the control
     * @param keys         properties of {@code item} to search for upload vocabulary
     */
    public Verdict inspect(PageItem item, Element element, String declaredType, List<SearchKey> keys) {
        String tag = element.normalName();
        if (!"input".equals(tag) && !"button".equals(tag)) {
            return Verdict.NOT_UPLOAD;
        }
        boolean resumeAttribute = ElementAttributes.searchValue(element, resumeWords).isPresent();
        boolean upload = "file".equals(declaredType)
                || resumeAttribute
                || query(keys, uploadWords).matches(item);
        if (!upload) {
            return Verdict.NOT_UPLOAD;
        }
        if (query(keys, cloudWords).matches(item)) {
            return Verdict.CLOUD;
        }
        return query(keys, resumeWords).matches(item) || resumeAttribute ? Verdict.RESUME : Verdict.OTHER;
    }

    private static TextQuery query(List<SearchKey> keys, List<String> words) {
        return TextQuery.of(keys, words).normalizeWhitespace();
    }
}
