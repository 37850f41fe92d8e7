package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.extract.ParseContext;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.session.BrowserSession;

import java.util.Objects;

/**
 * A parsed page together with the counters of the parse, which later extractions of revealed controls
 * must continue from.
 */
public final class PageCapture {

    private final PageModel page;
    private final ParseContext context;

    public PageCapture(PageModel page, ParseContext context) {
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    public static PageCapture take(BrowserSession session, PageExtractor extractor, Profile profile) {
        DomSnapshot snapshot = DomSnapshot.parse(session.snapshot());
        ParseContext context = new ParseContext(profile, snapshot.hasNamespaces());
        return new PageCapture(extractor.parse(snapshot, context), context);
    }

    public PageModel page() {
        return page;
    }

    public ParseContext context() {
        return context;
    }
}
