package io.hearthwarrio.autoapply.core.model;

import java.util.Objects;

public final class PageMetadata {

    private final String url;
    private final String title;
    private final boolean namespaced;

    public PageMetadata(String url, String title, boolean namespaced) {
        this.url = url == null ? "" : url;
        this.title = title == null ? "" : title;
        this.namespaced = namespaced;
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Whether the document declares XML namespaces; absolute positional paths are unreliable then.
     */
    public boolean isNamespaced() {
        return namespaced;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageMetadata other)) {
            return false;
        }
        return namespaced == other.namespaced && url.equals(other.url) && title.equals(other.title);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, namespaced);
    }
}
