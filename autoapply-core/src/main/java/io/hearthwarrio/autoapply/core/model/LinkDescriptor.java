package io.hearthwarrio.autoapply.core.model;

public final class LinkDescriptor extends PageItem {

    private String href = "";
    private String target = "";
    private String onclick = "";

    public LinkDescriptor(Locator locator) {
        super("a", locator);
    }

    public String getHref() {
        return href;
    }

    public void setHref(String href) {
        this.href = href == null ? "" : href;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target == null ? "" : target;
    }

    public String getOnclick() {
        return onclick;
    }

    public void setOnclick(String onclick) {
        this.onclick = onclick == null ? "" : onclick;
    }

    /**
     * Heuristic for links that open a dialog instead of navigating away.
     */
    public boolean looksLikeModalTrigger() {
        return !onclick.isEmpty() && !href.startsWith("http") && !"_blank".equals(target);
    }

    @Override
    protected String extraValue(SearchKey key) {
        return key == SearchKey.HREF ? href : "";
    }

    @Override
    public String toString() {
        return "Link{'" + getText() + "', " + getLocator() + "}";
    }
}
