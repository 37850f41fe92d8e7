package io.hearthwarrio.autoapply.core.model;

import java.util.Locale;

/**
 * Clickable control: {@code <button>}, submit/button inputs, or anything with {@code role=button}.
 */
public final class ButtonDescriptor extends PageItem {

    private String type = "";
    private String onclick = "";
    private UploadKind uploadKind;

    public ButtonDescriptor(String tagName, Locator locator) {
        super(tagName, locator);
    }

    /**
     * @return lower-cased {@code type} attribute ("submit", "button", "file" for upload triggers)
     */
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type == null ? "" : type.toLowerCase(Locale.ROOT);
    }

    public boolean isSubmit() {
        return "submit".equals(type);
    }

    public String getOnclick() {
        return onclick;
    }

    public void setOnclick(String onclick) {
        this.onclick = onclick == null ? "" : onclick;
    }

    public UploadKind getUploadKind() {
        return uploadKind;
    }

    public void setUploadKind(UploadKind uploadKind) {
        this.uploadKind = uploadKind;
    }

    @Override
    protected String extraValue(SearchKey key) {
        return key == SearchKey.TYPE ? type : "";
    }

    @Override
    public String toString() {
        return "Button{'" + getText() + "', " + getLocator() + "}";
    }
}
