package com.scriptorium.templatemodel;

import java.util.Objects;

/**
 * Visual style of a {@link DocumentTemplate}.
 *
 * <p>{@code pageMargins} is optional: {@code null} means no margins are configured, and a clone of
 * an unmargined style stays unmargined. The constructor and {@link #setPageMargins(Margins)} store
 * a copy of the margins they are given.
 */
public class DocumentStyle implements Prototype<DocumentStyle> {

    private String fontFamily;
    private int fontSize;
    private String headerColor;
    private String logoUrl;
    private Margins pageMargins;

    public DocumentStyle() {}

    public DocumentStyle(
            String fontFamily, int fontSize, String headerColor, String logoUrl, Margins pageMargins) {
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.headerColor = headerColor;
        this.logoUrl = logoUrl;
        this.pageMargins = Prototype.cloneOrNull(pageMargins);
    }

    @Override
    public DocumentStyle deepClone() {
        return new DocumentStyle(fontFamily, fontSize, headerColor, logoUrl, pageMargins);
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public int getFontSize() {
        return fontSize;
    }

    public void setFontSize(int fontSize) {
        this.fontSize = fontSize;
    }

    public String getHeaderColor() {
        return headerColor;
    }

    public void setHeaderColor(String headerColor) {
        this.headerColor = headerColor;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public void setLogoUrl(String logoUrl) {
        this.logoUrl = logoUrl;
    }

    public Margins getPageMargins() {
        return pageMargins;
    }

    /** Replaces the margins with a copy of {@code pageMargins}; {@code null} removes them. */
    public void setPageMargins(Margins pageMargins) {
        this.pageMargins = Prototype.cloneOrNull(pageMargins);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentStyle other)) {
            return false;
        }
        return fontSize == other.fontSize
                && Objects.equals(fontFamily, other.fontFamily)
                && Objects.equals(headerColor, other.headerColor)
                && Objects.equals(logoUrl, other.logoUrl)
                && Objects.equals(pageMargins, other.pageMargins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fontFamily, fontSize, headerColor, logoUrl, pageMargins);
    }

    @Override
    public String toString() {
        return "DocumentStyle{fontFamily='" + fontFamily + "', fontSize=" + fontSize
                + ", headerColor='" + headerColor + "', logoUrl='" + logoUrl
                + "', pageMargins=" + pageMargins + '}';
    }
}
