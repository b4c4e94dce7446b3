package com.scriptorium.templatemodel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named block of template content, e.g. a contract clause.
 *
 * <p>{@code placeholders} keeps substitution order.
 */
public class Section implements Prototype<Section> {

    private String name;
    private String content;
    private boolean editable;
    private List<String> placeholders = new ArrayList<>();

    public Section() {}

    public Section(String name, String content, boolean editable, List<String> placeholders) {
        this.name = name;
        this.content = content;
        this.editable = editable;
        setPlaceholders(placeholders);
    }

    @Override
    public Section deepClone() {
        return new Section(name, content, editable, placeholders);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public boolean isEditable() {
        return editable;
    }

    public void setEditable(boolean editable) {
        this.editable = editable;
    }

    /** Returns the owned, mutable placeholder list. */
    public List<String> getPlaceholders() {
        return placeholders;
    }

    /** Replaces the placeholders with a copy of {@code placeholders}; {@code null} clears them. */
    public void setPlaceholders(List<String> placeholders) {
        this.placeholders = placeholders != null ? new ArrayList<>(placeholders) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Section other)) {
            return false;
        }
        return editable == other.editable
                && Objects.equals(name, other.name)
                && Objects.equals(content, other.content)
                && placeholders.equals(other.placeholders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, content, editable, placeholders);
    }

    @Override
    public String toString() {
        return "Section{name='" + name + "', editable=" + editable
                + ", placeholders=" + placeholders + '}';
    }
}
