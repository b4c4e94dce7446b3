package com.scriptorium.templatemodel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A document template: the aggregate that the registry stores as a master and hands out as
 * clones.
 *
 * <p>Every nested entity and collection is exclusively owned by one instance. Collection getters
 * return the live owned container so the owner of a clone can mutate it in place. Setters copy
 * their argument, entities included, so a template never shares an object with its caller.
 *
 * <p>{@link #deepClone()} is the one place that knows how to copy the whole graph. A new field that
 * holds a mutable reference (collection or entity) must get its own copy step there, and a case in
 * {@code DocumentTemplateTest}; scalar and immutable fields may be copied directly.
 */
public class DocumentTemplate implements Prototype<DocumentTemplate> {

    private String title;
    private String category;
    private List<Section> sections = new ArrayList<>();
    private DocumentStyle style;
    private List<String> requiredFields = new ArrayList<>();
    private Map<String, String> metadata = new LinkedHashMap<>();
    private ApprovalWorkflow workflow;
    private List<String> tags = new ArrayList<>();

    public DocumentTemplate() {}

    @Override
    public DocumentTemplate deepClone() {
        DocumentTemplate copy = new DocumentTemplate();
        copy.title = title;
        copy.category = category;
        copy.style = Prototype.cloneOrNull(style);
        copy.workflow = Prototype.cloneOrNull(workflow);
        copy.sections = new ArrayList<>(sections.size());
        for (Section section : sections) {
            copy.sections.add(section.deepClone());
        }
        copy.requiredFields = new ArrayList<>(requiredFields);
        copy.metadata = new LinkedHashMap<>(metadata);
        copy.tags = new ArrayList<>(tags);
        return copy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    /** Returns the owned, mutable section list. */
    public List<Section> getSections() {
        return sections;
    }

    /** Replaces the sections with clones of {@code sections}, in order; {@code null} clears them. */
    public void setSections(List<Section> sections) {
        this.sections = new ArrayList<>();
        if (sections != null) {
            for (Section section : sections) {
                this.sections.add(section.deepClone());
            }
        }
    }

    public DocumentStyle getStyle() {
        return style;
    }

    /** Replaces the style with a copy of {@code style}; {@code null} removes it. */
    public void setStyle(DocumentStyle style) {
        this.style = Prototype.cloneOrNull(style);
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    public void setRequiredFields(List<String> requiredFields) {
        this.requiredFields =
                requiredFields != null ? new ArrayList<>(requiredFields) : new ArrayList<>();
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, String> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public ApprovalWorkflow getWorkflow() {
        return workflow;
    }

    /** Replaces the workflow with a copy of {@code workflow}; {@code null} removes it. */
    public void setWorkflow(ApprovalWorkflow workflow) {
        this.workflow = Prototype.cloneOrNull(workflow);
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentTemplate other)) {
            return false;
        }
        return Objects.equals(title, other.title)
                && Objects.equals(category, other.category)
                && sections.equals(other.sections)
                && Objects.equals(style, other.style)
                && requiredFields.equals(other.requiredFields)
                && metadata.equals(other.metadata)
                && Objects.equals(workflow, other.workflow)
                && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                title, category, sections, style, requiredFields, metadata, workflow, tags);
    }

    @Override
    public String toString() {
        return "DocumentTemplate{title='" + title + "', category='" + category
                + "', sections=" + sections.size() + ", tags=" + tags + '}';
    }

    /**
     * Fluent construction of master templates.
     *
     * <p>{@link #build()} returns a deep clone of the accumulated state, so reusing a builder or
     * mutating the objects passed to it never reaches a template it already built.
     */
    public static final class Builder {

        private final DocumentTemplate template = new DocumentTemplate();

        private Builder() {}

        public Builder title(String title) {
            template.title = title;
            return this;
        }

        public Builder category(String category) {
            template.category = category;
            return this;
        }

        public Builder style(DocumentStyle style) {
            template.style = style;
            return this;
        }

        public Builder workflow(ApprovalWorkflow workflow) {
            template.workflow = workflow;
            return this;
        }

        public Builder section(Section section) {
            template.sections.add(Objects.requireNonNull(section, "section"));
            return this;
        }

        public Builder section(String name, String content, boolean editable, String... placeholders) {
            return section(new Section(name, content, editable, List.of(placeholders)));
        }

        public Builder requiredFields(String... fields) {
            template.requiredFields.addAll(List.of(fields));
            return this;
        }

        public Builder tag(String tag) {
            template.tags.add(tag);
            return this;
        }

        public Builder tags(String... tags) {
            template.tags.addAll(List.of(tags));
            return this;
        }

        public Builder metadata(String key, String value) {
            template.metadata.put(key, value);
            return this;
        }

        public DocumentTemplate build() {
            return template.deepClone();
        }
    }
}
