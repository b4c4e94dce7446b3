package com.scriptorium.templatemodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.InputStream;

/**
 * JSON reading and writing of {@link DocumentTemplate} graphs.
 *
 * <p>Used to load master templates from a catalog and to hand clones to JSON clients. Unknown
 * properties are rejected so a misspelt catalog field fails loudly instead of being dropped.
 */
public final class TemplateJson {

    private static final ObjectMapper MAPPER = createMapper();

    private TemplateJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serializes a template to a JSON string.
     *
     * @throws TemplateJsonException if serialization fails
     */
    public static String write(DocumentTemplate template) {
        try {
            return MAPPER.writeValueAsString(template);
        } catch (JsonProcessingException e) {
            throw new TemplateJsonException("Failed to serialize template: " + template.getTitle(), e);
        }
    }

    /**
     * Reads a template from a JSON string.
     *
     * @throws TemplateJsonException if the JSON is malformed or does not describe a template
     */
    public static DocumentTemplate read(String json) {
        try {
            return MAPPER.readValue(json, DocumentTemplate.class);
        } catch (JsonProcessingException e) {
            throw new TemplateJsonException("Failed to read template", e);
        }
    }

    /**
     * Reads a template from a stream, closing it once read.
     *
     * @throws TemplateJsonException if reading fails or the JSON does not describe a template
     */
    public static DocumentTemplate read(InputStream in) {
        try {
            return MAPPER.readValue(in, DocumentTemplate.class);
        } catch (IOException e) {
            throw new TemplateJsonException("Failed to read template", e);
        }
    }

    /**
     * Returns a new ObjectMapper configured like the one this codec uses, for callers that must
     * write templates in the same format. Changes to the copy do not affect the codec.
     */
    public static ObjectMapper objectMapper() {
        return MAPPER.copy();
    }

    /** Thrown when a template cannot be converted to or from JSON. */
    public static class TemplateJsonException extends RuntimeException {
        public TemplateJsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
