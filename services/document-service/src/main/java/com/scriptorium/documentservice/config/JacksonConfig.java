package com.scriptorium.documentservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptorium.templatemodel.TemplateJson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

/**
 * HTTP responses use the template codec's JSON format, so a template fetched over HTTP reads the
 * same as a catalog file: absent style or workflow is left out rather than written as null.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        // Spring's builder is bypassed here, and it is what flattens ProblemDetail properties
        return TemplateJson.objectMapper().addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
    }
}
