package com.kaspaaio.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the compose document as YAML.
 */
@Component
public class ComposeCodec {

    private final ObjectMapper yamlMapper;

    public ComposeCodec() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        this.yamlMapper = new ObjectMapper(factory)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String write(ComposeDocument document) {
        try {
            return yamlMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize compose document", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a compose document
     */
    public ComposeDocument read(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return ComposeDocument.empty();
        }
        try {
            ComposeDocument document = yamlMapper.readValue(yaml, ComposeDocument.class);
            return document != null ? document : ComposeDocument.empty();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed compose document: " + e.getOriginalMessage(), e);
        }
    }
}
