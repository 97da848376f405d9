package dev.aparikh.emailtriage.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Codec for the stored-only attachment list. Solr keeps the full list as one JSON string so the
 * per-attachment fields stay together; filenames and parsed text are indexed separately for search.
 */
public final class AttachmentsJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<Attachment>> LIST_TYPE = new TypeReference<>() {};

    private AttachmentsJson() {
    }

    public static String write(List<Attachment> attachments) {
        try {
            return MAPPER.writeValueAsString(attachments == null ? List.of() : attachments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Attachments cannot be serialized", e);
        }
    }

    public static List<Attachment> read(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored attachments are not valid JSON", e);
        }
    }
}
