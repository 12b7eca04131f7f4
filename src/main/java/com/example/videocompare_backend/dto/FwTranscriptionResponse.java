package com.example.videocompare_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of the faster-whisper {@code /v1/audio/transcriptions} response. Some servers return
 * {@code text} as a list of fragments instead of a single string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FwTranscriptionResponse(JsonNode text, String language) {

    public String plainText() {
        if (text == null || text.isNull() || text.isMissingNode()) {
            return "";
        }
        if (text.isArray()) {
            List<String> parts = new ArrayList<>();
            text.forEach(n -> parts.add(n.isTextual() ? n.asText() : n.toString()));
            return String.join(" ", parts).strip();
        }
        return text.asText("").strip();
    }
}
