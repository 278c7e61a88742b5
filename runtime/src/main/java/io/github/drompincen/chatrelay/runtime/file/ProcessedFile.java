package io.github.drompincen.chatrelay.runtime.file;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracted content of one attachment. {@code content} is base64 when {@code base64} is set
 * (images), plain text otherwise.
 */
public record ProcessedFile(
        String name,
        String content,
        String contentType,
        FileType fileType,
        long size,
        boolean base64,
        Map<String, Object> metadata
) {

    public ProcessedFile {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Language hint for fenced code blocks, empty when none applies. */
    public String language() {
        Object language = metadata.get("language");
        if (language instanceof String s) {
            return s;
        }
        return switch (fileType) {
            case JSON -> "json";
            case YAML -> "yaml";
            case XML -> "xml";
            default -> "";
        };
    }
}
