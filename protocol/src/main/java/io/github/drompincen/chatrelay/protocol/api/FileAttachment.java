package io.github.drompincen.chatrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FileAttachment(
        String name,
        String content,
        String contentType,
        String fileType,
        long size,
        @JsonProperty("isBase64") boolean base64
) {
    public FileAttachment {
        name = name == null ? "" : name;
        content = content == null ? "" : content;
        contentType = contentType == null ? "" : contentType;
        fileType = fileType == null ? "" : fileType;
    }

    @JsonIgnore
    public boolean isImage() {
        return contentType.startsWith("image/");
    }

    @JsonIgnore
    public boolean isPdf() {
        return "application/pdf".equals(contentType);
    }
}
