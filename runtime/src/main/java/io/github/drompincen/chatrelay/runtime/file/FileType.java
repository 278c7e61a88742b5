package io.github.drompincen.chatrelay.runtime.file;

public enum FileType {
    TEXT("text"),
    IMAGE("image"),
    PDF("pdf"),
    DOCX("docx"),
    XLSX("xlsx"),
    CODE("code"),
    MARKDOWN("markdown"),
    YAML("yaml"),
    JSON("json"),
    XML("xml"),
    CSV("csv"),
    BINARY("binary");

    private final String label;

    FileType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Rendered as a fenced block with a language hint. */
    public boolean isStructured() {
        return this == CODE || this == JSON || this == YAML || this == XML;
    }
}
