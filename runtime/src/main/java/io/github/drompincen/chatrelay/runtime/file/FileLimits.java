package io.github.drompincen.chatrelay.runtime.file;

public record FileLimits(long maxFileSize, long maxTotalSize, int maxFiles) {

    public static final long MB = 1024L * 1024L;

    public static final FileLimits DEFAULT = new FileLimits(5 * MB, 50 * MB, 50);

    /** Type-specific ceilings applied by {@link DefaultFileProcessor}. */
    public static final long MAX_IMAGE_SIZE = 10 * MB;
    public static final long MAX_PDF_SIZE = 25 * MB;
    public static final long MAX_DOC_SIZE = 15 * MB;
}
