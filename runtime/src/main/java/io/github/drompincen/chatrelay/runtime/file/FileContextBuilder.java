package io.github.drompincen.chatrelay.runtime.file;

import io.github.drompincen.chatrelay.protocol.api.FileAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a request's attachments into one markdown block that is prepended to the prompt.
 *
 * <p>Progress is reported as: start (0/N), one step per file, then a final step at 100% while the
 * block is assembled. Files that cannot be decoded, are over the per-file limit, or fail
 * extraction are listed as failures; exceeding the aggregate limit aborts the whole request.
 */
public class FileContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(FileContextBuilder.class);

    private final FileProcessor processor;
    private final FileLimits limits;

    public FileContextBuilder(FileProcessor processor, FileLimits limits) {
        this.processor = processor;
        this.limits = limits;
    }

    public FileLimits limits() {
        return limits;
    }

    public String build(List<FileAttachment> files, ProgressSink progress) throws FileProcessingException {
        if (files == null || files.isEmpty()) {
            return "";
        }
        int total = files.size();
        progress.progress("Starting file processing...", 0, total);

        long totalSize = 0;
        List<ProcessedFile> processed = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (int i = 0; i < total; i++) {
            FileAttachment file = files.get(i);
            progress.progress("Processing file " + (i + 1) + " of " + total + ": " + file.name(), i + 1, total);

            byte[] content;
            if (file.base64()) {
                try {
                    content = Base64.getDecoder().decode(file.content());
                } catch (IllegalArgumentException e) {
                    log.warn("Base64 decode failed for file {}: {}", file.name(), e.getMessage());
                    failed.add(file.name() + " (base64 decode error)");
                    continue;
                }
            } else {
                content = file.content().getBytes(StandardCharsets.UTF_8);
            }

            long size = content.length;
            if (size > limits.maxFileSize() && !file.isImage() && !file.isPdf()) {
                failed.add(file.name() + " (exceeds " + limits.maxFileSize() / FileLimits.MB + " MB)");
                continue;
            }

            totalSize += size;
            if (totalSize > limits.maxTotalSize()) {
                throw new FileProcessingException("Total size of files exceeds the "
                        + limits.maxTotalSize() / FileLimits.MB + " MB limit");
            }

            try {
                processed.add(processor.process(file.name(), content));
            } catch (FileProcessingException e) {
                log.warn("Failed to process file {}: {}", file.name(), e.getMessage());
                failed.add(file.name() + " (" + e.getMessage() + ")");
            }
        }

        progress.progress("Building file context...", total, total);
        String context = render(processed, failed, totalSize);
        log.info("Files processed for context total={} success={} failed={} totalSize={}",
                total, processed.size(), failed.size(), totalSize);
        return context;
    }

    private String render(List<ProcessedFile> processed, List<String> failed, long totalSize) {
        StringBuilder sb = new StringBuilder();
        sb.append("# FILE CONTEXT PROVIDED BY THE USER\n\n");
        sb.append("## FILE INDEX:\n\n");
        for (int i = 0; i < processed.size(); i++) {
            ProcessedFile pf = processed.get(i);
            sb.append(i + 1).append(". **").append(pf.name()).append("** `").append(pf.fileType().label())
                    .append("` (").append(formatSize(pf.size())).append(")\n");
        }
        if (!failed.isEmpty()) {
            sb.append("\n### Files that failed to process:\n");
            for (String f : failed) {
                sb.append("- ").append(f).append('\n');
            }
        }
        sb.append("\n---\n\n");

        for (int i = 0; i < processed.size(); i++) {
            ProcessedFile pf = processed.get(i);
            sb.append("## FILE ").append(i + 1).append('/').append(processed.size()).append(": ")
                    .append(pf.name()).append("\n\n");
            if (!pf.metadata().isEmpty()) {
                sb.append("**Metadata:**\n");
                for (Map.Entry<String, Object> entry : pf.metadata().entrySet()) {
                    sb.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
                }
                sb.append('\n');
            }
            if (pf.fileType() == FileType.IMAGE) {
                sb.append("![").append(pf.name()).append("](data:").append(pf.contentType())
                        .append(";base64,").append(pf.content()).append(")\n\n");
                sb.append("*Note: image attached for visual analysis.*\n\n");
            } else if (pf.fileType().isStructured()) {
                sb.append("```").append(pf.language()).append('\n').append(pf.content()).append("\n```\n\n");
            } else {
                sb.append("```\n").append(pf.content()).append("\n```\n\n");
            }
            sb.append("---\n\n");
        }

        sb.append("\n**Summary:** ").append(processed.size()).append(" file(s) processed successfully, ")
                .append(failed.size()).append(" failure(s), total size: ").append(formatSize(totalSize))
                .append("\n\n");
        return sb.toString();
    }

    static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        long div = 1024;
        int exp = 0;
        for (long n = bytes / 1024; n >= 1024; n /= 1024) {
            div *= 1024;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f %cB", (double) bytes / div, "KMGTPE".charAt(exp));
    }
}
