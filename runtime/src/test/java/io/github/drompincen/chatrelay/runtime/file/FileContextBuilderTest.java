package io.github.drompincen.chatrelay.runtime.file;

import io.github.drompincen.chatrelay.protocol.api.FileAttachment;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileContextBuilderTest {

    private record Step(String message, int current, int total) {
    }

    private final List<Step> steps = new ArrayList<>();
    private final ProgressSink sink = (message, current, total) -> steps.add(new Step(message, current, total));

    private static FileAttachment text(String name, String content) {
        return new FileAttachment(name, content, "text/plain", "text", content.length(), false);
    }

    @Test
    void noFilesGivesEmptyContextWithoutProgress() throws Exception {
        FileContextBuilder builder = new FileContextBuilder(new DefaultFileProcessor(), FileLimits.DEFAULT);

        assertThat(builder.build(List.of(), sink)).isEmpty();
        assertThat(steps).isEmpty();
    }

    @Test
    void reportsProgressForEachFileAndFinalStep() throws Exception {
        FileContextBuilder builder = new FileContextBuilder(new DefaultFileProcessor(), FileLimits.DEFAULT);

        builder.build(List.of(text("a.txt", "alpha"), text("b.py", "print(1)")), sink);

        assertThat(steps).extracting(Step::current).containsExactly(0, 1, 2, 2);
        assertThat(steps).extracting(Step::total).containsOnly(2);
        assertThat(steps.get(1).message()).isEqualTo("Processing file 1 of 2: a.txt");
        assertThat(steps.get(3).message()).isEqualTo("Building file context...");
    }

    @Test
    void rendersIndexSectionsAndSummary() throws Exception {
        FileContextBuilder builder = new FileContextBuilder(new DefaultFileProcessor(), FileLimits.DEFAULT);

        String context = builder.build(List.of(text("a.txt", "alpha"), text("b.py", "print(1)")), sink);

        assertThat(context)
                .contains("1. **a.txt** `text` (5 B)")
                .contains("2. **b.py** `code` (8 B)")
                .contains("## FILE 1/2: a.txt")
                .contains("```py\nprint(1)\n```")
                .contains("**Summary:** 2 file(s) processed successfully, 0 failure(s), total size: 13 B");
    }

    @Test
    void badBase64IsRecordedAsFailure() throws Exception {
        FileContextBuilder builder = new FileContextBuilder(new DefaultFileProcessor(), FileLimits.DEFAULT);
        FileAttachment broken = new FileAttachment("img.png", "***", "image/png", "image", 3, true);

        String context = builder.build(List.of(broken, text("ok.txt", "fine")), sink);

        assertThat(context).contains("- img.png (base64 decode error)").contains("1 failure(s)");
    }

    @Test
    void oversizedTextFileIsSkipped() throws Exception {
        FileContextBuilder builder = new FileContextBuilder(new DefaultFileProcessor(), new FileLimits(4, 1000, 50));

        String context = builder.build(List.of(text("big.txt", "too long"), text("s.txt", "ok")), sink);

        assertThat(context).contains("- big.txt (exceeds 0 MB)").contains("**s.txt**");
    }

    @Test
    void aggregateLimitAbortsRequest() {
        FileContextBuilder builder = new FileContextBuilder(new DefaultFileProcessor(), new FileLimits(100, 10, 50));
        String encoded = Base64.getEncoder().encodeToString("123456".getBytes(StandardCharsets.UTF_8));
        FileAttachment first = new FileAttachment("a.txt", encoded, "text/plain", "text", 6, true);
        FileAttachment second = new FileAttachment("b.txt", encoded, "text/plain", "text", 6, true);

        assertThatThrownBy(() -> builder.build(List.of(first, second), sink))
                .isInstanceOf(FileProcessingException.class)
                .hasMessageContaining("Total size of files exceeds");
    }

    @Test
    void formatsSizes() {
        assertThat(FileContextBuilder.formatSize(512)).isEqualTo("512 B");
        assertThat(FileContextBuilder.formatSize(1536)).isEqualTo("1.5 KB");
        assertThat(FileContextBuilder.formatSize(5L * 1024 * 1024)).isEqualTo("5.0 MB");
    }
}
