package io.github.drompincen.chatrelay.runtime.chat;

import java.util.List;

/**
 * Heuristic used to set {@code isMarkdown} on completed responses so the client knows whether to
 * render the text.
 */
public final class MarkdownDetector {

    private static final List<String> INDICATORS = List.of(
            "```", "# ", "## ", "### ", "- ", "* ", "1. ",
            "**", "__", "[", "](", "|", "---",
            "apiVersion:", "kind:", "metadata:");

    private MarkdownDetector() {
    }

    public static boolean isMarkdown(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String indicator : INDICATORS) {
            if (text.contains(indicator)) {
                return true;
            }
        }
        return text.contains("\n\n");
    }
}
