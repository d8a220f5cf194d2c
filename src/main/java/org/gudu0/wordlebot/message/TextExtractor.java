package org.gudu0.wordlebot.message;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens every text-bearing part of a message into one newline-joined corpus.
 * <p>
 * Order: body, then per block title, description, author name, footer text and
 * each field's name and value. Blank parts are skipped.
 */
public final class TextExtractor {

    public String extract(ChatMessage message) {
        if (message == null) return "";
        return extract(message.content(), message.richBlocks());
    }

    public String extract(String body, List<RichBlock> blocks) {
        List<String> parts = new ArrayList<>();
        add(parts, body);

        if (blocks != null) {
            for (RichBlock block : blocks) {
                if (block == null) continue;
                add(parts, block.title());
                add(parts, block.description());
                add(parts, block.authorName());
                add(parts, block.footerText());
                for (RichBlock.Field field : block.fields()) {
                    add(parts, field.name());
                    add(parts, field.value());
                }
            }
        }
        return String.join("\n", parts);
    }

    private static void add(List<String> parts, String s) {
        if (s != null && !s.isBlank()) parts.add(s);
    }
}
