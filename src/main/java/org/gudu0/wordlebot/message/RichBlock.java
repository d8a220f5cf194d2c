package org.gudu0.wordlebot.message;

import java.util.List;

/**
 * One structured rich-content block attached to a message (a Discord embed).
 * Every text part is optional and may be null.
 */
public record RichBlock(String title,
                        String description,
                        String authorName,
                        String footerText,
                        List<Field> fields) {

    public RichBlock {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public record Field(String name, String value) {}
}
