package org.gudu0.wordlebot.message;

import java.time.Instant;
import java.util.List;

/** Plain ChatMessage for tests. */
public record TestMessage(long messageId,
                          long groupId,
                          String content,
                          List<RichBlock> richBlocks,
                          String authorName,
                          boolean authorIsBot,
                          Instant createdAt) implements ChatMessage {

    public static TestMessage fromBot(String authorName, String content, Instant createdAt) {
        return new TestMessage(1L, 100L, content, List.of(), authorName, true, createdAt);
    }

    public static TestMessage fromUser(String content, Instant createdAt) {
        return new TestMessage(2L, 100L, content, List.of(), "someone", false, createdAt);
    }
}
