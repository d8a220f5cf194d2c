package org.gudu0.wordlebot.message;

import java.time.Instant;
import java.util.List;

/**
 * The parts of a chat message the results pipeline reads.
 * Implemented over JDA messages in production and by plain records in tests.
 */
public interface ChatMessage {

    long messageId();

    /** Guild the message was posted in; scopes display-name resolution. */
    long groupId();

    String content();

    List<RichBlock> richBlocks();

    String authorName();

    boolean authorIsBot();

    Instant createdAt();
}
