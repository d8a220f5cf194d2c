package org.gudu0.wordlebot.discord;

import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.MessageEmbed;
import org.gudu0.wordlebot.message.ChatMessage;
import org.gudu0.wordlebot.message.RichBlock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChatMessage} view of a JDA message. Embeds become {@link RichBlock}s.
 */
public final class JdaChatMessage implements ChatMessage {

    private final Message msg;
    private final List<RichBlock> blocks;

    public JdaChatMessage(Message msg) {
        this.msg = msg;
        this.blocks = toBlocks(msg.getEmbeds());
    }

    @Override
    public long messageId() { return msg.getIdLong(); }

    @Override
    public long groupId() { return msg.isFromGuild() ? msg.getGuild().getIdLong() : 0L; }

    @Override
    public String content() { return msg.getContentRaw(); }

    @Override
    public List<RichBlock> richBlocks() { return blocks; }

    @Override
    public String authorName() { return msg.getAuthor().getName(); }

    @Override
    public boolean authorIsBot() { return msg.getAuthor().isBot(); }

    @Override
    public Instant createdAt() { return msg.getTimeCreated().toInstant(); }

    static List<RichBlock> toBlocks(List<MessageEmbed> embeds) {
        List<RichBlock> out = new ArrayList<>(embeds.size());
        for (MessageEmbed e : embeds) {
            List<RichBlock.Field> fields = new ArrayList<>();
            for (MessageEmbed.Field f : e.getFields()) {
                fields.add(new RichBlock.Field(f.getName(), f.getValue()));
            }
            out.add(new RichBlock(
                    e.getTitle(),
                    e.getDescription(),
                    e.getAuthor() != null ? e.getAuthor().getName() : null,
                    e.getFooter() != null ? e.getFooter().getText() : null,
                    fields));
        }
        return out;
    }
}
