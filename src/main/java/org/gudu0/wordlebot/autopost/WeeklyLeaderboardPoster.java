package org.gudu0.wordlebot.autopost;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.wordlebot.commands.LeaderboardRenderer;
import org.gudu0.wordlebot.config.GlobalConfig;
import org.gudu0.wordlebot.guild.GuildContext;
import org.gudu0.wordlebot.guild.GuildManager;
import org.gudu0.wordlebot.stats.Window;
import org.gudu0.wordlebot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Posts last week's leaderboard into every guild once a week.
 * <p>
 * A minute-level check runs on a scheduler; a guild is posted to at most once per calendar day
 * of the configured weekday, tracked in its autopost.json so restarts don't re-post.
 */
public class WeeklyLeaderboardPoster extends ListenerAdapter {

    static final List<String> PREFERRED_NAME_PARTS = List.of("general", "wordle", "games", "bot");

    private final GlobalConfig cfg;
    private final GuildManager guilds;
    private final LeaderboardRenderer renderer;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "WeeklyLeaderboardPoster");
        t.setDaemon(true);
        return t;
    });

    // Guards against a second send while the first is still queued in JDA.
    private final Set<Long> posting = ConcurrentHashMap.newKeySet();

    private volatile JDA jda;

    public WeeklyLeaderboardPoster(GlobalConfig cfg, GuildManager guilds, LeaderboardRenderer renderer) {
        this.cfg = cfg;
        this.guilds = guilds;
        this.renderer = renderer;
    }

    @Override
    public void onReady(@NotNull ReadyEvent event) {
        this.jda = event.getJDA();

        if (!cfg.autoPostEnabled) {
            ConsoleLog.info("AutoPost", "Weekly auto-post disabled in global config");
            return;
        }

        scheduler.scheduleAtFixedRate(this::checkSafe, 10, 60, TimeUnit.SECONDS);
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown));

        ConsoleLog.info("AutoPost", "Weekly auto-post scheduled: " + cfg.autoPostDayOfWeek()
                + " " + postTime() + " " + cfg.zone().getId());
    }

    private void checkSafe() {
        try {
            check();
        } catch (Exception e) {
            ConsoleLog.error("AutoPost", "Weekly check failed: " + e.getMessage(), e);
        }
    }

    private void check() {
        JDA j = jda;
        if (j == null) return;

        ZonedDateTime now = ZonedDateTime.now(cfg.zone());
        if (!isDue(now, cfg.autoPostDayOfWeek(), postTime())) return;

        LocalDate today = now.toLocalDate();
        for (Guild g : j.getGuilds()) {
            GuildContext ctx = guilds.get(g.getIdLong());
            if (!ctx.cfg.autoPostEnabled) continue;
            if (ctx.autoPostStore.postedOn(today)) continue;
            postTo(g, ctx, today);
        }
    }

    private void postTo(Guild g, GuildContext ctx, LocalDate today) {
        long guildId = g.getIdLong();
        Optional<GuildMessageChannel> channel = resolveChannel(g, ctx);
        if (channel.isEmpty()) {
            ConsoleLog.debug("AutoPost", "guildId=" + guildId + " has no channel I can post in; skipping");
            return;
        }

        MessageEmbed embed = renderer.lastWeek("Weekly auto-post • Click buttons for the live periods");
        if (!posting.add(guildId)) return;

        GuildMessageChannel ch = channel.get();
        ch.sendMessageEmbeds(embed)
                .addActionRow(renderer.buttons(Window.WEEKLY))
                .queue(
                        msg -> {
                            ctx.autoPostStore.recordPost(today, ch.getIdLong(), msg.getIdLong());
                            posting.remove(guildId);
                            ConsoleLog.info("AutoPost", "Posted weekly leaderboard guildId=" + guildId
                                    + " channel=#" + ch.getName());
                        },
                        err -> {
                            posting.remove(guildId);
                            ConsoleLog.error("AutoPost", "Weekly post failed guildId=" + guildId
                                    + " channel=#" + ch.getName() + ": " + err.getMessage(), err);
                        }
                );
    }

    private Optional<GuildMessageChannel> resolveChannel(Guild g, GuildContext ctx) {
        String configured = ctx.cfg.autoPostChannelId;
        if (configured != null && !configured.isBlank()) {
            GuildMessageChannel ch = g.getChannelById(GuildMessageChannel.class, configured);
            if (ch != null && ch.canTalk()) return Optional.of(ch);
            ConsoleLog.debug("AutoPost", "guildId=" + g.getId() + " autoPostChannelId not usable: " + configured);
        }

        List<TextChannel> text = g.getTextChannels();
        return chooseChannel(text, TextChannel::getName, TextChannel::canTalk).map(GuildMessageChannel.class::cast);
    }

    private LocalTime postTime() {
        return LocalTime.of(cfg.autoPostHour, cfg.autoPostMinute);
    }

    /** True on {@code day} from {@code at} until midnight. */
    static boolean isDue(ZonedDateTime now, DayOfWeek day, LocalTime at) {
        return now.getDayOfWeek() == day && !now.toLocalTime().isBefore(at);
    }

    /**
     * First channel whose name contains one of {@link #PREFERRED_NAME_PARTS} and that we can talk in,
     * else the first channel we can talk in.
     */
    static <C> Optional<C> chooseChannel(List<C> channels, Function<C, String> name, Predicate<C> canTalk) {
        for (C c : channels) {
            if (!canTalk.test(c)) continue;
            String n = name.apply(c).toLowerCase(Locale.ROOT);
            for (String part : PREFERRED_NAME_PARTS) {
                if (n.contains(part)) return Optional.of(c);
            }
        }
        return channels.stream().filter(canTalk).findFirst();
    }
}
