package org.gudu0.wordlebot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

public class TypedConfigStoreTest {

    @TempDir
    Path tmp;

    @Test
    public void testMissingFileGivesDefaultsWithoutWriting() {
        Path p = tmp.resolve("global/config.json");
        TypedConfigStore<GlobalConfig> s = new TypedConfigStore<>(p, GlobalConfig.class, GlobalConfig::new);

        assertFalse(s.loadedFromDisk());
        assertFalse(Files.exists(p));
        assertEquals(ZoneId.of("America/Los_Angeles"), s.cfg().zone());
        assertEquals(LocalDate.of(2021, 6, 19), s.cfg().roundEpochDate());
        assertEquals(DayOfWeek.MONDAY, s.cfg().autoPostDayOfWeek());
    }

    @Test
    public void testSaveThenReload() throws Exception {
        Path p = tmp.resolve("guilds/1/config.json");
        TypedConfigStore<GuildConfig> s = new TypedConfigStore<>(p, GuildConfig.class, GuildConfig::new);
        s.cfg().autoPostChannelId = "123";
        s.cfg().autoPostEnabled = false;
        s.save();

        TypedConfigStore<GuildConfig> again = new TypedConfigStore<>(p, GuildConfig.class, GuildConfig::new);
        assertTrue(again.loadedFromDisk());
        assertEquals("123", again.cfg().autoPostChannelId);
        assertFalse(again.cfg().autoPostEnabled);
    }

    @Test
    public void testUnknownKeysAreIgnored() throws Exception {
        Path p = tmp.resolve("config.json");
        Files.writeString(p, "{\"leaderboardLimit\": 5, \"countingChannelId\": \"42\"}");

        GlobalConfig cfg = new TypedConfigStore<>(p, GlobalConfig.class, GlobalConfig::new).cfg();
        assertEquals(5, cfg.leaderboardLimit);
        assertEquals("wordle", cfg.resultsBotName);
    }

    @Test
    public void testBrokenFileFallsBackToDefaults() throws Exception {
        Path p = tmp.resolve("config.json");
        Files.writeString(p, "{ not json");

        TypedConfigStore<GlobalConfig> s = new TypedConfigStore<>(p, GlobalConfig.class, GlobalConfig::new);
        assertFalse(s.loadedFromDisk());
        assertEquals(10, s.cfg().leaderboardLimit);
    }
}
