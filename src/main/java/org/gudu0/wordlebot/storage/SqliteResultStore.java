package org.gudu0.wordlebot.storage;

import org.gudu0.wordlebot.parsing.ParticipantRef;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link ResultStore}.
 * <p>
 * Every call opens its own connection, so the store is safe to share between JDA event threads.
 * Deduplication is the UNIQUE(user_id, wordle_number, game_date) constraint: inserts use
 * ON CONFLICT DO NOTHING and a zero update count means the key was already taken.
 */
public class SqliteResultStore implements ResultStore {

    private static final int BUSY_TIMEOUT_MS = 5_000;

    private static final String[] SCHEMA = {
            """
            CREATE TABLE IF NOT EXISTS users (
                user_id      INTEGER PRIMARY KEY,
                username     TEXT,
                display_name TEXT,
                first_seen   INTEGER NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS games (
                id            INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id       INTEGER NOT NULL REFERENCES users(user_id),
                wordle_number INTEGER NOT NULL,
                game_date     TEXT    NOT NULL,
                guesses       INTEGER NOT NULL,
                score         INTEGER NOT NULL,
                success       INTEGER NOT NULL,
                created_at    INTEGER NOT NULL,
                UNIQUE (user_id, wordle_number, game_date)
            )""",
            "CREATE INDEX IF NOT EXISTS idx_games_user_date ON games(user_id, game_date)",
            "CREATE INDEX IF NOT EXISTS idx_games_date ON games(game_date)"
    };

    private static final String UPSERT_USER =
            "INSERT INTO users (user_id, username, display_name, first_seen) VALUES (?, ?, ?, ?) "
                    + "ON CONFLICT(user_id) DO UPDATE SET "
                    + "username = COALESCE(excluded.username, users.username), "
                    + "display_name = COALESCE(excluded.display_name, users.display_name)";

    private static final String INSERT_GAME =
            "INSERT INTO games (user_id, wordle_number, game_date, guesses, score, success, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?) "
                    + "ON CONFLICT(user_id, wordle_number, game_date) DO NOTHING";

    private static final String AGGREGATE =
            "SELECT g.user_id, u.username, u.display_name, u.first_seen, "
                    + "COUNT(*) AS games_played, "
                    + "SUM(g.score) AS total_score, "
                    + "AVG(g.score) AS average_score, "
                    + "SUM(CASE WHEN g.success THEN 1 ELSE 0 END) AS successful_games, "
                    + "MIN(g.game_date) AS first_game, "
                    + "MAX(g.game_date) AS last_game "
                    + "FROM games g LEFT JOIN users u ON u.user_id = g.user_id "
                    + "WHERE g.game_date >= ? AND g.game_date <= ? ";

    private final String jdbcUrl;
    private final Clock clock;

    public SqliteResultStore(Path dbFile) {
        this(dbFile, Clock.systemUTC());
    }

    public SqliteResultStore(Path dbFile, Clock clock) {
        Path abs = dbFile.toAbsolutePath();
        try {
            if (abs.getParent() != null) Files.createDirectories(abs.getParent());
        } catch (Exception e) {
            throw new StorageException("Cannot create database directory for " + abs, e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + abs;
        this.clock = clock;
    }

    @Override
    public void initSchema() {
        try (Connection c = connect(); Statement st = c.createStatement()) {
            st.execute("PRAGMA journal_mode = WAL");
            for (String ddl : SCHEMA) {
                st.execute(ddl);
            }
            ConsoleLog.info("SqliteResultStore", "Schema ready at " + jdbcUrl);
        } catch (SQLException e) {
            throw new StorageException("Schema init failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void upsertParticipant(ParticipantRef participant) {
        try (Connection c = connect()) {
            upsertUser(c, participant);
        } catch (SQLException e) {
            throw new StorageException("Participant upsert failed for userId=" + participant.id(), e);
        }
    }

    @Override
    public InsertOutcome insertResultIfAbsent(RoundResult result) {
        try (Connection c = connect()) {
            return insertGame(c, result);
        } catch (SQLException e) {
            throw new StorageException("Result insert failed for userId=" + result.participantId(), e);
        }
    }

    @Override
    public InsertOutcome recordResult(ParticipantRef participant, RoundResult result) {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                upsertUser(c, participant);
                InsertOutcome outcome = insertGame(c, result);
                c.commit();
                return outcome;
            } catch (SQLException e) {
                rollbackQuietly(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Recording result failed for userId=" + participant.id()
                    + " round=" + result.roundId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Participant> findParticipant(long participantId) {
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT user_id, username, display_name, first_seen FROM users WHERE user_id = ?")) {
            ps.setLong(1, participantId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Participant(
                        rs.getLong("user_id"),
                        rs.getString("username"),
                        rs.getString("display_name"),
                        Instant.ofEpochMilli(rs.getLong("first_seen"))));
            }
        } catch (SQLException e) {
            throw new StorageException("Participant lookup failed for userId=" + participantId, e);
        }
    }

    @Override
    public Optional<AggregateRow> aggregate(long participantId, LocalDate from, LocalDate to) {
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(AGGREGATE + "AND g.user_id = ? GROUP BY g.user_id")) {
            ps.setString(1, from.toString());
            ps.setString(2, to.toString());
            ps.setLong(3, participantId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readAggregate(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Stats query failed for userId=" + participantId, e);
        }
    }

    @Override
    public List<AggregateRow> aggregateAll(LocalDate from, LocalDate to) {
        List<AggregateRow> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(AGGREGATE + "GROUP BY g.user_id")) {
            ps.setString(1, from.toString());
            ps.setString(2, to.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readAggregate(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Leaderboard query failed for " + from + ".." + to, e);
        }
        return out;
    }

    @Override
    public List<LocalDate> playDates(long participantId) {
        List<LocalDate> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT DISTINCT game_date FROM games WHERE user_id = ? ORDER BY game_date")) {
            ps.setLong(1, participantId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(LocalDate.parse(rs.getString(1)));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Play dates query failed for userId=" + participantId, e);
        }
        return out;
    }

    @Override
    public long countResults() {
        try (Connection c = connect();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM games")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StorageException("Count query failed", e);
        }
    }

    // ----------------------------
    // Helpers
    // ----------------------------

    private Connection connect() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MS);
            st.execute("PRAGMA foreign_keys = ON");
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return c;
    }

    private void upsertUser(Connection c, ParticipantRef p) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(UPSERT_USER)) {
            ps.setLong(1, p.id());
            ps.setString(2, p.username());
            ps.setString(3, p.displayName());
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        }
    }

    private static InsertOutcome insertGame(Connection c, RoundResult r) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT_GAME)) {
            ps.setLong(1, r.participantId());
            ps.setInt(2, r.roundId());
            ps.setString(3, r.roundDate().toString());
            ps.setInt(4, r.attemptCount());
            ps.setInt(5, r.score());
            ps.setBoolean(6, r.succeeded());
            ps.setLong(7, r.createdAt().toEpochMilli());
            return ps.executeUpdate() > 0 ? InsertOutcome.INSERTED : InsertOutcome.DUPLICATE;
        }
    }

    private static AggregateRow readAggregate(ResultSet rs) throws SQLException {
        Object firstSeen = rs.getObject("first_seen");
        Participant participant = new Participant(
                rs.getLong("user_id"),
                rs.getString("username"),
                rs.getString("display_name"),
                firstSeen == null ? null : Instant.ofEpochMilli(((Number) firstSeen).longValue()));

        String first = rs.getString("first_game");
        String last = rs.getString("last_game");
        return new AggregateRow(
                participant,
                rs.getInt("games_played"),
                rs.getInt("total_score"),
                rs.getDouble("average_score"),
                rs.getInt("successful_games"),
                first == null ? null : LocalDate.parse(first),
                last == null ? null : LocalDate.parse(last));
    }

    private static void rollbackQuietly(Connection c, SQLException cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }
}
