package io.agentkernel.storage;

import io.agentkernel.config.KernelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * The kernel's state store ({@code kernel.db}): agents, oath records, tasks, routing decisions and
 * the lazy queue. The ledger keeps its own file so that a task transaction can stay open while an
 * event is appended.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "agentkernel.schema.migration.v1";
    static final int BUSY_TIMEOUT_MS = 5000;

    private final KernelConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(KernelConfig config) {
        this.config = config;
        this.jdbcUrl = jdbcUrl(config.dbFile());
        this.connectionProperties = connectionProperties(SQLiteConfig.SynchronousMode.NORMAL);
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
        log.info("Kernel store ready at {}", config.dbFile());
    }

    /**
     * Opens a connection whose transactions start as {@code BEGIN IMMEDIATE}, so that concurrent
     * writers queue on the busy timeout instead of failing on lock upgrade.
     */
    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * True when any agent or task exists. Used at boot to refuse pairing existing state with an
     * empty ledger.
     */
    public boolean hasKernelState() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT (SELECT COUNT(1) FROM agents) + (SELECT COUNT(1) FROM tasks)")) {
            return rs.next() && rs.getLong(1) > 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to inspect kernel store", e);
        }
    }

    public static String jdbcUrl(Path file) {
        return "jdbc:sqlite:" + file.toString();
    }

    public static Properties connectionProperties(SQLiteConfig.SynchronousMode synchronous) {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(synchronous);
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return sqlite.toProperties();
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.ledgerRoot());
            Files.createDirectories(config.policyRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agents (
                        agent_id TEXT PRIMARY KEY,
                        public_key TEXT NOT NULL,
                        capabilities TEXT NOT NULL,
                        oath_status TEXT NOT NULL,
                        oath_event_sequence INTEGER,
                        registered_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS oath_records (
                        oath_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        agent_id TEXT NOT NULL,
                        policy_hash TEXT NOT NULL,
                        signature TEXT NOT NULL,
                        sworn_at_ms INTEGER NOT NULL,
                        valid INTEGER NOT NULL,
                        ledger_sequence INTEGER NOT NULL,
                        FOREIGN KEY(agent_id) REFERENCES agents(agent_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL UNIQUE,
                        request_id TEXT,
                        source_agent_id TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        tier TEXT NOT NULL,
                        tier_rank INTEGER NOT NULL,
                        placement_rank INTEGER NOT NULL DEFAULT 0,
                        user_priority INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL,
                        claimed_by TEXT,
                        claim_epoch INTEGER NOT NULL DEFAULT 0,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL,
                        result_payload TEXT,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        claimed_at_ms INTEGER,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS routing_decisions (
                        request_id TEXT PRIMARY KEY,
                        content_key TEXT NOT NULL,
                        source_agent_id TEXT NOT NULL,
                        tier TEXT NOT NULL,
                        reason TEXT NOT NULL,
                        rejection TEXT,
                        concepts TEXT NOT NULL DEFAULT '[]',
                        created_task_id TEXT,
                        decided_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS lazy_queue (
                        request_id TEXT PRIMARY KEY,
                        task_id TEXT NOT NULL UNIQUE,
                        enqueued_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_oath_records_agent ON oath_records(agent_id, oath_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_routing_content ON routing_decisions(content_key, decided_at_ms)");

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_pending_order_index",
                "Index the pending queue in scheduling order",
                List.of("CREATE INDEX IF NOT EXISTS idx_tasks_pending_order "
                        + "ON tasks(status, tier_rank, placement_rank, user_priority DESC, created_at_ms, seq)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_routing_decided_at_index",
                "Index routing decisions by decision time",
                List.of("CREATE INDEX IF NOT EXISTS idx_routing_decided_at ON routing_decisions(decided_at_ms)")
        ));
        steps.add(new MigrationStep(
                "20261019_003_routing_arrival_time",
                "Key the idempotency window and window purges on request arrival time",
                List.of(
                        "ALTER TABLE routing_decisions ADD COLUMN arrived_at_ms INTEGER NOT NULL DEFAULT 0",
                        "UPDATE routing_decisions SET arrived_at_ms=decided_at_ms WHERE arrived_at_ms=0",
                        "CREATE INDEX IF NOT EXISTS idx_routing_content_arrival ON routing_decisions(content_key, arrived_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_routing_arrived_at ON routing_decisions(arrived_at_ms)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
        log.info("Applied schema migration {}", step.version());
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    public static void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
