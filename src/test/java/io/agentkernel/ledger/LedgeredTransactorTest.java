package io.agentkernel.ledger;

import io.agentkernel.KernelFixtures;
import io.agentkernel.config.KernelConfig;
import io.agentkernel.error.HaltSwitch;
import io.agentkernel.error.LedgerCorruptionException;
import io.agentkernel.error.PersistenceException;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class LedgeredTransactorTest {

    @Test
    void stateCommitsTogetherWithItsEvent() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-tx-commit-");
        try {
            Fixture f = new Fixture(root);
            f.transactor.inTransaction("insert lazy slot", (c, recorder) -> {
                insertSlot(c, "r-1");
                return recorder.record(LedgerEventType.REQUEST_ADMITTED, Map.of("request_id", "r-1"), "agent-a");
            });

            Assertions.assertEquals(1, f.slots());
            Assertions.assertEquals(1L, f.ledger.size());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void failureBeforeAnyEventIsRetried() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-tx-retry-");
        try {
            Fixture f = new Fixture(root);
            AtomicInteger attempts = new AtomicInteger();
            f.transactor.inTransaction("flaky insert", (c, recorder) -> {
                insertSlot(c, "r-1");
                if (attempts.incrementAndGet() == 1) {
                    throw new SQLException("database is locked");
                }
                return recorder.record(LedgerEventType.REQUEST_ADMITTED, Map.of("request_id", "r-1"), "agent-a");
            });

            Assertions.assertEquals(2, attempts.get());
            Assertions.assertEquals(1, f.slots());
            Assertions.assertEquals(1L, f.ledger.size());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void failureAfterAnEventRollsBackAndHalts() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-tx-halt-");
        try {
            Fixture f = new Fixture(root);
            AtomicInteger attempts = new AtomicInteger();
            Assertions.assertThrows(PersistenceException.class, () -> f.transactor.inTransaction("half done",
                    (c, recorder) -> {
                        attempts.incrementAndGet();
                        insertSlot(c, "r-1");
                        recorder.record(LedgerEventType.REQUEST_ADMITTED, Map.of("request_id", "r-1"), "agent-a");
                        throw new SQLException("disk full");
                    }));

            Assertions.assertEquals(1, attempts.get());
            Assertions.assertEquals(0, f.slots());
            Assertions.assertTrue(f.halt.isHalted());
            Assertions.assertThrows(LedgerCorruptionException.class,
                    () -> f.transactor.inTransaction("after halt", (c, recorder) -> null));
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void runtimeFailureRollsBackWithoutHalting() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-tx-runtime-");
        try {
            Fixture f = new Fixture(root);
            Assertions.assertThrows(IllegalStateException.class, () -> f.transactor.inTransaction("rejected",
                    (c, recorder) -> {
                        insertSlot(c, "r-1");
                        throw new IllegalStateException("not allowed");
                    }));

            Assertions.assertEquals(0, f.slots());
            Assertions.assertFalse(f.halt.isHalted());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    private static void insertSlot(Connection c, String requestId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO lazy_queue(request_id,task_id,enqueued_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, requestId);
            ps.setString(2, "task-" + requestId);
            ps.setLong(3, System.currentTimeMillis());
            ps.executeUpdate();
        }
    }

    private static final class Fixture {
        private final HaltSwitch halt = new HaltSwitch();
        private final Database database;
        private final Ledger ledger;
        private final LedgeredTransactor transactor;

        private Fixture(Path root) {
            KernelConfig config = KernelConfig.fromRoot(root.toString());
            Backoff backoff = new Backoff(3, 1L, 5L);
            this.database = new Database(config);
            database.init();
            this.ledger = new Ledger(config.ledgerFile(), halt, backoff);
            ledger.open();
            this.transactor = new LedgeredTransactor(database, ledger, backoff, halt);
        }

        private int slots() throws SQLException {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM lazy_queue");
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }
}
