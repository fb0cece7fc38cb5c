package io.agentkernel.ledger;

import io.agentkernel.error.HaltSwitch;
import io.agentkernel.error.PersistenceException;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Runs a {@code kernel.db} transaction whose state change is committed only after the ledger
 * accepted the events describing it. A failed append rolls the state change back.
 *
 * <p>Storage errors raised before any event was recorded are retried with {@link Backoff}; once an
 * event is on the chain the attempt is never repeated, so a failed commit surfaces as a
 * {@link PersistenceException} and the transition is recovered by the maintenance sweeps.
 */
public final class LedgeredTransactor {
    private final Database database;
    private final Ledger ledger;
    private final Backoff backoff;
    private final HaltSwitch halt;

    public LedgeredTransactor(Database database, Ledger ledger, Backoff backoff, HaltSwitch halt) {
        this.database = database;
        this.ledger = ledger;
        this.backoff = backoff;
        this.halt = halt;
    }

    public <T> T inTransaction(String operation, Work<T> work) {
        halt.ensureWritable();
        try {
            return backoff.call(operation, () -> runOnce(operation, work));
        } catch (PersistenceException e) {
            halt.trip(operation + ": kernel store unavailable", ledger.head().sequenceNumber());
            throw e;
        }
    }

    private <T> T runOnce(String operation, Work<T> work) throws SQLException {
        Recorder recorder = new Recorder();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c, recorder);
                c.commit();
                return out;
            } catch (SQLException e) {
                rollback(c, e);
                if (recorder.recorded > 0) {
                    throw new PersistenceException(
                            operation + " failed after " + recorder.recorded + " ledger event(s) were written", 1, e);
                }
                throw e;
            } catch (RuntimeException e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @FunctionalInterface
    public interface Work<T> {
        T run(Connection connection, Recorder recorder) throws SQLException;
    }

    /**
     * Appends on behalf of the open transaction.
     */
    public final class Recorder {
        private int recorded;

        private Recorder() {
        }

        public LedgerEvent record(LedgerEventType type, Map<String, Object> payload, String actor) {
            LedgerEvent event = ledger.append(type, payload, actor);
            recorded++;
            return event;
        }
    }
}
