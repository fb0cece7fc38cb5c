package io.agentkernel.ledger;

import io.agentkernel.error.HaltSwitch;
import io.agentkernel.error.LedgerCorruptionException;
import io.agentkernel.error.PersistenceException;
import io.agentkernel.security.SensitiveDataMasker;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;
import io.agentkernel.util.Hashing;
import io.agentkernel.util.Jsons;
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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Append-only, hash-chained event store. Appends are serialized behind one lock and committed
 * with {@code synchronous=FULL} before returning; reads open their own connections and see a
 * committed prefix of the chain.
 */
public final class Ledger {
    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    public static final String GENESIS_HASH = "0".repeat(64);
    static final int PAGE_SIZE = 256;

    private final Path ledgerFile;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final HaltSwitch halt;
    private final Backoff backoff;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile LedgerHead head = new LedgerHead(-1L, GENESIS_HASH);

    public Ledger(Path ledgerFile, HaltSwitch halt, Backoff backoff) {
        this.ledgerFile = ledgerFile;
        this.jdbcUrl = Database.jdbcUrl(ledgerFile);
        this.connectionProperties = Database.connectionProperties(SQLiteConfig.SynchronousMode.FULL);
        this.halt = halt;
        this.backoff = backoff;
    }

    /**
     * Creates the store when absent and resumes from the last persisted event.
     */
    public void open() {
        try {
            Files.createDirectories(ledgerFile.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize ledger directory: " + ledgerFile, e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ledger_events (
                        sequence_number INTEGER PRIMARY KEY,
                        prev_hash TEXT NOT NULL,
                        hash TEXT NOT NULL,
                        event_type TEXT NOT NULL,
                        actor TEXT NOT NULL,
                        timestamp TEXT NOT NULL,
                        payload TEXT NOT NULL
                    )
                    """);
            Database.validatePragma(st, "journal_mode", "wal");
            Database.validatePragma(st, "synchronous", "2");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize ledger schema", e);
        }
        this.head = loadHead();
        if (head.isEmpty()) {
            log.info("Ledger at {} is empty, chain starts from genesis", ledgerFile);
        } else {
            log.info("Ledger resumed at sequence {} ({})", head.sequenceNumber(), shortHash(head.hash()));
        }
    }

    public LedgerEvent append(LedgerEventType type, Map<String, Object> payload, String actor) {
        if (type == null) {
            throw new IllegalArgumentException("event type is required");
        }
        String safeActor = actor == null || actor.isBlank() ? "kernel" : actor.trim();
        String payloadText = Jsons.toCanonicalJson(SensitiveDataMasker.maskedMap(payload));
        writeLock.lock();
        try {
            halt.ensureWritable();
            LedgerHead current = head;
            long sequence = current.sequenceNumber() + 1L;
            String timestamp = Instant.now().toString();
            String hash = computeHash(current.hash(), sequence, type.name(), safeActor, timestamp, payloadText);
            LedgerEvent event = new LedgerEvent(sequence, current.hash(), hash, type, payloadText, timestamp, safeActor);
            try {
                backoff.call("ledger append #" + sequence, () -> {
                    insert(event);
                    return null;
                });
            } catch (PersistenceException e) {
                halt.trip("ledger append failed after " + e.attempts() + " attempts", sequence);
                throw e;
            }
            head = new LedgerHead(sequence, hash);
            log.debug("Appended {} #{} by {}", type, sequence, safeActor);
            return event;
        } finally {
            writeLock.unlock();
        }
    }

    public LedgerHead head() {
        return head;
    }

    public long size() {
        return head.size();
    }

    /**
     * Walks the whole chain from genesis. A failure trips the global halt.
     */
    public ChainVerification verifyChainIntegrity() {
        long bound = loadHead().sequenceNumber();
        String expectedPrev = GENESIS_HASH;
        long expectedSeq = 0L;
        long checked = 0L;
        while (expectedSeq <= bound) {
            List<RawRow> page = readPage(expectedSeq, bound);
            if (page.isEmpty()) {
                return fail(checked, expectedSeq, "sequence_gap");
            }
            for (RawRow row : page) {
                if (row.sequenceNumber() != expectedSeq) {
                    return fail(checked, expectedSeq, "sequence_gap");
                }
                if (!expectedPrev.equals(row.prevHash())) {
                    return fail(checked, row.sequenceNumber(), "prev_hash_mismatch");
                }
                String recomputed = computeHash(row.prevHash(), row.sequenceNumber(), row.eventType(),
                        row.actor(), row.timestamp(), row.payload());
                if (!recomputed.equals(row.hash())) {
                    return fail(checked, row.sequenceNumber(), "hash_mismatch");
                }
                if (!isKnownType(row.eventType())) {
                    return fail(checked, row.sequenceNumber(), "unreadable_event");
                }
                expectedPrev = row.hash();
                expectedSeq++;
                checked++;
            }
        }
        return ChainVerification.intact(checked);
    }

    /**
     * Events with {@code sequenceNumber >= fromSequence}, fetched page by page. Each call to
     * {@code iterator()} starts over and stops at the head observed at that moment.
     */
    public Iterable<LedgerEvent> eventsSince(long fromSequence) {
        long start = Math.max(0L, fromSequence);
        return () -> new PagedIterator(start, head.sequenceNumber());
    }

    public Stream<LedgerEvent> stream(long fromSequence) {
        return StreamSupport.stream(eventsSince(fromSequence).spliterator(), false);
    }

    public static String computeHash(String prevHash, long sequenceNumber, String eventType,
                                     String actor, String timestamp, String payloadText) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("sequence_number", sequenceNumber);
        canonical.put("event_type", eventType);
        canonical.put("actor", actor);
        canonical.put("timestamp", timestamp);
        canonical.put("payload", payloadText);
        return Hashing.sha256Hex(prevHash, Jsons.toCanonicalJson(canonical));
    }

    private ChainVerification fail(long checked, long sequenceNumber, String reason) {
        halt.trip("ledger chain broken: " + reason, sequenceNumber);
        return ChainVerification.broken(checked, sequenceNumber, reason);
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void insert(LedgerEvent event) throws SQLException {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO ledger_events(sequence_number,prev_hash,hash,event_type,actor,timestamp,payload)
                     VALUES(?,?,?,?,?,?,?)
                     """)) {
            ps.setLong(1, event.sequenceNumber());
            ps.setString(2, event.prevHash());
            ps.setString(3, event.hash());
            ps.setString(4, event.eventType().name());
            ps.setString(5, event.actor());
            ps.setString(6, event.timestamp());
            ps.setString(7, event.payload());
            ps.executeUpdate();
        }
    }

    private LedgerHead loadHead() {
        return backoff.call("ledger head", () -> {
            try (Connection conn = openConnection();
                 PreparedStatement ps = conn.prepareStatement(
                         "SELECT sequence_number, hash FROM ledger_events ORDER BY sequence_number DESC LIMIT 1");
                 ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new LedgerHead(-1L, GENESIS_HASH);
                }
                return new LedgerHead(rs.getLong(1), rs.getString(2));
            }
        });
    }

    private List<RawRow> readPage(long fromSequence, long bound) {
        return backoff.call("ledger read", () -> {
            List<RawRow> out = new ArrayList<>();
            try (Connection conn = openConnection();
                 PreparedStatement ps = conn.prepareStatement("""
                         SELECT sequence_number,prev_hash,hash,event_type,actor,timestamp,payload
                         FROM ledger_events
                         WHERE sequence_number >= ? AND sequence_number <= ?
                         ORDER BY sequence_number ASC
                         LIMIT ?
                         """)) {
                ps.setLong(1, fromSequence);
                ps.setLong(2, bound);
                ps.setInt(3, PAGE_SIZE);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new RawRow(
                                rs.getLong(1),
                                rs.getString(2),
                                rs.getString(3),
                                rs.getString(4),
                                rs.getString(5),
                                rs.getString(6),
                                rs.getString(7)
                        ));
                    }
                }
            }
            return out;
        });
    }

    private static boolean isKnownType(String raw) {
        for (LedgerEventType type : LedgerEventType.values()) {
            if (type.name().equals(raw)) {
                return true;
            }
        }
        return false;
    }

    private static String shortHash(String hash) {
        return hash == null || hash.length() < 12 ? String.valueOf(hash) : hash.substring(0, 12);
    }

    private record RawRow(
            long sequenceNumber,
            String prevHash,
            String hash,
            String eventType,
            String actor,
            String timestamp,
            String payload
    ) {
        LedgerEvent toEvent() {
            if (!isKnownType(eventType)) {
                throw new LedgerCorruptionException("Unknown event type '" + eventType + "'", sequenceNumber);
            }
            return new LedgerEvent(sequenceNumber, prevHash, hash, LedgerEventType.valueOf(eventType),
                    payload, timestamp, actor);
        }
    }

    private final class PagedIterator implements Iterator<LedgerEvent> {
        private final long bound;
        private long nextSequence;
        private Iterator<RawRow> page = List.<RawRow>of().iterator();
        private boolean exhausted;

        private PagedIterator(long start, long bound) {
            this.nextSequence = start;
            this.bound = bound;
            this.exhausted = start > bound;
        }

        @Override
        public boolean hasNext() {
            if (page.hasNext()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            List<RawRow> rows = readPage(nextSequence, bound);
            if (rows.isEmpty()) {
                exhausted = true;
                return false;
            }
            nextSequence = rows.get(rows.size() - 1).sequenceNumber() + 1L;
            exhausted = nextSequence > bound;
            page = rows.iterator();
            return true;
        }

        @Override
        public LedgerEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next().toEvent();
        }
    }
}
