package com.triagedesk.support.desk.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cross-instance mutual exclusion via PostgreSQL session advisory locks.
 *
 * The lock is taken and released on one pinned connection, so it cannot leak onto a pooled connection.
 * Databases without advisory locks (H2 in dev) run the work unguarded; in-process overlap is handled by
 * the caller. Any other failure to take the lock propagates and the work does not run.
 */
@Repository
public class ScanLockRepository {

    private static final Logger log = LoggerFactory.getLogger(ScanLockRepository.class);

    static final String UNDEFINED_FUNCTION = "42883";

    private final JdbcTemplate jdbcTemplate;

    // null until the first connection has been inspected
    private volatile Boolean advisoryLocksSupported;

    public ScanLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return the work's result, or empty when another holder owns the lock
     */
    public <T> Optional<T> runExclusive(String key, Supplier<T> work) {
        return jdbcTemplate.execute((ConnectionCallback<Optional<T>>) con -> {
            var locked = tryLock(con, key);
            if (locked == Lock.BUSY) {
                log.info("scan_lock_busy key={}", key);
                return Optional.empty();
            }
            try {
                return Optional.ofNullable(work.get());
            } finally {
                if (locked == Lock.HELD) {
                    unlock(con, key);
                }
            }
        });
    }

    private enum Lock { HELD, BUSY, UNSUPPORTED }

    private Lock tryLock(Connection con, String key) throws SQLException {
        if (!supportsAdvisoryLocks(con)) return Lock.UNSUPPORTED;
        try (var ps = con.prepareStatement("select pg_try_advisory_lock(hashtext(?)::bigint)")) {
            ps.setString(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1) ? Lock.HELD : Lock.BUSY;
            }
        } catch (SQLException e) {
            if (!UNDEFINED_FUNCTION.equals(e.getSQLState())) {
                throw e;
            }
            advisoryLocksSupported = false;
            log.info("advisory_locks_unavailable key={} reason={}", key, e.getMessage());
            return Lock.UNSUPPORTED;
        }
    }

    private boolean supportsAdvisoryLocks(Connection con) throws SQLException {
        var supported = advisoryLocksSupported;
        if (supported == null) {
            var product = con.getMetaData().getDatabaseProductName();
            supported = product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
            advisoryLocksSupported = supported;
            if (!supported) {
                log.info("advisory_locks_unavailable database={}", product);
            }
        }
        return supported;
    }

    private void unlock(Connection con, String key) throws SQLException {
        try (var ps = con.prepareStatement("select pg_advisory_unlock(hashtext(?)::bigint)")) {
            ps.setString(1, key);
            ps.executeQuery().close();
        }
    }
}
