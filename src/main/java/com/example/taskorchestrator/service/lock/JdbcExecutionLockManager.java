package com.example.taskorchestrator.service.lock;

import com.example.taskorchestrator.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

/**
 * Lock manager backed by the {@code execution_locks} table.
 * <p>
 * Acquisition is insert-then-conditional-update: the primary key on {@code resource_id}
 * makes the insert atomic, and an expired row is taken over with a single UPDATE guarded
 * by {@code expires_at <= now}. Expiry is therefore evaluated by every statement and needs
 * no process to notice that a holder died.
 * <p>
 * Statements must run outside a surrounding transaction: a duplicate-key failure aborts
 * the whole transaction on PostgreSQL.
 * <p>
 * Times are written as UTC offset timestamps into {@code TIMESTAMP WITH TIME ZONE} columns,
 * so workers with different JVM default zones compare the same instants. Each worker's
 * clock is still the reference for expiry: clock skew between workers must stay well
 * below the lock TTL minus the heartbeat interval.
 */
@Slf4j
@Repository
public class JdbcExecutionLockManager implements ExecutionLockManager {

    private static final String INSERT_SQL = """
            INSERT INTO execution_locks (resource_id, holder_id, lock_token, acquired_at, expires_at, heartbeat_count)
            VALUES (?, ?, ?, ?, ?, 0)
            """;

    private static final String TAKE_OVER_EXPIRED_SQL = """
            UPDATE execution_locks
            SET holder_id = ?, lock_token = ?, acquired_at = ?, expires_at = ?, heartbeat_count = 0
            WHERE resource_id = ? AND expires_at <= ?
            """;

    private static final String HEARTBEAT_SQL = """
            UPDATE execution_locks
            SET expires_at = ?, heartbeat_count = heartbeat_count + 1
            WHERE resource_id = ? AND lock_token = ? AND expires_at > ?
            """;

    private static final String RELEASE_SQL = "DELETE FROM execution_locks WHERE resource_id = ? AND lock_token = ?";

    private static final String FIND_LIVE_SQL = """
            SELECT resource_id, holder_id, lock_token, acquired_at, expires_at, heartbeat_count
            FROM execution_locks
            WHERE resource_id = ? AND expires_at > ?
            """;

    private static final String PURGE_SQL = "DELETE FROM execution_locks WHERE expires_at <= ?";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final RowMapper<ExecutionLock> rowMapper = new ExecutionLockRowMapper();

    public JdbcExecutionLockManager(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<ExecutionLock> acquire(String resourceId, String holderId, Duration ttl) {
        var now = clock.instant();
        var lock = ExecutionLock.builder()
                .resourceId(resourceId)
                .holderId(holderId)
                .token(UUID.randomUUID().toString())
                .acquiredAt(now)
                .expiresAt(now.plus(ttl))
                .heartbeatCount(0)
                .build();

        try {
            try {
                jdbcTemplate.update(INSERT_SQL, resourceId, holderId, lock.getToken(),
                        utc(now), utc(lock.getExpiresAt()));
                log.debug("Acquired lock {} for holder {} until {}", resourceId, holderId, lock.getExpiresAt());
                return Optional.of(lock);
            } catch (DuplicateKeyException e) {
                // A row exists; it can only be taken over if it has expired
                var rows = jdbcTemplate.update(TAKE_OVER_EXPIRED_SQL, holderId, lock.getToken(),
                        utc(now), utc(lock.getExpiresAt()), resourceId, utc(now));
                if (rows == 1) {
                    log.info("Took over expired lock {} for holder {}", resourceId, holderId);
                    return Optional.of(lock);
                }
                log.debug("Lock {} denied to holder {}, held by another holder", resourceId, holderId);
                return Optional.empty();
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("lock acquire " + resourceId, e);
        }
    }

    @Override
    public Optional<ExecutionLock> heartbeat(ExecutionLock lock, Duration ttl) {
        var now = clock.instant();
        var newExpiry = now.plus(ttl);

        try {
            var rows = jdbcTemplate.update(HEARTBEAT_SQL, utc(newExpiry),
                    lock.getResourceId(), lock.getToken(), utc(now));
            if (rows == 1) {
                log.debug("Extended lock {} until {}", lock.getResourceId(), newExpiry);
                return Optional.of(lock.withExpiresAt(newExpiry).withHeartbeatCount(lock.getHeartbeatCount() + 1));
            }
            log.warn("Lost lock {} held by {} (expired or taken over)", lock.getResourceId(), lock.getHolderId());
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("lock heartbeat " + lock.getResourceId(), e);
        }
    }

    @Override
    public void release(ExecutionLock lock) {
        try {
            var rows = jdbcTemplate.update(RELEASE_SQL, lock.getResourceId(), lock.getToken());
            if (rows > 0) {
                log.debug("Released lock {} by holder {}", lock.getResourceId(), lock.getHolderId());
            } else {
                log.debug("Lock {} was no longer held by {}", lock.getResourceId(), lock.getHolderId());
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("lock release " + lock.getResourceId(), e);
        }
    }

    @Override
    public Optional<ExecutionLock> findLive(String resourceId) {
        try {
            var locks = jdbcTemplate.query(FIND_LIVE_SQL, rowMapper, resourceId, utc(clock.instant()));
            return locks.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("lock lookup " + resourceId, e);
        }
    }

    @Override
    public int purgeExpired() {
        try {
            return jdbcTemplate.update(PURGE_SQL, utc(clock.instant()));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("lock purge", e);
        }
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static class ExecutionLockRowMapper implements RowMapper<ExecutionLock> {
        @Override
        public ExecutionLock mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ExecutionLock.builder()
                    .resourceId(rs.getString("resource_id"))
                    .holderId(rs.getString("holder_id"))
                    .token(rs.getString("lock_token"))
                    .acquiredAt(rs.getObject("acquired_at", OffsetDateTime.class).toInstant())
                    .expiresAt(rs.getObject("expires_at", OffsetDateTime.class).toInstant())
                    .heartbeatCount(rs.getInt("heartbeat_count"))
                    .build();
        }
    }
}
