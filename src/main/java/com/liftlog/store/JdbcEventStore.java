package com.liftlog.store;

import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Event log kept in the {@code events} table (see {@code schema.sql}).
 * Append order is the identity column, not the timestamp.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String INSERT_SQL = """
            INSERT INTO events (event_id, user_id, occurred_at, event_type, payload, schema_version)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_SQL = """
            SELECT event_id, user_id, occurred_at, event_type, payload, schema_version
            FROM events
            WHERE user_id = ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final EventPayloadCodec codec;
    private final Clock clock;
    private final int schemaVersion;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, EventPayloadCodec codec, Clock clock, int schemaVersion) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.clock = clock;
        this.schemaVersion = schemaVersion;
    }

    @Override
    public EventRecord stamp(String userId, EventPayload payload) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Instant last = lastTimestamp(userId);
        if (last != null && now.isBefore(last)) {
            now = last;
        }
        return new EventRecord(UUID.randomUUID().toString(), userId, now, payload.type(), payload, schemaVersion);
    }

    @Override
    public EventRecord append(EventRecord record) {
        try {
            jdbcTemplate.update(INSERT_SQL,
                record.eventId(),
                record.userId(),
                toColumn(record.timestamp()),
                record.type().getValue(),
                codec.encode(record.payload()),
                record.schemaVersion());
            return record;
        } catch (DataAccessException ex) {
            log.warn("Append failed for user={} event_id={}: {}", record.userId(), record.eventId(), ex.getMessage());
            throw new StorageFailureException("append failed for event " + record.eventId(), ex);
        }
    }

    @Override
    public EventSequence list(String userId, EventFilter filter) {
        return new EventSequence(() -> query(userId, filter).stream());
    }

    private List<EventRecord> query(String userId, EventFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT_SQL);
        List<Object> args = new ArrayList<>();
        args.add(userId);
        if (!filter.types().isEmpty()) {
            sql.append(" AND event_type IN (");
            sql.append(String.join(", ", filter.types().stream().map(t -> "?").toList()));
            sql.append(')');
            filter.types().stream().map(EventType::getValue).sorted().forEach(args::add);
        }
        if (filter.from() != null) {
            sql.append(" AND occurred_at >= ?");
            args.add(toColumn(filter.from()));
        }
        if (filter.to() != null) {
            sql.append(" AND occurred_at < ?");
            args.add(toColumn(filter.to()));
        }
        sql.append(filter.order() == EventFilter.Order.REVERSE ? " ORDER BY id DESC" : " ORDER BY id ASC");
        if (filter.limit() != Integer.MAX_VALUE) {
            sql.append(" LIMIT ").append(filter.limit());
        }
        try {
            return jdbcTemplate.query(sql.toString(), rowMapper(), args.toArray());
        } catch (DataAccessException ex) {
            throw new StorageFailureException("listing events failed for user " + userId, ex);
        }
    }

    private RowMapper<EventRecord> rowMapper() {
        return (rs, rowNum) -> {
            EventType type = EventType.fromValue(rs.getString("event_type"));
            return new EventRecord(
                rs.getString("event_id"),
                rs.getString("user_id"),
                rs.getObject("occurred_at", OffsetDateTime.class).toInstant(),
                type,
                codec.decode(type, rs.getString("payload")),
                rs.getInt("schema_version"));
        };
    }

    private Instant lastTimestamp(String userId) {
        try {
            OffsetDateTime last = jdbcTemplate.queryForObject(
                "SELECT MAX(occurred_at) FROM events WHERE user_id = ?", OffsetDateTime.class, userId);
            return last == null ? null : last.toInstant();
        } catch (DataAccessException ex) {
            throw new StorageFailureException("reading last timestamp failed for user " + userId, ex);
        }
    }

    private static OffsetDateTime toColumn(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    @Override
    public long count(String userId) {
        try {
            Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM events WHERE user_id = ?", Long.class, userId);
            return count == null ? 0 : count;
        } catch (DataAccessException ex) {
            throw new StorageFailureException("counting events failed for user " + userId, ex);
        }
    }

    @Override
    public Set<String> userIds() {
        try {
            return new HashSet<>(jdbcTemplate.queryForList("SELECT DISTINCT user_id FROM events", String.class));
        } catch (DataAccessException ex) {
            throw new StorageFailureException("listing users failed", ex);
        }
    }
}
