package jobhub.backend.logs;

import jobhub.backend.error.LogGroupNotFoundException;
import jobhub.backend.model.LogEvent;
import jobhub.backend.model.LogEventSource;
import jobhub.backend.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Log store over the {@code log_groups} and {@code log_events} tables.
 * Pages are keyset-paginated on {@code (event_time, id)}, so appends between pages
 * never shift or duplicate events already returned.
 */
public class JdbcLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcLogSink.class);

    private final Database db;

    public JdbcLogSink(Database db) {
        this.db = db;
    }

    /** Create the group if it does not exist yet */
    public void createGroup(String group) {
        String sql = "MERGE INTO log_groups (log_group) KEY (log_group) VALUES (?)";
        String portableSql = """
                    INSERT INTO log_groups (log_group)
                    SELECT ? WHERE NOT EXISTS (SELECT 1 FROM log_groups WHERE log_group = ?)
                """;

        db.inTransaction("create log group " + group, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(isH2(conn) ? sql : portableSql)) {
                ps.setString(1, group);
                if (!isH2(conn)) {
                    ps.setString(2, group);
                }
                return ps.executeUpdate();
            }
        });
    }

    public boolean groupExists(String group) {
        return db.inTransaction("check log group " + group, conn -> groupExists(conn, group));
    }

    public void append(String group, String stream, LogEvent event) {
        appendAll(group, stream, List.of(event));
    }

    /** Append events to a stream, creating the group on first use */
    public void appendAll(String group, String stream, List<LogEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        createGroup(group);

        String sql = """
                    INSERT INTO log_events (log_group, log_stream, job_id, event_time, source, message)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction("append logs to " + group + "/" + stream, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (LogEvent event : events) {
                    ps.setString(1, group);
                    ps.setString(2, stream);
                    ps.setString(3, event.jobId());
                    ps.setTimestamp(4, Timestamp.from(event.timestamp()));
                    ps.setString(5, event.source().name());
                    ps.setString(6, event.message());
                    ps.addBatch();
                }
                return ps.executeBatch().length;
            }
        });
        log.debug("Appended {} events to {}/{}", events.size(), group, stream);
    }

    @Override
    public LogPage query(LogQuery query) {
        Cursor cursor = query.token() != null ? Cursor.decode(query.token()) : null;
        String cmp = query.descending() ? "<" : ">";
        String order = query.descending() ? "DESC" : "ASC";

        StringBuilder sql = new StringBuilder("""
                    SELECT id, job_id, event_time, source, message FROM log_events
                    WHERE log_group = ? AND log_stream = ? AND event_time >= ?
                """);
        if (query.end() != null) {
            sql.append(" AND event_time < ?");
        }
        if (cursor != null) {
            sql.append(" AND (event_time ").append(cmp).append(" ? OR (event_time = ? AND id ")
                    .append(cmp).append(" ?))");
        }
        sql.append(" ORDER BY event_time ").append(order).append(", id ").append(order).append(" LIMIT ?");

        return db.inTransaction("query logs " + query.group() + "/" + query.stream(), conn -> {
            if (!groupExists(conn, query.group())) {
                throw new LogGroupNotFoundException(query.group());
            }
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                int i = 1;
                ps.setString(i++, query.group());
                ps.setString(i++, query.stream());
                ps.setTimestamp(i++, Timestamp.from(query.start()));
                if (query.end() != null) {
                    ps.setTimestamp(i++, Timestamp.from(query.end()));
                }
                if (cursor != null) {
                    ps.setTimestamp(i++, Timestamp.from(cursor.time()));
                    ps.setTimestamp(i++, Timestamp.from(cursor.time()));
                    ps.setLong(i++, cursor.id());
                }
                // One extra row tells whether another page exists
                ps.setInt(i, query.limit() + 1);

                List<LogEvent> events = new ArrayList<>();
                Cursor last = null;
                boolean more = false;
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        if (events.size() == query.limit()) {
                            more = true;
                            break;
                        }
                        Instant time = rs.getTimestamp("event_time").toInstant();
                        events.add(new LogEvent(
                                time,
                                rs.getString("job_id"),
                                rs.getString("message"),
                                LogEventSource.valueOf(rs.getString("source"))));
                        last = new Cursor(time, rs.getLong("id"));
                    }
                }
                return new LogPage(events, more ? last.encode() : null);
            }
        });
    }

    private static boolean groupExists(Connection conn, String group) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM log_groups WHERE log_group = ?")) {
            ps.setString(1, group);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static boolean isH2(Connection conn) throws SQLException {
        return conn.getMetaData().getDatabaseProductName().toLowerCase().contains("h2");
    }

    /** Position after the last returned event */
    record Cursor(Instant time, long id) {

        String encode() {
            String raw = time.getEpochSecond() + ":" + time.getNano() + ":" + id;
            return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        }

        static Cursor decode(String token) {
            try {
                String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
                String[] parts = raw.split(":");
                if (parts.length != 3) {
                    throw new IllegalArgumentException("Malformed log token: " + token);
                }
                return new Cursor(
                        Instant.ofEpochSecond(Long.parseLong(parts[0]), Long.parseLong(parts[1])),
                        Long.parseLong(parts[2]));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed log token: " + token, e);
            }
        }
    }
}
