package jobhub.backend.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ObjectStore: one row per key in the {@code objects} table.
 * {@link #putIfAbsent} relies on the primary key and is atomic.
 */
public class JdbcObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcObjectStore.class);

    private final Database db;
    private final UrlSigner urlSigner;

    public JdbcObjectStore(Database db, UrlSigner urlSigner) {
        this.db = db;
        this.urlSigner = urlSigner;
    }

    @Override
    public void put(String key, byte[] content) {
        String updateSql = "UPDATE objects SET content = ?, size_bytes = ?, updated_at = ? WHERE object_key = ?";
        String insertSql = "INSERT INTO objects (object_key, content, size_bytes, updated_at) VALUES (?, ?, ?, ?)";

        db.inTransaction("put object " + key, conn -> {
            Timestamp now = Timestamp.from(Instant.now());
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setBytes(1, content);
                ps.setLong(2, content.length);
                ps.setTimestamp(3, now);
                ps.setString(4, key);
                if (ps.executeUpdate() > 0) {
                    return null;
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, key);
                ps.setBytes(2, content);
                ps.setLong(3, content.length);
                ps.setTimestamp(4, now);
                ps.executeUpdate();
            }
            return null;
        });
        log.debug("Put object {} ({} bytes)", key, content.length);
    }

    @Override
    public boolean putIfAbsent(String key, byte[] content) {
        String sql = "INSERT INTO objects (object_key, content, size_bytes, updated_at) VALUES (?, ?, ?, ?)";

        return db.inTransaction("create object " + key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                ps.setBytes(2, content);
                ps.setLong(3, content.length);
                ps.setTimestamp(4, Timestamp.from(Instant.now()));
                ps.executeUpdate();
                return true;
            } catch (SQLException e) {
                if (isDuplicateKey(e)) {
                    log.debug("Object {} already exists", key);
                    return false;
                }
                throw e;
            }
        });
    }

    @Override
    public Optional<byte[]> get(String key) {
        String sql = "SELECT content FROM objects WHERE object_key = ?";

        return db.inTransaction("get object " + key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(rs.getBytes("content"));
                    }
                }
                return Optional.empty();
            }
        });
    }

    @Override
    public boolean exists(String key) {
        String sql = "SELECT 1 FROM objects WHERE object_key = ?";

        return db.inTransaction("check object " + key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public void delete(String key) {
        String sql = "DELETE FROM objects WHERE object_key = ?";

        db.inTransaction("delete object " + key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                return ps.executeUpdate();
            }
        });
        log.debug("Deleted object {}", key);
    }

    @Override
    public int deletePrefix(String prefix) {
        String sql = "DELETE FROM objects WHERE object_key LIKE ? ESCAPE '\\'";

        int deleted = db.inTransaction("delete prefix " + prefix, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, likePrefix(prefix));
                return ps.executeUpdate();
            }
        });
        log.debug("Deleted {} objects under {}", deleted, prefix);
        return deleted;
    }

    @Override
    public List<String> list(String prefix) {
        return listFiles(prefix).stream().map(StorageFile::key).toList();
    }

    @Override
    public List<StorageFile> listFiles(String prefix) {
        String sql = "SELECT object_key, size_bytes FROM objects WHERE object_key LIKE ? ESCAPE '\\' ORDER BY object_key";

        return db.inTransaction("list " + prefix, conn -> {
            List<StorageFile> files = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, likePrefix(prefix));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        files.add(new StorageFile(rs.getString("object_key"), rs.getLong("size_bytes")));
                    }
                }
            }
            return files;
        });
    }

    @Override
    public URL signedUrl(String key, SignedUrlMode mode) {
        return urlSigner.sign(key, mode);
    }

    // --- Helpers ---

    static String likePrefix(String prefix) {
        StringBuilder sb = new StringBuilder();
        for (char c : prefix.toCharArray()) {
            if (c == '%' || c == '_' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    private static boolean isDuplicateKey(SQLException e) {
        // 23505 is unique_violation in both PostgreSQL and H2
        return e instanceof SQLIntegrityConstraintViolationException || "23505".equals(e.getSQLState());
    }
}
