package ai.storefront.translator.store;

import ai.storefront.translator.content.Resource;
import ai.storefront.translator.content.ResourceRepository;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resources table. The engine only reads it; {@link #upsert(Resource, Instant)} is for importers and tests.
 */
public class JdbcResourceRepository implements ResourceRepository {

    private static final String COLUMNS = "id, locale, title, content, content_hash";

    private final SqliteDatabase database;

    public JdbcResourceRepository(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public Optional<Resource> findById(String id) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM resources WHERE id = ?")) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Resource>empty();
                }
            }
        });
    }

    @Override
    public List<Resource> findByLocale(String locale) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM resources WHERE locale = ? ORDER BY id")) {
                ps.setString(1, locale);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Resource> resources = new ArrayList<>();
                    while (rs.next()) {
                        resources.add(map(rs));
                    }
                    return resources;
                }
            }
        });
    }

    public void upsert(Resource resource, Instant now) {
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO resources (id, locale, title, content, content_hash, updated_at) VALUES (?,?,?,?,?,?) "
                            + "ON CONFLICT(id) DO UPDATE SET locale = excluded.locale, title = excluded.title, "
                            + "content = excluded.content, content_hash = excluded.content_hash, "
                            + "updated_at = excluded.updated_at")) {
                ps.setString(1, resource.id());
                ps.setString(2, resource.locale());
                ps.setString(3, resource.title().orElse(null));
                ps.setString(4, resource.content());
                ps.setString(5, resource.contentHash());
                ps.setLong(6, now.toEpochMilli());
                return ps.executeUpdate();
            }
        });
    }

    private static Resource map(ResultSet rs) throws SQLException {
        return new Resource(rs.getString("id"), rs.getString("locale"), Optional.ofNullable(rs.getString("title")),
                rs.getString("content"), rs.getString("content_hash"));
    }
}
