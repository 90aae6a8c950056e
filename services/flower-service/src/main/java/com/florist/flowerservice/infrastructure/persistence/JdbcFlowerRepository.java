package com.florist.flowerservice.infrastructure.persistence;

import com.florist.flowerservice.application.ports.FlowerRepository;
import com.florist.flowerservice.domain.flower.Flower;
import com.florist.flowerservice.domain.flower.FlowerErrors;
import com.florist.flowerservice.domain.shared.Pagination;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * PostgreSQL adapter for {@link FlowerRepository} on top of {@link NamedParameterJdbcTemplate}.
 *
 * <p>Listings order by {@code created_at DESC, id DESC}; the seed rows share one timestamp, so the
 * id breaks the tie.
 */
@Repository
public class JdbcFlowerRepository implements FlowerRepository {

    private static final String COLUMNS =
            "id, name, color, description, price, stock, created_at, updated_at";

    private static final String ORDER_NEWEST_FIRST = " ORDER BY created_at DESC, id DESC";

    private static final String PAGE = " LIMIT :limit OFFSET :offset";

    static final RowMapper<Flower> FLOWER_ROW_MAPPER = JdbcFlowerRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcFlowerRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Flower> findById(UUID id) {
        List<Flower> rows =
                jdbc.query(
                        "SELECT " + COLUMNS + " FROM flowers WHERE id = :id",
                        new MapSqlParameterSource("id", id),
                        FLOWER_ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public List<Flower> findAll(Pagination pagination) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        bindPage(params, pagination);
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM flowers" + ORDER_NEWEST_FIRST + PAGE,
                params,
                FLOWER_ROW_MAPPER);
    }

    @Override
    public long count() {
        Long total =
                jdbc.queryForObject(
                        "SELECT COUNT(*) FROM flowers", new MapSqlParameterSource(), Long.class);
        return total != null ? total : 0L;
    }

    @Override
    public List<Flower> search(String query, String color, Pagination pagination) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = searchCriteria(query, color, params);
        bindPage(params, pagination);
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM flowers" + where + ORDER_NEWEST_FIRST + PAGE,
                params,
                FLOWER_ROW_MAPPER);
    }

    @Override
    public long countSearch(String query, String color) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = searchCriteria(query, color, params);
        Long total = jdbc.queryForObject("SELECT COUNT(*) FROM flowers" + where, params, Long.class);
        return total != null ? total : 0L;
    }

    @Override
    public Flower create(Flower flower) {
        return jdbc.queryForObject(
                "INSERT INTO flowers (" + COLUMNS + ")"
                        + " VALUES (:id, :name, :color, :description, :price, :stock,"
                        + " :createdAt, :updatedAt)"
                        + " RETURNING " + COLUMNS,
                toParams(flower),
                FLOWER_ROW_MAPPER);
    }

    @Override
    public Flower update(Flower flower) {
        List<Flower> rows =
                jdbc.query(
                        "UPDATE flowers SET name = :name, color = :color,"
                                + " description = :description, price = :price, stock = :stock,"
                                + " updated_at = :updatedAt"
                                + " WHERE id = :id"
                                + " RETURNING " + COLUMNS,
                        toParams(flower),
                        FLOWER_ROW_MAPPER);
        // deleted between read and write
        return rows.stream().findFirst().orElseThrow(() -> FlowerErrors.notFound(flower.id()));
    }

    @Override
    public boolean delete(UUID id) {
        return jdbc.update("DELETE FROM flowers WHERE id = :id", new MapSqlParameterSource("id", id))
                > 0;
    }

    // ── Helpers ──

    /** Builds the WHERE clause for the given criteria and binds its parameters. */
    static String searchCriteria(String query, String color, MapSqlParameterSource params) {
        List<String> clauses = new ArrayList<>();
        if (query != null) {
            clauses.add("LOWER(name) LIKE :namePattern");
            params.addValue("namePattern", "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%");
        }
        if (color != null) {
            clauses.add("LOWER(color) = :color");
            params.addValue("color", color.toLowerCase(Locale.ROOT));
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    /** Escapes LIKE wildcards so they match literally (PostgreSQL's default escape is '\'). */
    static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void bindPage(MapSqlParameterSource params, Pagination pagination) {
        params.addValue("limit", pagination.limit());
        params.addValue("offset", pagination.offset());
    }

    private static MapSqlParameterSource toParams(Flower flower) {
        return new MapSqlParameterSource()
                .addValue("id", flower.id())
                .addValue("name", flower.name())
                .addValue("color", flower.color())
                .addValue("description", flower.description(), Types.VARCHAR)
                .addValue("price", flower.price())
                .addValue("stock", flower.stock())
                .addValue("createdAt", toOffset(flower.createdAt()))
                .addValue("updatedAt", toOffset(flower.updatedAt()));
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Flower mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Flower.restore(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getString("color"),
                rs.getString("description"),
                rs.getDouble("price"),
                rs.getInt("stock"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getObject("updated_at", OffsetDateTime.class).toInstant());
    }
}
