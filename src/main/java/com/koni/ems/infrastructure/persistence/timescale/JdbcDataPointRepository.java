package com.koni.ems.infrastructure.persistence.timescale;

import com.koni.ems.domain.model.DataPoint;
import com.koni.ems.domain.model.DataPointStats;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.domain.model.MeasurementField;
import com.koni.ems.domain.model.Reading;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.TimeWindow;
import com.koni.ems.domain.repository.DataPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DataPointRepository on the device hypertables, using plain JDBC.
 * Column names come from {@link MeasurementField}, never from the request, and every
 * value is bound as a parameter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcDataPointRepository implements DataPointRepository {

    private static final RowMapper<DataPoint> DATA_POINT_MAPPER = JdbcDataPointRepository::mapDataPoint;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public IngestResult insert(RelationName relation, Reading reading) {
        List<String> columns = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (reading.getTimestamp() != null) {
            columns.add("timestamp");
            args.add(toOffsetDateTime(reading.getTimestamp()));
        }
        for (Map.Entry<MeasurementField, BigDecimal> entry : reading.getValues().entrySet()) {
            columns.add(entry.getKey().columnName());
            args.add(entry.getValue());
        }

        String sql = "INSERT INTO " + relation + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ") RETURNING id, timestamp";

        try {
            return jdbcTemplate.queryForObject(sql,
                    (rs, rowNum) -> new IngestResult(rs.getLong("id"), readInstant(rs, "timestamp")),
                    args.toArray());
        } catch (DataAccessException e) {
            log.error("Failed to insert data point: relation={}, error={}", relation, e.getMessage());
            throw DataAccessErrors.translate(e, "Failed to insert into " + relation);
        }
    }

    @Override
    public List<DataPoint> findRange(RelationName relation, TimeWindow window, int limit, int offset) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT * FROM " + relation + where(window, args)
                + " ORDER BY timestamp DESC LIMIT ? OFFSET ?";
        args.add(limit);
        args.add(offset);

        try {
            return jdbcTemplate.query(sql, DATA_POINT_MAPPER, args.toArray());
        } catch (DataAccessException e) {
            throw DataAccessErrors.translate(e, "Failed to query " + relation);
        }
    }

    @Override
    public Optional<DataPoint> findLatest(RelationName relation) {
        try {
            List<DataPoint> rows = jdbcTemplate.query(
                    "SELECT * FROM " + relation + " ORDER BY timestamp DESC LIMIT 1", DATA_POINT_MAPPER);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw DataAccessErrors.translate(e, "Failed to query " + relation);
        }
    }

    @Override
    public DataPointStats stats(RelationName relation, TimeWindow window) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) AS count, "
                + "MIN(timestamp) AS first_timestamp, "
                + "MAX(timestamp) AS last_timestamp, "
                + "AVG(ptotal) AS avg_power, "
                + "MAX(ptotal) AS max_power, "
                + "MIN(ptotal) AS min_power, "
                + "AVG(pfavg) AS avg_power_factor, "
                + "AVG(frequency) AS avg_frequency "
                + "FROM " + relation + where(window, args);

        try {
            return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> new DataPointStats(
                    rs.getLong("count"),
                    readInstant(rs, "first_timestamp"),
                    readInstant(rs, "last_timestamp"),
                    rs.getBigDecimal("avg_power"),
                    rs.getBigDecimal("max_power"),
                    rs.getBigDecimal("min_power"),
                    rs.getBigDecimal("avg_power_factor"),
                    rs.getBigDecimal("avg_frequency")
            ), args.toArray());
        } catch (DataAccessException e) {
            throw DataAccessErrors.translate(e, "Failed to aggregate " + relation);
        }
    }

    private static String where(TimeWindow window, List<Object> args) {
        List<String> conditions = new ArrayList<>();
        if (window.getStart() != null) {
            conditions.add("timestamp >= ?");
            args.add(toOffsetDateTime(window.getStart()));
        }
        if (window.getEnd() != null) {
            conditions.add("timestamp <= ?");
            args.add(toOffsetDateTime(window.getEnd()));
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static DataPoint mapDataPoint(ResultSet rs, int rowNum) throws SQLException {
        Map<MeasurementField, BigDecimal> values = new EnumMap<>(MeasurementField.class);
        for (MeasurementField field : MeasurementField.values()) {
            BigDecimal value = rs.getBigDecimal(field.columnName());
            if (value != null) {
                values.put(field, value);
            }
        }
        return new DataPoint(rs.getLong("id"), readInstant(rs, "timestamp"), values);
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
