package com.koni.ems.infrastructure.persistence.timescale;

import com.koni.ems.application.port.DeviceStoreManager;
import com.koni.ems.domain.model.DeviceStoreState;
import com.koni.ems.domain.model.MeasurementField;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.StoreProvisioning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Provisions one TimescaleDB hypertable per device.
 *
 * <p>Creation walks the states ABSENT, CREATED, PARTITIONED and COMPRESSED. The current
 * state is read from the catalog and only the missing steps run, each of them idempotent,
 * so an interrupted creation is recovered by running it again. Within this process
 * creations of the same relation are serialized; across processes the {@code IF NOT EXISTS}
 * forms and the tolerated "already exists" states absorb the race.
 *
 * <p>Relation names are validated identifiers and are written into the DDL as is.
 */
@Slf4j
@Component
public class TimescaleDeviceStoreManager implements DeviceStoreManager {

    static final String CHUNK_INTERVAL = "1 day";

    private final JdbcTemplate jdbcTemplate;
    private final Duration compressAfter;
    private final ConcurrentMap<RelationName, ReentrantLock> locks = new ConcurrentHashMap<>();

    public TimescaleDeviceStoreManager(
            JdbcTemplate jdbcTemplate,
            @Value("${ems.storage.compression-after:7d}") Duration compressAfter) {
        this.jdbcTemplate = jdbcTemplate;
        this.compressAfter = compressAfter;
    }

    @Override
    public StoreProvisioning createDeviceStore(String deviceId) {
        RelationName relation = RelationName.forDevice(deviceId);
        ReentrantLock lock = locks.computeIfAbsent(relation, key -> new ReentrantLock());
        lock.lock();
        try {
            DeviceStoreState initial = inspect(relation);
            DeviceStoreState state = initial;
            log.debug("Provisioning device relation: deviceId={}, relation={}, state={}", deviceId, relation, state);

            if (!state.isAtLeast(DeviceStoreState.CREATED)) {
                createTable(relation);
                state = DeviceStoreState.CREATED;
            }
            if (!state.isAtLeast(DeviceStoreState.PARTITIONED)) {
                createHypertable(relation);
                state = DeviceStoreState.PARTITIONED;
            }
            createIndexes(relation);
            if (!state.isAtLeast(DeviceStoreState.COMPRESSED)) {
                state = enableCompression(relation) ? DeviceStoreState.COMPRESSED : state;
            }

            log.info("Device relation ready: deviceId={}, relation={}, from={}, state={}",
                    deviceId, relation, initial, state);
            return new StoreProvisioning(initial, state);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteDeviceStore(String deviceId) {
        RelationName relation = RelationName.forDevice(deviceId);
        execute("DROP TABLE IF EXISTS " + relation, "Failed to drop relation " + relation);
        locks.remove(relation);
        log.info("Device relation dropped: deviceId={}, relation={}", deviceId, relation);
    }

    @Override
    public DeviceStoreState inspect(String deviceId) {
        return inspect(RelationName.forDevice(deviceId));
    }

    @Override
    public List<RelationName> listDeviceRelations() {
        List<String> tables = query(() -> jdbcTemplate.queryForList(
                "SELECT tablename FROM pg_tables "
                        + "WHERE schemaname = current_schema() AND tablename LIKE 'device\\_%' "
                        + "ORDER BY tablename",
                String.class), "Failed to list device relations");

        List<RelationName> relations = new ArrayList<>();
        for (String table : tables) {
            try {
                relations.add(RelationName.of(table));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring relation with a name this service never generates: {}", table);
            }
        }
        return relations;
    }

    @Override
    public void dropRelation(RelationName relation) {
        execute("DROP TABLE IF EXISTS " + relation + " CASCADE", "Failed to drop relation " + relation);
        locks.remove(relation);
    }

    DeviceStoreState inspect(RelationName relation) {
        return query(() -> {
            Boolean exists = jdbcTemplate.queryForObject(
                    "SELECT EXISTS (SELECT 1 FROM pg_tables WHERE schemaname = current_schema() AND tablename = ?)",
                    Boolean.class, relation.getValue());
            if (!Boolean.TRUE.equals(exists)) {
                return DeviceStoreState.ABSENT;
            }

            List<Boolean> compression = jdbcTemplate.queryForList(
                    "SELECT compression_enabled FROM timescaledb_information.hypertables "
                            + "WHERE hypertable_schema = current_schema() AND hypertable_name = ?",
                    Boolean.class, relation.getValue());
            if (compression.isEmpty()) {
                return DeviceStoreState.CREATED;
            }
            if (!Boolean.TRUE.equals(compression.get(0)) || !hasCompressionPolicy(relation)) {
                return DeviceStoreState.PARTITIONED;
            }
            return DeviceStoreState.COMPRESSED;
        }, "Failed to inspect relation " + relation);
    }

    private boolean hasCompressionPolicy(RelationName relation) {
        Integer jobs = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM timescaledb_information.jobs "
                        + "WHERE proc_name = 'policy_compression' "
                        + "AND hypertable_schema = current_schema() AND hypertable_name = ?",
                Integer.class, relation.getValue());
        return jobs != null && jobs > 0;
    }

    private void createTable(RelationName relation) {
        StringBuilder ddl = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(relation).append(" (\n")
                .append("  id BIGSERIAL,\n")
                .append("  timestamp TIMESTAMPTZ NOT NULL DEFAULT NOW(),\n");
        for (MeasurementField field : MeasurementField.values()) {
            ddl.append("  ").append(field.columnName()).append(' ').append(field.sqlType()).append(",\n");
        }
        ddl.append("  PRIMARY KEY (id, timestamp)\n)");

        tolerateExisting(ddl.toString(), "Failed to create relation " + relation);
        log.debug("Relation created: relation={}", relation);
    }

    private void createHypertable(RelationName relation) {
        query(() -> jdbcTemplate.queryForList(
                "SELECT create_hypertable(?::regclass, 'timestamp', "
                        + "chunk_time_interval => INTERVAL '" + CHUNK_INTERVAL + "', "
                        + "if_not_exists => TRUE, migrate_data => TRUE)",
                relation.getValue()), "Failed to convert " + relation + " to a hypertable");
        log.debug("Hypertable created: relation={}", relation);
    }

    private void createIndexes(RelationName relation) {
        tolerateExisting("CREATE INDEX IF NOT EXISTS " + relation.index("timestamp")
                + " ON " + relation + " (timestamp DESC)", "Failed to index " + relation);
        for (MeasurementField field : List.of(MeasurementField.PTOTAL, MeasurementField.PFAVG)) {
            String column = field.columnName();
            tolerateExisting("CREATE INDEX IF NOT EXISTS " + relation.index(column)
                    + " ON " + relation + " (timestamp DESC, " + column + ") WHERE " + column + " IS NOT NULL",
                    "Failed to index " + relation);
        }
    }

    /**
     * Enables native compression and attaches the compression job.
     *
     * @return false if compression could not be enabled; the relation stays usable
     */
    private boolean enableCompression(RelationName relation) {
        try {
            List<Boolean> enabled = jdbcTemplate.queryForList(
                    "SELECT compression_enabled FROM timescaledb_information.hypertables "
                            + "WHERE hypertable_schema = current_schema() AND hypertable_name = ?",
                    Boolean.class, relation.getValue());
            if (enabled.isEmpty() || !Boolean.TRUE.equals(enabled.get(0))) {
                jdbcTemplate.execute("ALTER TABLE " + relation
                        + " SET (timescaledb.compress, timescaledb.compress_orderby = 'timestamp DESC')");
            }
            jdbcTemplate.queryForList(
                    "SELECT add_compression_policy(?::regclass, ?::interval, if_not_exists => TRUE)",
                    relation.getValue(), PostgresIntervals.toInterval(compressAfter));
            log.debug("Compression enabled: relation={}, after={}", relation, compressAfter);
            return true;
        } catch (DataAccessException e) {
            log.warn("Could not enable compression: relation={}, error={}", relation, e.getMessage());
            return false;
        }
    }

    private void tolerateExisting(String sql, String message) {
        try {
            jdbcTemplate.execute(sql);
        } catch (DataAccessException e) {
            if (!DataAccessErrors.isAlreadyExists(e)) {
                log.error("{}: {}", message, e.getMessage(), e);
                throw DataAccessErrors.translateDdl(e, message);
            }
            log.debug("Created concurrently, continuing: {}", message);
        }
    }

    private void execute(String sql, String message) {
        try {
            jdbcTemplate.execute(sql);
        } catch (DataAccessException e) {
            log.error("{}: {}", message, e.getMessage(), e);
            throw DataAccessErrors.translateDdl(e, message);
        }
    }

    private <T> T query(Supplier<T> statement, String message) {
        try {
            return statement.get();
        } catch (DataAccessException e) {
            log.error("{}: {}", message, e.getMessage(), e);
            throw DataAccessErrors.translateDdl(e, message);
        }
    }
}
