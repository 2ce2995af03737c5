package com.koni.ems.infrastructure.persistence.timescale;

import com.koni.ems.application.port.RetentionPolicyManager;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.exception.ValidationException;
import com.koni.ems.domain.model.RelationName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Attaches and detaches TimescaleDB retention jobs of device relations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimescaleRetentionPolicyManager implements RetentionPolicyManager {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void setRetention(String deviceId, Duration period) {
        RelationName relation = RelationName.forDevice(deviceId);
        String interval;
        try {
            interval = PostgresIntervals.toInterval(period);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Retention period must be positive", e);
        }

        try {
            jdbcTemplate.queryForList(
                    "SELECT add_retention_policy(?::regclass, ?::interval, if_not_exists => TRUE)",
                    relation.getValue(), interval);
            log.info("Retention policy set: relation={}, period={}", relation, period);
        } catch (DataAccessException e) {
            if (DataAccessErrors.isAlreadyExists(e)) {
                log.debug("Retention policy already attached: relation={}", relation);
                return;
            }
            if (DataAccessErrors.UNDEFINED_TABLE.equals(DataAccessErrors.sqlState(e))) {
                throw new NotFoundException("Device storage not found: " + relation, e);
            }
            throw DataAccessErrors.translateDdl(e, "Failed to set retention policy on " + relation);
        }
    }

    @Override
    public int removeRetention(String deviceId) {
        RelationName relation = RelationName.forDevice(deviceId);
        try {
            List<Integer> jobs = jdbcTemplate.queryForList(
                    "SELECT job_id FROM timescaledb_information.jobs "
                            + "WHERE proc_name = 'policy_retention' "
                            + "AND hypertable_schema = current_schema() AND hypertable_name = ?",
                    Integer.class, relation.getValue());
            for (Integer jobId : jobs) {
                jdbcTemplate.queryForList("SELECT delete_job(?)", jobId);
            }
            log.info("Retention policy removed: relation={}, jobs={}", relation, jobs.size());
            return jobs.size();
        } catch (DataAccessException e) {
            throw DataAccessErrors.translateDdl(e, "Failed to remove retention policy from " + relation);
        }
    }
}
