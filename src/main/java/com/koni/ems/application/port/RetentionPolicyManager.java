package com.koni.ems.application.port;

import java.time.Duration;

/**
 * Port interface for the retention jobs of device relations.
 */
public interface RetentionPolicyManager {

    /**
     * Attaches a retention policy dropping chunks older than the period.
     * A policy that is already attached is left as is.
     *
     * @throws com.koni.ems.domain.exception.StorageException if the policy cannot be attached
     */
    void setRetention(String deviceId, Duration period);

    /**
     * Removes every retention policy of the device relation.
     *
     * @return the number of policies removed
     */
    int removeRetention(String deviceId);
}
