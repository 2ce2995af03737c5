package com.koni.ems.domain.model;

/**
 * Provisioning state of a device relation.
 * Creation is a sequence of DDL steps that cannot be rolled back as a unit, so each
 * state is reached by an idempotent transition and recovery means re-running creation.
 */
public enum DeviceStoreState {

    /** No relation exists. */
    ABSENT,

    /** The relation exists as a plain table. */
    CREATED,

    /** The relation is a hypertable chunked by timestamp. */
    PARTITIONED,

    /** Compression is enabled and the compression policy is attached. */
    COMPRESSED;

    public boolean isAtLeast(DeviceStoreState other) {
        return compareTo(other) >= 0;
    }
}
