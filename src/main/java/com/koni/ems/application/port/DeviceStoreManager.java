package com.koni.ems.application.port;

import com.koni.ems.domain.model.DeviceStoreState;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.StoreProvisioning;

import java.util.List;

/**
 * Port interface for the per-device time-series relations.
 * Every operation is idempotent: running it twice has the same effect as running it once.
 */
public interface DeviceStoreManager {

    /**
     * Brings the relation of the device to {@link DeviceStoreState#COMPRESSED},
     * running only the steps that are still missing.
     *
     * @param deviceId the registry identifier of the device
     * @return the state found before provisioning and the state reached
     * @throws com.koni.ems.domain.exception.StorageException if a required step fails
     */
    StoreProvisioning createDeviceStore(String deviceId);

    /**
     * Drops the relation of the device. An absent relation is not an error.
     */
    void deleteDeviceStore(String deviceId);

    /**
     * Reads the current provisioning state from the database catalog.
     */
    DeviceStoreState inspect(String deviceId);

    /**
     * Lists every relation in the current schema carrying the device relation prefix.
     */
    List<RelationName> listDeviceRelations();

    /**
     * Drops one relation and everything depending on it.
     */
    void dropRelation(RelationName relation);
}
