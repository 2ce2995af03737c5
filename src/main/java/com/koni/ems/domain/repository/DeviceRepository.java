package com.koni.ems.domain.repository;

import com.koni.ems.domain.model.Device;
import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RelationName;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the device registry.
 * The registry is the source of truth for which device relations must exist.
 */
public interface DeviceRepository {

    Optional<Device> findById(String deviceId);

    boolean existsById(String deviceId);

    List<Device> findAll();

    /**
     * Returns the devices with the given identifiers, in identifier order.
     */
    List<Device> findAllById(Collection<String> deviceIds);

    /**
     * Returns the identifiers of all registered devices.
     * Used as the snapshot of the orphan sweep, so it must not be filtered.
     */
    List<String> findAllIds();

    /**
     * Finds the device whose relation name is the given one, if any.
     */
    Optional<String> findIdByRelationName(RelationName relationName);

    /**
     * Records the relation name of devices stored without one. A device whose relation
     * name is already recorded for another device keeps none and is reported in the log.
     *
     * @return the number of devices that received a relation name
     */
    int assignMissingRelationNames();

    /**
     * Inserts the device or replaces every attribute of an existing one.
     *
     * @param device the device to store
     * @return the stored device
     */
    Device save(Device device);

    /**
     * Sets the status and the last-seen time of a registered device.
     *
     * @return the updated device, or empty if no device has the identifier
     */
    Optional<Device> updateStatus(String deviceId, DeviceStatus status, Instant lastSeen);

    /**
     * Deletes the device record.
     *
     * @return true if a record was deleted
     */
    boolean deleteById(String deviceId);
}
