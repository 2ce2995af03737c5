package com.koni.ems.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of provisioning a device relation: the state found before the missing
 * steps ran and the state reached afterwards.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class StoreProvisioning {

    private final DeviceStoreState initialState;
    private final DeviceStoreState state;

    /**
     * Whether this provisioning created the relation. Only then may a failed
     * registration drop it again.
     */
    public boolean createdRelation() {
        return initialState == DeviceStoreState.ABSENT;
    }
}
