package com.koni.ems.application.port;

import java.util.Set;

/**
 * Port interface to the user-device permission records owned by the account service.
 */
public interface DeviceAccessPolicy {

    boolean hasAccess(String userId, String deviceId);

    Set<String> accessibleDeviceIds(String userId);
}
