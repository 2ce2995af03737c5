package com.koni.ems.domain.register;

import com.koni.ems.domain.model.RegisterMapping;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Default registration settings and register map of a meter model.
 */
@Getter
@AllArgsConstructor
public class DeviceTypeProfile {

    private final String deviceType;
    private final String defaultSubnetMask;
    private final int defaultSlaveAddress;
    private final List<RegisterMapping> registerMappings;
}
