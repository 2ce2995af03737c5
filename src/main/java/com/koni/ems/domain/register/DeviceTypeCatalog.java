package com.koni.ems.domain.register;

import com.koni.ems.domain.model.RegisterMapping;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.koni.ems.domain.register.RegisterDataType.FLOAT32;
import static com.koni.ems.domain.register.RegisterDataType.FOUR_QUADRANT_POWER_FACTOR;
import static com.koni.ems.domain.register.RegisterDataType.INT32U;

/**
 * Built-in register maps of the supported meter models.
 * Unknown types resolve to an empty profile so that custom meters can be registered
 * with their own register map.
 */
public final class DeviceTypeCatalog {

    public static final String DEFAULT_SUBNET_MASK = "255.255.255.0";
    public static final int DEFAULT_SLAVE_ADDRESS = 1;

    private static final Map<String, DeviceTypeProfile> PROFILES = new LinkedHashMap<>();

    static {
        register(new DeviceTypeProfile("PM5320", DEFAULT_SUBNET_MASK, DEFAULT_SLAVE_ADDRESS, List.of(
                new RegisterMapping("V1", 40001, FLOAT32, "Voltage L1-N (V)"),
                new RegisterMapping("V2", 40003, FLOAT32, "Voltage L2-N (V)"),
                new RegisterMapping("V3", 40005, FLOAT32, "Voltage L3-N (V)"),
                new RegisterMapping("VR", 40007, FLOAT32, "Voltage R-N (V)"),
                new RegisterMapping("VY", 40009, FLOAT32, "Voltage Y-N (V)"),
                new RegisterMapping("VB", 40011, FLOAT32, "Voltage B-N (V)"),
                new RegisterMapping("Vavg", 40013, FLOAT32, "Average Voltage (V)"),
                new RegisterMapping("I1", 40015, FLOAT32, "Current L1 (A)"),
                new RegisterMapping("I2", 40017, FLOAT32, "Current L2 (A)"),
                new RegisterMapping("I3", 40019, FLOAT32, "Current L3 (A)"),
                new RegisterMapping("IR", 40021, FLOAT32, "Current R (A)"),
                new RegisterMapping("IY", 40023, FLOAT32, "Current Y (A)"),
                new RegisterMapping("IB", 40025, FLOAT32, "Current B (A)"),
                new RegisterMapping("Iavg", 40027, FLOAT32, "Average Current (A)"),
                new RegisterMapping("Ipeak", 40029, FLOAT32, "Peak Current (A)"),
                new RegisterMapping("P1", 40031, FLOAT32, "Active Power L1 (kW)"),
                new RegisterMapping("P2", 40033, FLOAT32, "Active Power L2 (kW)"),
                new RegisterMapping("P3", 40035, FLOAT32, "Active Power L3 (kW)"),
                new RegisterMapping("Ptotal", 40037, FLOAT32, "Total Active Power (kW)"),
                new RegisterMapping("PF1", 40039, FOUR_QUADRANT_POWER_FACTOR, "Power Factor L1"),
                new RegisterMapping("PF2", 40040, FOUR_QUADRANT_POWER_FACTOR, "Power Factor L2"),
                new RegisterMapping("PF3", 40041, FOUR_QUADRANT_POWER_FACTOR, "Power Factor L3"),
                new RegisterMapping("PFavg", 40042, FOUR_QUADRANT_POWER_FACTOR, "Average Power Factor"),
                new RegisterMapping("frequency", 40043, FLOAT32, "Frequency (Hz)"),
                new RegisterMapping("energy_active", 40045, INT32U, "Active Energy (Wh)"),
                new RegisterMapping("energy_reactive", 40047, INT32U, "Reactive Energy (VARh)"),
                new RegisterMapping("V", 40049, FLOAT32, "Voltage (V)"),
                new RegisterMapping("I", 40051, FLOAT32, "Current (A)")
        )));
        register(new DeviceTypeProfile("PM5330", DEFAULT_SUBNET_MASK, DEFAULT_SLAVE_ADDRESS, List.of(
                new RegisterMapping("V1", 40001, FLOAT32, "Voltage L1-N (V)"),
                new RegisterMapping("V2", 40003, FLOAT32, "Voltage L2-N (V)"),
                new RegisterMapping("V3", 40005, FLOAT32, "Voltage L3-N (V)"),
                new RegisterMapping("I1", 40015, FLOAT32, "Current L1 (A)"),
                new RegisterMapping("I2", 40017, FLOAT32, "Current L2 (A)"),
                new RegisterMapping("I3", 40019, FLOAT32, "Current L3 (A)"),
                new RegisterMapping("Ptotal", 40037, FLOAT32, "Total Active Power (kW)"),
                new RegisterMapping("PFavg", 40042, FOUR_QUADRANT_POWER_FACTOR, "Average Power Factor")
        )));
        register(emptyProfile("PM5350"));
        register(emptyProfile("Custom"));
    }

    private DeviceTypeCatalog() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static List<String> deviceTypes() {
        return List.copyOf(PROFILES.keySet());
    }

    public static boolean isKnown(String deviceType) {
        return PROFILES.containsKey(deviceType);
    }

    /**
     * Returns the profile of a device type, or an empty profile for unknown types.
     */
    public static DeviceTypeProfile profile(String deviceType) {
        DeviceTypeProfile profile = PROFILES.get(deviceType);
        return profile != null ? profile : emptyProfile(deviceType);
    }

    private static DeviceTypeProfile emptyProfile(String deviceType) {
        return new DeviceTypeProfile(deviceType, DEFAULT_SUBNET_MASK, DEFAULT_SLAVE_ADDRESS, List.of());
    }

    private static void register(DeviceTypeProfile profile) {
        PROFILES.put(profile.getDeviceType(), profile);
    }
}
