package com.koni.ems.infrastructure.web.controller;

import com.koni.ems.application.command.DeleteDeviceCommand;
import com.koni.ems.application.command.DeleteDeviceCommandHandler;
import com.koni.ems.application.command.RegisterDeviceCommand;
import com.koni.ems.application.command.RegisterDeviceCommandHandler;
import com.koni.ems.application.command.UpdateDeviceStatusCommand;
import com.koni.ems.application.command.UpdateDeviceStatusCommandHandler;
import com.koni.ems.application.query.GetDeviceQuery;
import com.koni.ems.application.query.GetDevicesQuery;
import com.koni.ems.application.query.GetDevicesQueryHandler;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.Device;
import com.koni.ems.infrastructure.web.dto.DeviceRequest;
import com.koni.ems.infrastructure.web.dto.DeviceResponse;
import com.koni.ems.infrastructure.web.dto.DeviceStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the device registry.
 *
 * Endpoints:
 * - POST /api/v1/devices: Register or update a device (admin)
 * - GET /api/v1/devices: Devices visible to the caller
 * - GET /api/v1/devices/{id}: One device
 * - PATCH /api/v1/devices/{id}/status: Status report of the poller, also marks the device as seen
 * - DELETE /api/v1/devices/{id}: Remove a device and its stored data (admin)
 */
@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {

    private final RegisterDeviceCommandHandler registerHandler;
    private final DeleteDeviceCommandHandler deleteHandler;
    private final UpdateDeviceStatusCommandHandler statusHandler;
    private final GetDevicesQueryHandler queryHandler;

    @PostMapping
    public ResponseEntity<DeviceResponse> registerDevice(Caller caller, @RequestBody @Valid DeviceRequest request) {
        log.info("Received device registration: deviceId={}, type={}", request.getId(), request.getType());

        Device device = registerHandler.handle(new RegisterDeviceCommand(
                caller,
                request.getId(),
                request.getName(),
                request.getType(),
                request.getIpAddress(),
                request.getSubnetMask(),
                request.getSlaveAddress(),
                request.getStatus(),
                request.getIncludeInTotalSummary(),
                request.getRegisterMap()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(DeviceResponse.from(device));
    }

    /**
     * @return 200 OK with the visible devices (empty list if there are none)
     */
    @GetMapping
    public ResponseEntity<List<DeviceResponse>> getDevices(Caller caller) {
        List<DeviceResponse> devices = queryHandler.handle(new GetDevicesQuery(caller)).stream()
                .map(DeviceResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(devices);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DeviceResponse> getDevice(Caller caller, @PathVariable String id) {
        return ResponseEntity.ok(DeviceResponse.from(queryHandler.handle(new GetDeviceQuery(caller, id))));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<DeviceResponse> updateStatus(Caller caller, @PathVariable String id,
                                                       @RequestBody @Valid DeviceStatusRequest request) {
        log.debug("Received device status: deviceId={}, status={}", id, request.getStatus());
        Device device = statusHandler.handle(new UpdateDeviceStatusCommand(caller, id, request.getStatus()));
        return ResponseEntity.ok(DeviceResponse.from(device));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDevice(Caller caller, @PathVariable String id) {
        log.info("Received device deletion: deviceId={}", id);
        deleteHandler.handle(new DeleteDeviceCommand(caller, id));
        return ResponseEntity.noContent().build();
    }
}
