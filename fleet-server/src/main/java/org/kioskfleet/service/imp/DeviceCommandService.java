package org.kioskfleet.service.imp;

import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.CommandDispatch;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.hub.BroadcastHub;
import org.kioskfleet.repository.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes commands, configuration and application deployments to devices.
 * Best effort: a device that is not connected simply does not receive it.
 */
@Service
public class DeviceCommandService {

    private static final Logger log = LoggerFactory.getLogger(DeviceCommandService.class);

    public static final String CONFIG_UPDATE_EVENT = "config:update";
    public static final String APP_DEPLOY_EVENT = "app:deploy";
    public static final String COMMAND_SENT_EVENT = "device:command:sent";

    private final DeviceRepository deviceRepository;
    private final BroadcastHub hub;

    public DeviceCommandService(DeviceRepository deviceRepository, BroadcastHub hub) {
        this.deviceRepository = deviceRepository;
        this.hub = hub;
    }

    /**
     * @return true if a live connection of the device received the command
     * @throws DeviceNotFoundException if the device is not registered
     */
    public boolean dispatchCommand(String deviceId, String command, Map<String, Object> parameters,
                                   AuthenticatedPrincipal issuedBy) {
        requireDevice(deviceId);
        CommandDispatch dispatch = CommandDispatch.builder()
                .deviceId(deviceId)
                .command(command)
                .parameters(parameters)
                .build();
        boolean delivered = hub.routeCommand(dispatch);
        log.info("Command dispatched: deviceId={}, command={}, delivered={}", deviceId, command, delivered);

        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("device_id", deviceId);
        echo.put("command", command);
        echo.put("delivered", delivered);
        echo.put("issued_by", issuedBy != null ? issuedBy.username() : null);
        hub.toAdmins(COMMAND_SENT_EVENT, echo);
        return delivered;
    }

    public boolean pushConfig(String deviceId, Map<String, Object> config) {
        requireDevice(deviceId);
        boolean delivered = hub.toDevice(deviceId, CONFIG_UPDATE_EVENT, config);
        log.info("Configuration pushed: deviceId={}, delivered={}", deviceId, delivered);
        return delivered;
    }

    public boolean deployApplication(String deviceId, Map<String, Object> application) {
        requireDevice(deviceId);
        boolean delivered = hub.toDevice(deviceId, APP_DEPLOY_EVENT, application);
        log.info("Application deployment pushed: deviceId={}, delivered={}", deviceId, delivered);
        return delivered;
    }

    private void requireDevice(String deviceId) {
        if (!deviceRepository.existsByDeviceId(deviceId)) {
            throw new DeviceNotFoundException(deviceId);
        }
    }
}
