package com.example.magiogateway.application.service;

import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.config.AppHttpProperties;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.AuthHeaders;
import com.example.magiogateway.domain.model.Device;
import com.example.magiogateway.domain.model.DeviceCount;
import com.example.magiogateway.domain.model.DeviceType;
import com.example.magiogateway.infrastructure.magio.MagioApiClient;
import com.example.magiogateway.infrastructure.magio.MagioApiException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DeviceService {

    private static final Logger log = LoggerFactory.getLogger(DeviceService.class);

    private final MagioAuthService authService;
    private final MagioApiClient apiClient;
    private final TtlCache cache;
    private final AppCacheProperties cacheProperties;
    private final AppHttpProperties httpProperties;

    public DeviceService(MagioAuthService authService,
                         MagioApiClient apiClient,
                         TtlCache cache,
                         AppCacheProperties cacheProperties,
                         AppHttpProperties httpProperties) {
        this.authService = authService;
        this.apiClient = apiClient;
        this.cache = cache;
        this.cacheProperties = cacheProperties;
        this.httpProperties = httpProperties;
    }

    public List<Device> getDevices() {
        return cache.getOrFetch(devicesKey(), List.class, this::fetchDevices, cacheProperties.getDeviceTtlSeconds());
    }

    public Device getDevice(String deviceId) {
        for (Device device : getDevices()) {
            if (device.getId().equals(deviceId)) {
                return device;
            }
        }
        return null;
    }

    public DeviceCount getDeviceCount() {
        List<Device> devices = getDevices();
        int current = 0;
        int mobile = 0;
        int stb = 0;
        for (Device device : devices) {
            switch (device.getType()) {
                case CURRENT:
                    current++;
                    break;
                case MOBILE:
                    mobile++;
                    break;
                case STB:
                    stb++;
                    break;
                default:
                    break;
            }
        }
        return new DeviceCount(devices.size(), current, mobile, stb);
    }

    public void deleteDevice(String deviceId) {
        AuthHeaders headers = requireHeaders("Cannot delete device");
        Map<String, String> params = new HashMap<>();
        params.put("id", deviceId);
        try {
            JsonNode body = apiClient.getJson(MagioApiClient.PATH_DEVICE_DELETE, params, headers.toMap(),
                    httpProperties.getApiTimeoutMs());
            if (!body.path("success").asBoolean(false)) {
                throw new MagioApiException(MagioApiException.Kind.PROTOCOL,
                        "deleteDevice rejected: " + body.path("errorMessage").asText("Unknown error"));
            }
        } catch (MagioApiException e) {
            log.error("Failed to delete device {}: {}", deviceId, e.getMessage());
            throw BusinessException.upstream("Failed to delete device: " + e.getMessage());
        }
        cache.clear(devicesKey());
        log.info("Device {} deleted", deviceId);
    }

    // --- Private methods ---

    private String devicesKey() {
        return "devices_" + authService.getLanguage();
    }

    private AuthHeaders requireHeaders(String action) {
        AuthHeaders headers = authService.getAuthHeaders();
        if (headers == null) {
            throw BusinessException.unauthorized(action + ": not authenticated with Magio");
        }
        return headers;
    }

    private List<Device> fetchDevices() {
        AuthHeaders headers = requireHeaders("Cannot load devices");
        try {
            JsonNode body = apiClient.getJson(MagioApiClient.PATH_DEVICES, Collections.<String, String>emptyMap(),
                    headers.toMap(), httpProperties.getApiTimeoutMs());
            List<Device> devices = new ArrayList<>();
            JsonNode current = body.path("thisDevice");
            if (current.hasNonNull("id")) {
                devices.add(toDevice(current, DeviceType.CURRENT));
            }
            for (JsonNode node : body.path("smallScreenDevices")) {
                devices.add(toDevice(node, DeviceType.MOBILE));
            }
            for (JsonNode node : body.path("stbAndBigScreenDevices")) {
                devices.add(toDevice(node, DeviceType.STB));
            }
            log.info("Loaded {} devices", devices.size());
            return Collections.unmodifiableList(devices);
        } catch (MagioApiException e) {
            log.error("Failed to load devices: {}", e.getMessage());
            throw BusinessException.upstream("Failed to load devices: " + e.getMessage());
        }
    }

    private Device toDevice(JsonNode node, DeviceType type) {
        return new Device(node.path("id").asText(""), node.path("name").asText(""), type,
                type == DeviceType.CURRENT);
    }
}
