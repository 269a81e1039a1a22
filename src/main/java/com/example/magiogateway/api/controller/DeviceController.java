package com.example.magiogateway.api.controller;

import com.example.magiogateway.api.response.ApiResponse;
import com.example.magiogateway.application.service.DeviceService;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.Device;
import com.example.magiogateway.domain.model.DeviceCount;
import java.util.List;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/devices")
public class DeviceController {

    private final DeviceService deviceService;

    public DeviceController(DeviceService deviceService) {
        this.deviceService = deviceService;
    }

    @GetMapping
    public ApiResponse<List<Device>> listDevices() {
        return ApiResponse.success(deviceService.getDevices());
    }

    @GetMapping("/count")
    public ApiResponse<DeviceCount> countDevices() {
        return ApiResponse.success(deviceService.getDeviceCount());
    }

    @GetMapping("/{id}")
    public ApiResponse<Device> getDevice(@PathVariable("id") String id) {
        Device device = deviceService.getDevice(id);
        if (device == null) {
            throw BusinessException.notFound("Device not found: " + id);
        }
        return ApiResponse.success(device);
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> deleteDevice(@PathVariable("id") String id) {
        deviceService.deleteDevice(id);
        return ApiResponse.success(null);
    }
}
