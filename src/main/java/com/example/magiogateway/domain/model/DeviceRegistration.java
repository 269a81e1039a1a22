package com.example.magiogateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceRegistration {

    private String deviceId;
    private String deviceName;
    private String deviceType;
    private String osVersion;
    private String appVersion;
    private String language;
    private String devicePlatform;
}
