package com.example.magiogateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    private String id;
    private String name;
    private DeviceType type;
    private boolean thisDevice;
}
