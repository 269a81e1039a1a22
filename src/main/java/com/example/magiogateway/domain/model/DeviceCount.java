package com.example.magiogateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCount {

    private int total;
    private int current;
    private int mobile;
    private int stb;
}
