package com.example.magiogateway.domain.model;

public enum DeviceType {
    CURRENT,
    MOBILE,
    STB
}
