package com.example.magiogateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Channel {

    public static final String DEFAULT_GROUP = "Other";

    private String id;
    private String name;
    private String originalName;
    private String logo;
    private String group;
    private boolean hasArchive;
}
