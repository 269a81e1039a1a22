package com.example.magiogateway.domain.model;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamInfo {

    public static final String DEFAULT_CONTENT_TYPE = "application/vnd.apple.mpegurl";

    private String url;

    private Map<String, String> headers;

    private String contentType;

    private boolean live;
}
