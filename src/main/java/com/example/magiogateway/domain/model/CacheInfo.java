package com.example.magiogateway.domain.model;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheInfo {

    private int totalEntries;

    private int expiredEntries;

    private Map<String, Integer> categories;

    private List<String> keys;

    private Map<String, Long> expiresIn;
}
