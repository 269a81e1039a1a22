package com.example.magiogateway.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Program {

    private long scheduleId;
    private String title;
    private long startTimeUtc;
    private long endTimeUtc;
    private String description;
    private long durationSeconds;
    private String category;
    private Integer year;
    private String episode;
    private List<String> images;

    public boolean overlaps(long fromMillis, long toMillis) {
        return startTimeUtc <= toMillis && endTimeUtc >= fromMillis;
    }
}
