package com.example.magiogateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EpgGuide {

    private Map<String, List<Program>> channels = new LinkedHashMap<>();

    public List<Program> programsOf(String channelId) {
        List<Program> programs = channels.get(channelId);
        return programs == null ? Collections.<Program>emptyList() : programs;
    }

    public int programCount() {
        int count = 0;
        for (List<Program> programs : channels.values()) {
            count += programs.size();
        }
        return count;
    }
}
