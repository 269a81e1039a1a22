package com.example.magiogateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatchupAvailability {

    private boolean hasArchive;
    private double daysAvailable;
    private int programsCount;
}
