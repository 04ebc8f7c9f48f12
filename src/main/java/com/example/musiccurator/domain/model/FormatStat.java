package com.example.musiccurator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormatStat {

    private String format;

    private long count;

    private double percentage;
}
