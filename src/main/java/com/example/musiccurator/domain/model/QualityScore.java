package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.QualityTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QualityScore {

    private int total;

    private int formatPoints;

    private int bitratePoints;

    private int vbrBonus;

    private int sampleRatePoints;

    private int recencyPoints;

    private QualityTier tier;
}
