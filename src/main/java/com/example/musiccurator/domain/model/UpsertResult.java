package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.UpsertOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpsertResult {

    private Long id;

    private UpsertOutcome outcome;
}
