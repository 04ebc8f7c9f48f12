package com.example.musiccurator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual review outcome for one group: either pick another keeper or keep every file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDecision {

    private int groupId;

    private Long keeperId;

    private boolean keepAll;
}
