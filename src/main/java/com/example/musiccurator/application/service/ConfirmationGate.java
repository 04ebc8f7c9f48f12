package com.example.musiccurator.application.service;

import com.example.musiccurator.domain.model.CleanupPlan;
import com.example.musiccurator.domain.model.ReviewDecision;
import java.util.Collections;
import java.util.List;

/**
 * Presents a reviewed plan to a person and returns what they typed. Anything other than the
 * configured confirmation phrase cancels the run.
 */
@FunctionalInterface
public interface ConfirmationGate {

    String confirm(CleanupPlan plan);

    /**
     * Per-group overrides collected during review. None by default.
     */
    default List<ReviewDecision> decisions(CleanupPlan plan) {
        return Collections.emptyList();
    }
}
