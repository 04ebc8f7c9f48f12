package com.example.musiccurator.application.service.similarity;

/**
 * Normalized string similarity in [0, 1]; 1 means identical. Inputs are already folded.
 */
public interface SimilarityStrategy {

    double similarity(String left, String right);
}
