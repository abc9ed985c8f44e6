package com.tradecodes.classifier.model;

/**
 * Shape of a ranked shortlist as seen by the decision engine.
 *
 * @param topSimilarity   similarity of the best candidate
 * @param gap             similarity gap to the runner-up
 * @param level           confidence band derived from the thresholds
 * @param chapterCount    distinct chapters in the top results
 * @param dominantChapter most frequent chapter in the top results
 * @param dominantShare   share of the top results in the dominant chapter
 */
public record CandidateAnalysis(double topSimilarity,
                                double gap,
                                ConfidenceLevel level,
                                int chapterCount,
                                String dominantChapter,
                                double dominantShare) {
}
