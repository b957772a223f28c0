package com.maxsort.organizer.engine;

import com.maxsort.organizer.model.RawSuggestion;

import java.util.Set;

/**
 * Interface for the per-dimension suggestion checks.
 * Each implementation produces one sub-score of the weighted confidence adjustment.
 */
public interface ScoreEvaluator {

    /**
     * The dimension this evaluator scores.
     */
    ScoreDimension getDimension();

    /**
     * Score a suggestion along this evaluator's dimension.
     *
     * @param suggestion the raw suggestion
     * @param context    the file the suggestion is for
     * @param flags      validation flags; evaluators add what they find
     * @return sub-score in [0, 100]
     */
    double evaluate(RawSuggestion suggestion, ScoringContext context, Set<String> flags);
}
