package com.maxsort.organizer.engine.evaluators;

import com.maxsort.organizer.engine.ScoreDimension;
import com.maxsort.organizer.engine.ScoreEvaluator;
import com.maxsort.organizer.engine.ScoringContext;
import com.maxsort.organizer.model.RawSuggestion;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Measures how much of the suggested name is backed by the AI's own reasoning.
 * Below 30% word alignment costs 20 points, above 70% earns 10.
 */
@Component
public class ReasoningConsistencyEvaluator implements ScoreEvaluator {

    @Override
    public ScoreDimension getDimension() {
        return ScoreDimension.AI_CONSISTENCY;
    }

    @Override
    public double evaluate(RawSuggestion suggestion, ScoringContext context, Set<String> flags) {
        double score = 100;
        String reasoning = suggestion.getReasoning();
        if (reasoning == null || reasoning.isBlank()) {
            return score;
        }

        List<String> suggestionWords = Arrays.stream(
                        suggestion.getValue().toLowerCase(Locale.ROOT).split("[-_\\s]+"))
                .filter(w -> w.length() > 2)
                .toList();
        if (suggestionWords.isEmpty()) {
            return score;
        }
        List<String> reasoningWords = Arrays.asList(reasoning.toLowerCase(Locale.ROOT).split("\\s+"));

        long aligned = suggestionWords.stream()
                .filter(word -> reasoningWords.stream().anyMatch(r -> r.contains(word)))
                .count();
        double ratio = (double) aligned / suggestionWords.size();

        if (ratio < 0.3) {
            score -= 20;
            flags.add("reasoning-mismatch");
        } else if (ratio > 0.7) {
            score += 10;
            flags.add("strong-reasoning-alignment");
        }
        return Math.max(0, score);
    }
}
