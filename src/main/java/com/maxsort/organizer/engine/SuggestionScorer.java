package com.maxsort.organizer.engine;

import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.config.ScoringConfig;
import com.maxsort.organizer.model.RawSuggestion;
import com.maxsort.organizer.model.ScoredSuggestion;
import com.maxsort.organizer.model.SuggestionMetrics;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates raw AI suggestions and turns them into ranked, scored suggestions.
 * Uses the Strategy pattern: each {@link ScoreDimension} is scored by a registered {@link ScoreEvaluator}.
 */
@Component
public class SuggestionScorer {

    private static final Logger log = LoggerFactory.getLogger(SuggestionScorer.class);

    static final String PROCESSING_ERROR_FLAG = "processing-error";
    private static final double GENERIC_TERM_PENALTY = 0.8;
    private static final double SPECIFICITY_BONUS = 1.1;
    private static final int FLAG_PENALTY = 5;
    private static final int FALLBACK_RANK_OFFSET = 1000;

    private final Map<ScoreDimension, ScoreEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private volatile ScoringConfig config;

    public SuggestionScorer(List<ScoreEvaluator> evaluators, ScoringConfig config,
                            Tracer tracer, MetricsConfig metricsConfig) {
        config.validate();
        this.config = config.copy();
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.evaluatorMap = new EnumMap<>(ScoreDimension.class);

        for (ScoreEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getDimension(), evaluator);
            log.info("Registered score evaluator: {} -> {}",
                    evaluator.getDimension(), evaluator.getClass().getSimpleName());
        }
        for (ScoreDimension dimension : ScoreDimension.values()) {
            if (!evaluatorMap.containsKey(dimension)) {
                log.warn("No evaluator registered for dimension {}, it will score 100", dimension);
            }
        }
    }

    /**
     * Score, rank and trim the suggestions made for one file.
     *
     * @param suggestions raw AI suggestions; empty values and confidences outside [0, 100] are dropped
     * @param context     the file the suggestions are for
     * @return at most {@code maxResultsPerFile} suggestions, best first, ranks 1..n
     */
    @Observed(name = "suggestions.score", contextualName = "score-filename-suggestions")
    public List<ScoredSuggestion> scoreFilenameSuggestions(List<RawSuggestion> suggestions, ScoringContext context) {
        if (suggestions == null || suggestions.isEmpty()) {
            log.warn("No suggestions provided for scoring: file={}", context.getOriginalFilename());
            return new ArrayList<>();
        }
        ScoringConfig cfg = this.config;

        List<RawSuggestion> valid = new ArrayList<>();
        for (RawSuggestion suggestion : suggestions) {
            if (suggestion.getValue() == null || suggestion.getValue().trim().isEmpty()) {
                log.warn("Empty suggestion dropped: file={}", context.getOriginalFilename());
                continue;
            }
            if (suggestion.getConfidence() < 0 || suggestion.getConfidence() > 100
                    || Double.isNaN(suggestion.getConfidence())) {
                log.warn("Suggestion with invalid confidence dropped: file={}, value={}, confidence={}",
                        context.getOriginalFilename(), suggestion.getValue(), suggestion.getConfidence());
                continue;
            }
            valid.add(suggestion);
        }
        if (valid.size() != suggestions.size()) {
            log.info("Dropped {} invalid suggestions: file={}, valid={}",
                    suggestions.size() - valid.size(), context.getOriginalFilename(), valid.size());
        }

        List<ScoredSuggestion> scored = new ArrayList<>(valid.size());
        for (int i = 0; i < valid.size(); i++) {
            RawSuggestion suggestion = valid.get(i);
            Span span = tracer.nextSpan()
                    .name("suggestion.score")
                    .tag("suggestion.index", String.valueOf(i))
                    .start();
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                ScoredSuggestion result = scoreSingle(suggestion, context, cfg, i);
                span.tag("suggestion.quality", String.valueOf(result.getQualityScore()));
                metricsConfig.recordSuggestionScored(result.getQualityScore());
                scored.add(result);
            } catch (Exception e) {
                span.error(e);
                log.error("Failed to score suggestion {} for file {}: {}",
                        suggestion.getValue(), context.getOriginalFilename(), e.getMessage(), e);
                scored.add(fallback(suggestion, context, e, i));
            } finally {
                span.end();
            }
        }

        List<ScoredSuggestion> ranked = rank(scored);
        List<ScoredSuggestion> limited = ranked.size() > cfg.getMaxResultsPerFile()
                ? new ArrayList<>(ranked.subList(0, cfg.getMaxResultsPerFile()))
                : ranked;

        log.info("Scored suggestions: file={}, processed={}, returned={}, topQuality={}",
                context.getOriginalFilename(), ranked.size(), limited.size(),
                limited.isEmpty() ? 0 : limited.get(0).getQualityScore());
        return limited;
    }

    /**
     * Drop later suggestions whose trimmed, lower-cased value was already seen. Order is kept.
     */
    public List<ScoredSuggestion> deduplicate(List<ScoredSuggestion> suggestions) {
        Set<String> seen = new HashSet<>();
        List<ScoredSuggestion> result = new ArrayList<>();
        for (ScoredSuggestion s : suggestions) {
            String normalized = s.getValue() == null ? "" : s.getValue().trim().toLowerCase(Locale.ROOT);
            if (seen.add(normalized)) {
                result.add(s);
            }
        }
        return result;
    }

    public SuggestionMetrics calculateMetrics(List<ScoredSuggestion> suggestions) {
        ScoringConfig cfg = this.config;
        int total = suggestions.size();
        int valid = (int) suggestions.stream()
                .filter(s -> s.getAdjustedConfidence() >= cfg.getMinAcceptableConfidence()).count();
        int highQuality = (int) suggestions.stream()
                .filter(s -> s.getQualityScore() >= cfg.getHighQualityThreshold()).count();
        double avgConfidence = suggestions.stream().mapToDouble(ScoredSuggestion::getAdjustedConfidence).average().orElse(0);
        double avgQuality = suggestions.stream().mapToDouble(ScoredSuggestion::getQualityScore).average().orElse(0);

        Map<String, Integer> flagCounts = new LinkedHashMap<>();
        for (ScoredSuggestion s : suggestions) {
            for (String flag : s.getValidationFlags()) {
                flagCounts.merge(flag, 1, Integer::sum);
            }
        }
        List<String> commonIssues = flagCounts.entrySet().stream()
                .filter(e -> e.getValue() >= 2 && FilenameTerms.isProblemFlag(e.getKey()))
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(5)
                .map(Map.Entry::getKey)
                .toList();

        return new SuggestionMetrics(total, valid, highQuality,
                Math.round(avgConfidence), Math.round(avgQuality), commonIssues);
    }

    public ScoringConfig getConfig() {
        return config.copy();
    }

    /**
     * @throws IllegalArgumentException when the new configuration is invalid; the old one stays active
     */
    public void updateConfig(ScoringConfig newConfig) {
        newConfig.validate();
        this.config = newConfig.copy();
        log.info("Scoring config updated: weights={}/{}/{}/{}, highQualityThreshold={}",
                newConfig.getAiConsistencyWeight(), newConfig.getMetadataAlignmentWeight(),
                newConfig.getStructuralPatternWeight(), newConfig.getNamingConventionWeight(),
                newConfig.getHighQualityThreshold());
    }

    private ScoredSuggestion scoreSingle(RawSuggestion suggestion, ScoringContext context,
                                         ScoringConfig cfg, int index) {
        Set<String> flags = new LinkedHashSet<>();

        double structural = subScore(ScoreDimension.STRUCTURAL_PATTERN, suggestion, context, flags);
        double alignment = subScore(ScoreDimension.METADATA_ALIGNMENT, suggestion, context, flags);
        double consistency = subScore(ScoreDimension.AI_CONSISTENCY, suggestion, context, flags);
        double convention = subScore(ScoreDimension.NAMING_CONVENTION, suggestion, context, flags);

        double weighted = structural * cfg.getStructuralPatternWeight()
                + alignment * cfg.getMetadataAlignmentWeight()
                + consistency * cfg.getAiConsistencyWeight()
                + convention * cfg.getNamingConventionWeight();

        double adjusted = clamp(suggestion.getConfidence() * (weighted / 100));

        if (cfg.isPenalizeGenericTerms() && FilenameTerms.containsGenericTerms(suggestion.getValue())) {
            adjusted *= GENERIC_TERM_PENALTY;
            flags.add("contains-generic-terms");
        }
        if (cfg.isRewardSpecificity()
                && FilenameTerms.hasSpecificTerms(suggestion.getValue(), context.getOriginalFilename())) {
            adjusted = Math.min(100, adjusted * SPECIFICITY_BONUS);
            flags.add("specific-terminology");
        }

        double quality = qualityScore(adjusted, structural, alignment, flags);

        return ScoredSuggestion.builder()
                .value(suggestion.getValue())
                .confidence(suggestion.getConfidence())
                .reasoning(suggestion.getReasoning())
                .originalConfidence(suggestion.getConfidence())
                .adjustedConfidence(Math.round(adjusted))
                .qualityScore(Math.round(quality))
                .validationFlags(flags)
                .recommended(quality >= cfg.getHighQualityThreshold())
                .rank(index + 1)
                .originalPath(context.getPath())
                .build();
    }

    private double subScore(ScoreDimension dimension, RawSuggestion suggestion,
                            ScoringContext context, Set<String> flags) {
        ScoreEvaluator evaluator = evaluatorMap.get(dimension);
        if (evaluator == null) {
            return 100;
        }
        return clamp(evaluator.evaluate(suggestion, context, flags));
    }

    private static double qualityScore(double adjusted, double structural, double alignment, Set<String> flags) {
        long problems = flags.stream().filter(FilenameTerms::isProblemFlag).count();
        double average = (adjusted + structural + alignment) / 3;
        return clamp(average - problems * FLAG_PENALTY);
    }

    private ScoredSuggestion fallback(RawSuggestion suggestion, ScoringContext context, Exception e, int index) {
        Set<String> flags = new LinkedHashSet<>();
        flags.add(PROCESSING_ERROR_FLAG);
        return ScoredSuggestion.builder()
                .value(suggestion.getValue())
                .confidence(0)
                .originalConfidence(suggestion.getConfidence())
                .reasoning("Processing failed: " + e.getMessage())
                .adjustedConfidence(0)
                .qualityScore(0)
                .validationFlags(flags)
                .recommended(false)
                .rank(index + FALLBACK_RANK_OFFSET)
                .originalPath(context.getPath())
                .build();
    }

    private static List<ScoredSuggestion> rank(List<ScoredSuggestion> scored) {
        List<ScoredSuggestion> ranked = new ArrayList<>(scored);
        // Fallback entries always sort last
        ranked.sort(Comparator.comparing((ScoredSuggestion s) -> s.hasFlag(PROCESSING_ERROR_FLAG))
                .thenComparing(Comparator.comparingDouble(ScoredSuggestion::getQualityScore).reversed())
                .thenComparing(Comparator.comparingDouble(ScoredSuggestion::getAdjustedConfidence).reversed()));
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRank(i + 1);
        }
        return ranked;
    }

    private static double clamp(double value) {
        return Math.min(100, Math.max(0, value));
    }
}
