package com.maxsort.organizer.engine;

import com.maxsort.organizer.config.ConfidenceThresholdConfig;
import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.model.CategorizedSuggestion;
import com.maxsort.organizer.model.ConfidenceBucket;
import com.maxsort.organizer.model.ConfidenceStatistics;
import com.maxsort.organizer.model.FilterOptions;
import com.maxsort.organizer.model.FilteringResult;
import com.maxsort.organizer.model.RiskLevel;
import com.maxsort.organizer.model.SafetyCheckResult;
import com.maxsort.organizer.model.ScoredSuggestion;
import com.maxsort.organizer.model.SuggestionCategory;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sorts scored suggestions into auto-approve, manual-review and reject using the active
 * threshold policy, then downgrades anything that touches dangerous paths.
 */
@Component
public class ConfidenceFilter {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceFilter.class);

    public static final double MIN_MANUAL_REVIEW_THRESHOLD = 0.30;

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("^/System/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^/usr/bin/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^/Library/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.app/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.framework/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("node_modules", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.git/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.env", Pattern.CASE_INSENSITIVE),
            Pattern.compile("config", Pattern.CASE_INSENSITIVE),
            Pattern.compile("package\\.json$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(exe|dll|sys|bat|cmd|sh)$", Pattern.CASE_INSENSITIVE));

    // Not blocking, only noted in the reason
    private static final List<Pattern> CAUTION_PATTERNS = List.of(
            Pattern.compile("\\.(js|ts|py|php|rb|java|cpp|c)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(sql|db|sqlite)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(key|pem|crt|cert)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.(zip|rar|tar|7z)$", Pattern.CASE_INSENSITIVE));

    private static final String[] BUCKET_RANGES = {
            "90-100%", "80-89%", "70-79%", "60-69%", "50-59%",
            "40-49%", "30-39%", "20-29%", "10-19%", "0-9%"};

    private final MetricsConfig metricsConfig;
    private volatile ConfidenceThresholdConfig policy;

    public ConfidenceFilter(ConfidenceThresholdConfig policy, MetricsConfig metricsConfig) {
        policy.validate();
        this.policy = policy.copy();
        this.metricsConfig = metricsConfig;
    }

    /**
     * Filter with the policy's own safety and cap settings.
     */
    public FilteringResult filter(List<ScoredSuggestion> suggestions) {
        ConfidenceThresholdConfig cfg = this.policy;
        return filter(suggestions, FilterOptions.builder()
                .enableSafetyChecks(cfg.isEnableSafetyChecks())
                .maxAutoApproveCount(cfg.getMaxAutoApproveCount())
                .build());
    }

    @Observed(name = "suggestions.filter", contextualName = "filter-suggestions")
    public FilteringResult filter(List<ScoredSuggestion> suggestions, FilterOptions options) {
        long start = System.currentTimeMillis();
        ConfidenceThresholdConfig cfg = this.policy;

        if (suggestions == null || suggestions.isEmpty()) {
            log.warn("No suggestions provided for filtering");
            return new FilteringResult(List.of(), ConfidenceStatistics.empty(), 0, 0);
        }

        List<ScoredSuggestion> valid = new ArrayList<>();
        for (ScoredSuggestion s : suggestions) {
            if (s.getValue() == null || s.getValue().trim().isEmpty()) {
                log.warn("Skipping suggestion with empty value");
                continue;
            }
            double c = s.getAdjustedConfidence();
            if (Double.isNaN(c) || c < 0 || c > 100) {
                log.warn("Skipping suggestion with invalid confidence: value={}, confidence={}", s.getValue(), c);
                continue;
            }
            valid.add(s);
        }

        List<CategorizedSuggestion> categorized = new ArrayList<>(valid.size());
        for (ScoredSuggestion s : valid) {
            SuggestionCategory category = categorize(s, cfg);
            categorized.add(CategorizedSuggestion.builder()
                    .suggestion(s)
                    .category(category)
                    .reason(options.isIncludeReasoning() ? reason(s, category, null, cfg) : "")
                    .canOverride(canOverride(category, cfg))
                    .build());
        }

        if (options.isEnableSafetyChecks()) {
            applySafetyChecks(categorized, options, cfg);
        }
        if (options.getMaxAutoApproveCount() != null && options.getMaxAutoApproveCount() > 0) {
            applyAutoApproveLimit(categorized, options.getMaxAutoApproveCount());
        }
        if (options.isPreserveOriginalOrder()) {
            preserveOriginalOrder(categorized, suggestions);
        }

        ConfidenceStatistics statistics = calculateStatistics(categorized);
        for (CategorizedSuggestion c : categorized) {
            metricsConfig.recordCategorized(c.getCategory().getLabel());
        }
        long duration = System.currentTimeMillis() - start;

        log.info("Filtered suggestions: processed={}, autoApproved={}, manualReview={}, rejected={}, " +
                        "profile={}, threshold={}, durationMs={}",
                valid.size(), statistics.getAutoApproved(), statistics.getManualReview(),
                statistics.getRejected(), cfg.getProfile(), cfg.effectiveThreshold(), duration);

        return new FilteringResult(List.copyOf(categorized), statistics, valid.size(), duration);
    }

    /**
     * Categorize one suggestion, e.g. while a user edits a name.
     */
    public CategorizedSuggestion filterSingle(ScoredSuggestion suggestion, boolean enableSafetyChecks) {
        ConfidenceThresholdConfig cfg = this.policy;
        SuggestionCategory category = categorize(suggestion, cfg);
        SafetyCheckResult safety = enableSafetyChecks ? performSafetyCheck(suggestion) : SafetyCheckResult.passed();

        SuggestionCategory finalCategory = !safety.safe() && category == SuggestionCategory.AUTO_APPROVE
                ? SuggestionCategory.MANUAL_REVIEW
                : category;

        return CategorizedSuggestion.builder()
                .suggestion(suggestion)
                .category(finalCategory)
                .reason(reason(suggestion, finalCategory, safety, cfg))
                .canOverride(canOverride(finalCategory, cfg))
                .build();
    }

    public ConfidenceThresholdConfig getPolicy() {
        return policy.copy();
    }

    /**
     * @throws IllegalArgumentException when the policy is invalid; the previous policy stays active
     */
    public void updatePolicy(ConfidenceThresholdConfig newPolicy) {
        newPolicy.validate();
        this.policy = newPolicy.copy();
        log.info("Threshold policy updated: profile={}, threshold={}, autoApprove={}",
                newPolicy.getProfile(), newPolicy.effectiveThreshold(), newPolicy.isAutoApprove());
    }

    SafetyCheckResult performSafetyCheck(ScoredSuggestion suggestion) {
        String value = suggestion.getValue().toLowerCase(Locale.ROOT);
        String originalPath = suggestion.getOriginalPath() != null ? suggestion.getOriginalPath() : "";

        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(value).find() || pattern.matcher(originalPath).find()) {
                return SafetyCheckResult.unsafe("Contains system or critical file patterns", RiskLevel.HIGH);
            }
        }

        for (Pattern pattern : CAUTION_PATTERNS) {
            if (pattern.matcher(value).find()) {
                return new SafetyCheckResult(true, "Contains potentially sensitive file type", RiskLevel.MEDIUM);
            }
        }

        List<String> problemFlags = suggestion.getValidationFlags().stream()
                .filter(f -> f.contains("bad-") || f.contains("error") || f.contains("invalid"))
                .toList();
        if (problemFlags.size() > 2) {
            return SafetyCheckResult.unsafe(
                    "Multiple validation issues: " + String.join(", ", problemFlags.subList(0, 2)),
                    RiskLevel.MEDIUM);
        }

        return SafetyCheckResult.passed();
    }

    private SuggestionCategory categorize(ScoredSuggestion suggestion, ConfidenceThresholdConfig cfg) {
        double confidence = suggestion.getAdjustedConfidence() / 100;
        if (!cfg.isAutoApprove()) {
            return confidence >= MIN_MANUAL_REVIEW_THRESHOLD
                    ? SuggestionCategory.MANUAL_REVIEW
                    : SuggestionCategory.REJECT;
        }
        if (confidence >= cfg.effectiveThreshold()) {
            return SuggestionCategory.AUTO_APPROVE;
        }
        if (confidence >= MIN_MANUAL_REVIEW_THRESHOLD) {
            return SuggestionCategory.MANUAL_REVIEW;
        }
        return SuggestionCategory.REJECT;
    }

    private static boolean canOverride(SuggestionCategory category, ConfidenceThresholdConfig cfg) {
        return cfg.isEnableManualOverride() && category != SuggestionCategory.REJECT;
    }

    private String reason(ScoredSuggestion suggestion, SuggestionCategory category,
                          SafetyCheckResult safety, ConfidenceThresholdConfig cfg) {
        long confidence = Math.round(suggestion.getAdjustedConfidence());
        long threshold = Math.round(cfg.effectiveThreshold() * 100);

        switch (category) {
            case AUTO_APPROVE:
                String reason = String.format("High confidence (%d%% ≥ %d%%)", confidence, threshold);
                if (safety != null && safety.riskLevel() == RiskLevel.MEDIUM) {
                    reason += ", passed safety checks";
                }
                return reason;
            case MANUAL_REVIEW:
                if (!cfg.isAutoApprove()) {
                    return String.format("Auto-approval disabled, requires manual review (%d%%)", confidence);
                }
                if (safety != null && !safety.safe()) {
                    return String.format("Safety concern: %s (%d%%)", safety.reason(), confidence);
                }
                return String.format("Medium confidence (%d%% < %d%%), requires review", confidence, threshold);
            case REJECT:
            default:
                return String.format("Low confidence (%d%% < %d%%), automatically rejected",
                        confidence, Math.round(MIN_MANUAL_REVIEW_THRESHOLD * 100));
        }
    }

    private void applySafetyChecks(List<CategorizedSuggestion> categorized, FilterOptions options,
                                   ConfidenceThresholdConfig cfg) {
        for (CategorizedSuggestion c : categorized) {
            if (c.getCategory() != SuggestionCategory.AUTO_APPROVE) {
                continue;
            }
            SafetyCheckResult safety = performSafetyCheck(c.getSuggestion());
            if (!safety.safe()) {
                c.setCategory(SuggestionCategory.MANUAL_REVIEW);
                c.setReason(reason(c.getSuggestion(), SuggestionCategory.MANUAL_REVIEW, safety, cfg));
                c.setCanOverride(canOverride(SuggestionCategory.MANUAL_REVIEW, cfg));
                metricsConfig.recordSafetyDowngrade(safety.riskLevel().name());
                log.info("Downgraded auto-approved suggestion: value={}, reason={}, risk={}",
                        c.getValue(), safety.reason(), safety.riskLevel());
            } else if (safety.riskLevel() == RiskLevel.MEDIUM && options.isIncludeReasoning()) {
                c.setReason(reason(c.getSuggestion(), SuggestionCategory.AUTO_APPROVE, safety, cfg));
            }
        }
    }

    private void applyAutoApproveLimit(List<CategorizedSuggestion> categorized, int maxCount) {
        List<CategorizedSuggestion> autoApproved = categorized.stream()
                .filter(c -> c.getCategory() == SuggestionCategory.AUTO_APPROVE)
                .sorted(Comparator.comparingDouble(CategorizedSuggestion::getAdjustedConfidence).reversed())
                .toList();
        if (autoApproved.size() <= maxCount) {
            return;
        }
        for (CategorizedSuggestion c : autoApproved.subList(maxCount, autoApproved.size())) {
            c.setCategory(SuggestionCategory.MANUAL_REVIEW);
            c.setReason(String.format("Exceeded auto-approve limit (%d), moved to manual review", maxCount));
        }
        log.info("Applied auto-approve limit: limit={}, downgraded={}", maxCount, autoApproved.size() - maxCount);
    }

    private static void preserveOriginalOrder(List<CategorizedSuggestion> categorized,
                                              List<ScoredSuggestion> original) {
        Map<ScoredSuggestion, Integer> order = new IdentityHashMap<>();
        for (int i = 0; i < original.size(); i++) {
            order.put(original.get(i), i);
        }
        categorized.sort(Comparator.comparingInt(c -> order.getOrDefault(c.getSuggestion(), 0)));
    }

    private static ConfidenceStatistics calculateStatistics(List<CategorizedSuggestion> categorized) {
        int total = categorized.size();
        if (total == 0) {
            return ConfidenceStatistics.empty();
        }
        int auto = 0;
        int manual = 0;
        int rejected = 0;
        double confidenceSum = 0;
        int[] buckets = new int[BUCKET_RANGES.length];

        for (CategorizedSuggestion c : categorized) {
            switch (c.getCategory()) {
                case AUTO_APPROVE -> auto++;
                case MANUAL_REVIEW -> manual++;
                case REJECT -> rejected++;
            }
            double percent = c.getAdjustedConfidence();
            confidenceSum += percent / 100;
            int bucket = percent >= 90 ? 0 : 9 - (int) Math.floor(percent / 10);
            buckets[Math.min(9, Math.max(0, bucket))]++;
        }

        List<ConfidenceBucket> distribution = new ArrayList<>(BUCKET_RANGES.length);
        for (int i = 0; i < BUCKET_RANGES.length; i++) {
            distribution.add(new ConfidenceBucket(BUCKET_RANGES[i], buckets[i]));
        }

        return ConfidenceStatistics.builder()
                .totalSuggestions(total)
                .autoApproved(auto)
                .manualReview(manual)
                .rejected(rejected)
                .averageConfidence(Math.round((confidenceSum / total) * 100) / 100.0)
                .filteringEffectiveness((int) Math.round(((auto + rejected) * 100.0) / total))
                .confidenceDistribution(List.copyOf(distribution))
                .build();
    }
}
