package com.maxsort.organizer.engine;

import com.maxsort.organizer.config.ConfidenceThresholdConfig;
import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.model.CategorizedSuggestion;
import com.maxsort.organizer.model.ConfidenceBucket;
import com.maxsort.organizer.model.ConfidenceStatistics;
import com.maxsort.organizer.model.FilterOptions;
import com.maxsort.organizer.model.FilteringResult;
import com.maxsort.organizer.model.ScoredSuggestion;
import com.maxsort.organizer.model.SuggestionCategory;
import com.maxsort.organizer.model.ThresholdProfile;
import com.maxsort.organizer.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConfidenceFilterTest {

    @Mock private MetricsConfig metricsConfig;

    private ConfidenceFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ConfidenceFilter(policy(ThresholdProfile.BALANCED, null), metricsConfig);
    }

    private static ConfidenceThresholdConfig policy(ThresholdProfile profile, Double custom) {
        ConfidenceThresholdConfig config = new ConfidenceThresholdConfig();
        config.setProfile(profile);
        config.setCustomThreshold(custom);
        return config;
    }

    private static ScoredSuggestion suggestion(String value, double confidence) {
        return TestDataFactory.createScoredSuggestion(value, confidence, "/home/user/docs/scan-001.pdf");
    }

    @Test
    void filter_highConfidenceBalanced_autoApprovesWithReason() {
        FilteringResult result = filter.filter(List.of(suggestion("doc.pdf", 95)));

        CategorizedSuggestion item = result.categorized().get(0);
        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.AUTO_APPROVE);
        assertThat(item.getReason()).contains("95% ≥ 80%");
        assertThat(item.isCanOverride()).isTrue();
        verify(metricsConfig).recordCategorized("auto-approve");
    }

    @Test
    void filter_systemPath_downgradedToManualReview() {
        ScoredSuggestion s = TestDataFactory.createScoredSuggestion("report.pdf", 95, "/System/x.pdf");

        FilteringResult result = filter.filter(List.of(s));

        CategorizedSuggestion item = result.categorized().get(0);
        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.MANUAL_REVIEW);
        assertThat(item.getReason()).startsWith("Safety concern");
        verify(metricsConfig).recordSafetyDowngrade("HIGH");
    }

    @Test
    void filter_safetyChecksDisabled_keepsAutoApproval() {
        ScoredSuggestion s = TestDataFactory.createScoredSuggestion("report.pdf", 95, "/System/x.pdf");

        FilteringResult result = filter.filter(List.of(s),
                FilterOptions.builder().enableSafetyChecks(false).build());

        assertThat(result.categorized().get(0).getCategory()).isEqualTo(SuggestionCategory.AUTO_APPROVE);
    }

    @Test
    void filter_stricterProfileNeverApprovesMore() {
        ScoredSuggestion s = suggestion("invoice.pdf", 85);
        ConfidenceFilter conservative = new ConfidenceFilter(policy(ThresholdProfile.CONSERVATIVE, null), metricsConfig);
        ConfidenceFilter aggressive = new ConfidenceFilter(policy(ThresholdProfile.AGGRESSIVE, null), metricsConfig);

        assertThat(conservative.filter(List.of(s)).categorized().get(0).getCategory())
                .isEqualTo(SuggestionCategory.MANUAL_REVIEW);
        assertThat(aggressive.filter(List.of(s)).categorized().get(0).getCategory())
                .isEqualTo(SuggestionCategory.AUTO_APPROVE);
    }

    @Test
    void filter_lowConfidence_rejectedAndNotOverridable() {
        CategorizedSuggestion item = filter.filter(List.of(suggestion("scan.pdf", 20))).categorized().get(0);

        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.REJECT);
        assertThat(item.isCanOverride()).isFalse();
        assertThat(item.getReason()).contains("automatically rejected");
    }

    @Test
    void filter_autoApproveDisabled_sendsConfidentItemsToReview() {
        ConfidenceThresholdConfig config = policy(ThresholdProfile.BALANCED, null);
        config.setAutoApprove(false);
        ConfidenceFilter manualOnly = new ConfidenceFilter(config, metricsConfig);

        CategorizedSuggestion item = manualOnly.filter(List.of(suggestion("doc.pdf", 95))).categorized().get(0);

        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.MANUAL_REVIEW);
        assertThat(item.getReason()).startsWith("Auto-approval disabled");
    }

    @Test
    void filter_zeroAutoApproveCap_meansNoLimit() {
        FilteringResult result = filter.filter(
                List.of(suggestion("a.pdf", 90), suggestion("b.pdf", 95), suggestion("c.pdf", 85)),
                FilterOptions.builder().maxAutoApproveCount(0).build());

        assertThat(result.inCategory(SuggestionCategory.AUTO_APPROVE))
                .extracting(CategorizedSuggestion::getValue).containsExactlyInAnyOrder("a.pdf", "b.pdf", "c.pdf");
        assertThat(result.inCategory(SuggestionCategory.MANUAL_REVIEW)).isEmpty();
    }

    @Test
    void filter_autoApproveCap_keepsHighestConfidence() {
        FilteringResult result = filter.filter(
                List.of(suggestion("a.pdf", 90), suggestion("b.pdf", 95), suggestion("c.pdf", 85)),
                FilterOptions.builder().maxAutoApproveCount(1).build());

        assertThat(result.inCategory(SuggestionCategory.AUTO_APPROVE))
                .extracting(CategorizedSuggestion::getValue).containsExactly("b.pdf");
        assertThat(result.inCategory(SuggestionCategory.MANUAL_REVIEW))
                .allSatisfy(c -> assertThat(c.getReason()).contains("Exceeded auto-approve limit (1)"));
    }

    @Test
    void filter_invalidEntries_skippedFromTotals() {
        ScoredSuggestion blank = suggestion(" ", 90);
        ScoredSuggestion outOfRange = suggestion("x.pdf", 120);

        FilteringResult result = filter.filter(List.of(blank, outOfRange, suggestion("ok.pdf", 50)));

        assertThat(result.totalProcessed()).isEqualTo(1);
        assertThat(result.categorized()).hasSize(1);
    }

    @Test
    void filter_emptyInput_returnsEmptyStatistics() {
        FilteringResult result = filter.filter(List.of());

        assertThat(result.totalProcessed()).isZero();
        assertThat(result.statistics().getTotalSuggestions()).isZero();
    }

    @Test
    void filter_statistics_countsAndBuckets() {
        FilteringResult result = filter.filter(List.of(
                suggestion("a.pdf", 95), suggestion("b.pdf", 85),
                suggestion("c.pdf", 50), suggestion("d.pdf", 10)));

        ConfidenceStatistics stats = result.statistics();
        assertThat(stats.getTotalSuggestions()).isEqualTo(4);
        assertThat(stats.getAutoApproved()).isEqualTo(2);
        assertThat(stats.getManualReview()).isEqualTo(1);
        assertThat(stats.getRejected()).isEqualTo(1);
        assertThat(stats.getFilteringEffectiveness()).isEqualTo(75);
        assertThat(stats.getAverageConfidence()).isEqualTo(0.6);

        List<ConfidenceBucket> buckets = stats.getConfidenceDistribution();
        assertThat(buckets).hasSize(10);
        assertThat(buckets.get(0)).isEqualTo(new ConfidenceBucket("90-100%", 1));
        assertThat(buckets.get(1)).isEqualTo(new ConfidenceBucket("80-89%", 1));
        assertThat(buckets.get(4)).isEqualTo(new ConfidenceBucket("50-59%", 1));
        assertThat(buckets.get(8)).isEqualTo(new ConfidenceBucket("10-19%", 1));
        assertThat(buckets.stream().mapToInt(ConfidenceBucket::count).sum()).isEqualTo(4);
    }

    @Test
    void filterSingle_scriptFile_requiresReview() {
        CategorizedSuggestion item = filter.filterSingle(suggestion("deploy.sh", 95), true);

        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.MANUAL_REVIEW);
        assertThat(item.getReason()).contains("Safety concern");
    }

    @Test
    void filterSingle_sensitiveTypeStaysApprovedWithNote() {
        CategorizedSuggestion item = filter.filterSingle(suggestion("analysis.py", 95), true);

        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.AUTO_APPROVE);
        assertThat(item.getReason()).endsWith(", passed safety checks");
    }

    @Test
    void customProfile_usesConfiguredThreshold() {
        ConfidenceFilter custom = new ConfidenceFilter(policy(ThresholdProfile.CUSTOM, 0.60), metricsConfig);

        CategorizedSuggestion item = custom.filter(List.of(suggestion("notes.pdf", 65))).categorized().get(0);

        assertThat(item.getCategory()).isEqualTo(SuggestionCategory.AUTO_APPROVE);
        assertThat(item.getReason()).contains("65% ≥ 60%");
    }

    @Test
    void customProfile_outOfRangeThreshold_throws() {
        assertThatThrownBy(() -> new ConfidenceFilter(policy(ThresholdProfile.CUSTOM, 0.05), metricsConfig))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceFilter(policy(ThresholdProfile.CUSTOM, null), metricsConfig))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updatePolicy_invalid_keepsPreviousPolicy() {
        assertThatThrownBy(() -> filter.updatePolicy(policy(ThresholdProfile.CUSTOM, 1.5)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(filter.getPolicy().getProfile()).isEqualTo(ThresholdProfile.BALANCED);
    }
}
