package com.maxsort.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "organizer.scoring")
public class ScoringConfig {

    // Sub-score weights. Must each be >= 0 and sum to at most 1.
    private double aiConsistencyWeight = 0.30;
    private double metadataAlignmentWeight = 0.25;
    private double structuralPatternWeight = 0.25;
    private double namingConventionWeight = 0.20;

    // Adjusted confidence below this does not count as a valid suggestion
    private double minAcceptableConfidence = 30;

    // Quality score at or above this marks a suggestion as recommended
    private double highQualityThreshold = 80;

    // Suggestions kept per input file after ranking
    private int maxResultsPerFile = 5;

    // Multiply adjusted confidence by 0.8 when the value is only generic words
    private boolean penalizeGenericTerms = true;

    // Multiply adjusted confidence by 1.1 when the value adds specific new words
    private boolean rewardSpecificity = true;

    public double totalWeight() {
        return aiConsistencyWeight + metadataAlignmentWeight + structuralPatternWeight + namingConventionWeight;
    }

    /**
     * @throws IllegalArgumentException when a weight is negative, the weights sum above 1
     *                                  or a threshold is outside [0, 100]
     */
    public void validate() {
        double[] weights = {aiConsistencyWeight, metadataAlignmentWeight, structuralPatternWeight, namingConventionWeight};
        for (double w : weights) {
            if (w < 0) {
                throw new IllegalArgumentException("Scoring weights must not be negative, got " + w);
            }
        }
        if (totalWeight() > 1.0 + 1e-9) {
            throw new IllegalArgumentException(
                    String.format("Scoring weights must sum to at most 1.0, got %.3f", totalWeight()));
        }
        if (minAcceptableConfidence < 0 || minAcceptableConfidence > 100) {
            throw new IllegalArgumentException("minAcceptableConfidence must be within [0, 100]");
        }
        if (highQualityThreshold < 0 || highQualityThreshold > 100) {
            throw new IllegalArgumentException("highQualityThreshold must be within [0, 100]");
        }
        if (maxResultsPerFile < 1) {
            throw new IllegalArgumentException("maxResultsPerFile must be at least 1");
        }
    }

    public ScoringConfig copy() {
        ScoringConfig copy = new ScoringConfig();
        copy.setAiConsistencyWeight(aiConsistencyWeight);
        copy.setMetadataAlignmentWeight(metadataAlignmentWeight);
        copy.setStructuralPatternWeight(structuralPatternWeight);
        copy.setNamingConventionWeight(namingConventionWeight);
        copy.setMinAcceptableConfidence(minAcceptableConfidence);
        copy.setHighQualityThreshold(highQualityThreshold);
        copy.setMaxResultsPerFile(maxResultsPerFile);
        copy.setPenalizeGenericTerms(penalizeGenericTerms);
        copy.setRewardSpecificity(rewardSpecificity);
        return copy;
    }
}
