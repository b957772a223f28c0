package com.maxsort.organizer.engine;

public enum ScoreDimension {
    STRUCTURAL_PATTERN,
    METADATA_ALIGNMENT,
    AI_CONSISTENCY,
    NAMING_CONVENTION
}
