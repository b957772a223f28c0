package com.maxsort.organizer.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word-level helpers shared by the scorer and its evaluators.
 */
public final class FilenameTerms {

    public static final Set<String> GENERIC_TERMS = Set.of(
            "file", "document", "image", "photo", "video", "audio",
            "untitled", "new", "copy", "temp", "temporary", "test",
            "data", "stuff", "misc", "other", "unknown", "item",
            "thing", "content", "attachment", "download");

    private static final Pattern WORD_SPLIT = Pattern.compile("[-_\\s.]+");

    private FilenameTerms() {}

    public static List<String> words(String value) {
        if (value == null || value.isEmpty()) return List.of();
        return Arrays.stream(WORD_SPLIT.split(value.toLowerCase(Locale.ROOT)))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    public static boolean containsGenericTerms(String value) {
        return words(value).stream().anyMatch(GENERIC_TERMS::contains);
    }

    /**
     * True when the suggestion introduces at least two descriptive words (longer than three
     * characters, not generic) that the original name did not have.
     */
    public static boolean hasSpecificTerms(String value, String originalFilename) {
        List<String> originalWords = words(originalFilename);
        long newDescriptive = words(value).stream()
                .filter(w -> w.length() > 3)
                .filter(w -> !GENERIC_TERMS.contains(w))
                .filter(w -> !originalWords.contains(w))
                .count();
        return newDescriptive >= 2;
    }

    public static boolean isProblemFlag(String flag) {
        return flag.startsWith("bad-") || flag.contains("missing-") || flag.contains("error");
    }
}
