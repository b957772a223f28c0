package com.maxsort.organizer.engine.evaluators;

import com.maxsort.organizer.engine.ScoreDimension;
import com.maxsort.organizer.engine.ScoreEvaluator;
import com.maxsort.organizer.engine.ScoringContext;
import com.maxsort.organizer.model.RawSuggestion;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks the shape of a suggested filename.
 *
 * Starts at 100 and subtracts: 20 per bad pattern (30 for filesystem-unsafe characters),
 * 15 when no good pattern matches, 40 when shorter than 3 characters or 25 when longer
 * than 100, 30 without an extension and 10 with more than two dots.
 */
@Component
public class StructuralPatternEvaluator implements ScoreEvaluator {

    static final String INVALID_CHARS = "invalid-chars";

    private static final Map<String, Pattern> BAD_PATTERNS = new LinkedHashMap<>();
    private static final Map<String, Pattern> GOOD_PATTERNS = new LinkedHashMap<>();

    static {
        BAD_PATTERNS.put("spaces", Pattern.compile("\\s+"));
        BAD_PATTERNS.put(INVALID_CHARS, Pattern.compile("[<>:\"/\\\\|?*]"));
        BAD_PATTERNS.put("multiple-dots", Pattern.compile("\\.{2,}"));
        BAD_PATTERNS.put("starts-with-dot", Pattern.compile("^\\."));
        BAD_PATTERNS.put("ends-with-dot", Pattern.compile("\\.$"));
        BAD_PATTERNS.put("repeated-separators", Pattern.compile("-{2,}|_{2,}"));
        BAD_PATTERNS.put("starts-with-separator", Pattern.compile("^[-_]"));
        BAD_PATTERNS.put("ends-with-separator", Pattern.compile("[-_]$"));

        GOOD_PATTERNS.put("date-prefix", Pattern.compile("^\\d{4}-\\d{2}-\\d{2}"));
        GOOD_PATTERNS.put("lowercase-with-separators", Pattern.compile("^[a-z][a-z0-9-_]*$"));
        GOOD_PATTERNS.put("pascal-case", Pattern.compile("^[A-Z][a-zA-Z0-9]*$"));
        GOOD_PATTERNS.put("camel-case", Pattern.compile("^[a-z][a-zA-Z0-9]*$"));
    }

    @Override
    public ScoreDimension getDimension() {
        return ScoreDimension.STRUCTURAL_PATTERN;
    }

    @Override
    public double evaluate(RawSuggestion suggestion, ScoringContext context, Set<String> flags) {
        String filename = suggestion.getValue();
        double score = 100;

        for (Map.Entry<String, Pattern> bad : BAD_PATTERNS.entrySet()) {
            if (bad.getValue().matcher(filename).find()) {
                score -= 20;
                flags.add("bad-pattern-" + bad.getKey());
                if (INVALID_CHARS.equals(bad.getKey())) {
                    score -= 10;
                }
            }
        }

        boolean hasGoodPattern = false;
        for (Map.Entry<String, Pattern> good : GOOD_PATTERNS.entrySet()) {
            if (good.getValue().matcher(filename).find()) {
                hasGoodPattern = true;
                flags.add("good-pattern-" + good.getKey());
                break;
            }
        }
        if (!hasGoodPattern) {
            score -= 15;
            flags.add("no-good-pattern");
        }

        if (filename.length() < 3) {
            score -= 40;
            flags.add("too-short");
        } else if (filename.length() > 100) {
            score -= 25;
            flags.add("too-long");
        }

        // split with -1 keeps trailing empty parts, so "name." counts as having two parts
        int parts = filename.split("\\.", -1).length;
        if (parts < 2) {
            score -= 30;
            flags.add("missing-extension");
        } else if (parts > 3) {
            score -= 10;
            flags.add("too-many-dots");
        }

        return Math.max(0, score);
    }
}
