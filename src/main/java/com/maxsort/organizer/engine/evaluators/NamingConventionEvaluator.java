package com.maxsort.organizer.engine.evaluators;

import com.maxsort.organizer.engine.ScoreDimension;
import com.maxsort.organizer.engine.ScoreEvaluator;
import com.maxsort.organizer.engine.ScoringContext;
import com.maxsort.organizer.model.RawSuggestion;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class NamingConventionEvaluator implements ScoreEvaluator {

    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z][a-zA-Z0-9]*$");

    @Override
    public ScoreDimension getDimension() {
        return ScoreDimension.NAMING_CONVENTION;
    }

    @Override
    public double evaluate(RawSuggestion suggestion, ScoringContext context, Set<String> flags) {
        String filename = suggestion.getValue();
        double score = 100;

        if (filename.contains("-") && filename.contains("_")) {
            score -= 10;
            flags.add("mixed-separators");
        }

        String stem = filename.replaceFirst("\\.[^.]*$", "");
        boolean allLower = stem.equals(stem.toLowerCase(Locale.ROOT));
        boolean allUpper = stem.equals(stem.toUpperCase(Locale.ROOT));
        boolean pascal = PASCAL_CASE.matcher(stem).matches();
        boolean camel = CAMEL_CASE.matcher(stem).matches();

        if (!allLower && !allUpper && !pascal && !camel) {
            score -= 15;
            flags.add("inconsistent-case");
        } else {
            flags.add("consistent-case");
        }
        return Math.max(0, score);
    }
}
