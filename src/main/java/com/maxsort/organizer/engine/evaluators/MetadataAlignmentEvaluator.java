package com.maxsort.organizer.engine.evaluators;

import com.maxsort.organizer.engine.ScoreDimension;
import com.maxsort.organizer.engine.ScoreEvaluator;
import com.maxsort.organizer.engine.ScoringContext;
import com.maxsort.organizer.model.RawSuggestion;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Checks that the suggestion keeps the file's extension, with a small bonus when the
 * name relates to the directory the file lives in.
 */
@Component
public class MetadataAlignmentEvaluator implements ScoreEvaluator {

    private static final Set<String> UNINFORMATIVE_DIRECTORIES = Set.of("downloads", "desktop");

    @Override
    public ScoreDimension getDimension() {
        return ScoreDimension.METADATA_ALIGNMENT;
    }

    @Override
    public double evaluate(RawSuggestion suggestion, ScoringContext context, Set<String> flags) {
        String filename = suggestion.getValue();
        double score = 100;

        String extension = context.getExtension() != null ? context.getExtension() : "";
        if (!filename.endsWith(extension)) {
            score -= 50;
            flags.add("missing-extension");
        }

        String parent = context.getParentDirectory();
        if (parent != null && !parent.isEmpty()) {
            String dirName = lastSegment(parent).toLowerCase(Locale.ROOT);
            String lower = filename.toLowerCase(Locale.ROOT);
            String stem = lower.split("\\.", -1)[0];
            if (!dirName.isEmpty() && !UNINFORMATIVE_DIRECTORIES.contains(dirName)
                    && (lower.contains(dirName) || dirName.contains(stem))) {
                score += 10;
                flags.add("directory-alignment");
            }
        }

        return Math.min(100, Math.max(0, score));
    }

    private static String lastSegment(String path) {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
