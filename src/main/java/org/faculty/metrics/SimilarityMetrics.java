package org.faculty.metrics;

import java.util.List;
import java.util.Locale;

/**
 * Resolves the configured similarity strategy by name.
 */
public final class SimilarityMetrics {

    private SimilarityMetrics() {
    }

    public static List<String> names() {
        return List.of(CosineSimilarity.NAME, CommonsMathCosineSimilarity.NAME);
    }

    /**
     * @param name "cosine" (pure computation) or "commons-math" (library-backed)
     * @throws IllegalArgumentException for any other name
     */
    public static SimilarityMetric byName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("similarity metric name must be non-empty");
        }
        switch (name.strip().toLowerCase(Locale.ROOT)) {
            case CosineSimilarity.NAME:
                return new CosineSimilarity();
            case CommonsMathCosineSimilarity.NAME:
                return new CommonsMathCosineSimilarity();
            default:
                throw new IllegalArgumentException(
                        "Unknown similarity metric '" + name + "', expected one of " + names()
                );
        }
    }
}
