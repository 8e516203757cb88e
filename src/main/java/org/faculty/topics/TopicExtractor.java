package org.faculty.topics;

import org.faculty.model.FacultyRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds research topics as the most frequent keyword tokens across faculty keyword texts.
 * Works on the raw metadata only; embeddings are not involved.
 */
public final class TopicExtractor {

    public static final int MAX_ASSOCIATED_FACULTY = 10;

    /** Generic English function words plus terms that say nothing about a research area. */
    static final Set<String> STOP_WORDS = Set.of(
            "and", "the", "for", "with", "from", "that", "this", "are", "was", "were",
            "been", "have", "has", "had", "will", "would", "could", "should", "may",
            "can", "research", "study", "analysis", "using", "based", "approach"
    );

    private static final Pattern DISALLOWED =
            Pattern.compile("[^\\w\\s,;-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TOKEN =
            Pattern.compile("\\b[a-z]{3,}\\b", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * @param records faculty records; those without keyword text are skipped
     * @param numTopics maximum number of topics to return (>= 0)
     */
    public TopicsReport extract(List<FacultyRecord> records, int numTopics) {
        if (records == null) throw new IllegalArgumentException("records must not be null");
        if (numTopics < 0) throw new IllegalArgumentException("numTopics must be >= 0");

        // insertion order doubles as the tie-break for equal frequencies
        Map<String, Integer> counts = new LinkedHashMap<>();
        int totalTokens = 0;
        int coverage = 0;
        for (FacultyRecord record : records) {
            if (!record.hasKeywords()) {
                continue;
            }
            coverage++;
            for (String token : tokenize(record.keywords().orElseThrow())) {
                counts.merge(token, 1, Integer::sum);
                totalTokens++;
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (isTopicCandidate(e.getKey())) {
                ranked.add(e);
            }
        }
        ranked.sort(Comparator.comparingInt(Map.Entry<String, Integer>::getValue).reversed());

        List<TopicRecord> topics = new ArrayList<>();
        for (int i = 0; i < Math.min(numTopics, ranked.size()); i++) {
            Map.Entry<String, Integer> e = ranked.get(i);
            topics.add(associate(i, e.getKey(), e.getValue(), records));
        }

        return new TopicsReport(topics, totalTokens, counts.size(), coverage);
    }

    /**
     * Lowercases the text, blanks out punctuation other than , ; - and returns every
     * standalone run of three or more lowercase letters.
     */
    static List<String> tokenize(String keywords) {
        String cleaned = DISALLOWED.matcher(keywords.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(cleaned);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    static boolean isTopicCandidate(String token) {
        return token.length() > 3 && !STOP_WORDS.contains(token);
    }

    private static TopicRecord associate(int topicId, String keyword, int frequency, List<FacultyRecord> records) {
        List<AssociatedFaculty> associated = new ArrayList<>();
        int matches = 0;
        for (FacultyRecord record : records) {
            String text = record.keywords().orElse("").toLowerCase(Locale.ROOT);
            if (!text.contains(keyword)) {
                continue;
            }
            matches++;
            if (associated.size() < MAX_ASSOCIATED_FACULTY) {
                associated.add(AssociatedFaculty.of(record));
            }
        }
        return new TopicRecord(topicId, keyword, frequency, matches, associated);
    }
}
