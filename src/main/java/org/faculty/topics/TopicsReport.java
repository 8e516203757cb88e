package org.faculty.topics;

import java.util.List;

/**
 * @param topics topics ordered by descending frequency
 * @param totalKeywords token occurrences before stop-word filtering
 * @param uniqueKeywords distinct tokens before stop-word filtering
 * @param coverage number of faculty with non-empty keyword text
 */
public record TopicsReport(List<TopicRecord> topics, int totalKeywords, int uniqueKeywords, int coverage) {

    public TopicsReport {
        topics = List.copyOf(topics);
    }
}
