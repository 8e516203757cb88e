package org.faculty.topics;

import java.util.List;

/**
 * A frequent keyword and the faculty associated with it.
 *
 * @param topicId rank of the topic, starting at 0
 * @param frequency occurrences of the keyword across all keyword texts
 * @param facultyCount number of faculty whose keyword text contains the keyword (not capped)
 * @param associatedFaculty the first matching faculty, at most {@link TopicExtractor#MAX_ASSOCIATED_FACULTY}
 */
public record TopicRecord(int topicId,
                          String keyword,
                          int frequency,
                          int facultyCount,
                          List<AssociatedFaculty> associatedFaculty) {

    public TopicRecord {
        associatedFaculty = List.copyOf(associatedFaculty);
    }
}
