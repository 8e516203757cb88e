package org.faculty.topics;

import org.faculty.model.FacultyRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicExtractorTest {

    private final TopicExtractor extractor = new TopicExtractor();

    private static FacultyRecord faculty(String id, String department, String keywords) {
        return new FacultyRecord(id, "Name " + id, department, keywords);
    }

    private static List<String> keywords(TopicsReport report) {
        List<String> out = new ArrayList<>();
        for (TopicRecord t : report.topics()) {
            out.add(t.keyword());
        }
        return out;
    }

    @Test
    void sharedKeyword_ranksFirst() {
        List<FacultyRecord> records = List.of(
                faculty("f1", "CS", "machine learning, data mining"),
                faculty("f2", null, "deep learning")
        );

        TopicsReport report = extractor.extract(records, 10);

        TopicRecord top = report.topics().get(0);
        assertEquals(0, top.topicId());
        assertEquals("learning", top.keyword());
        assertEquals(2, top.frequency());
        assertEquals(2, top.facultyCount());
        assertEquals(List.of(
                new AssociatedFaculty("f1", "Name f1", "CS"),
                new AssociatedFaculty("f2", "Name f2", "Unknown")
        ), top.associatedFaculty());

        // ties keep first-seen order
        assertEquals(List.of("learning", "machine", "data", "mining", "deep"), keywords(report));
    }

    @Test
    void totals_areCountedBeforeFiltering() {
        List<FacultyRecord> records = List.of(
                faculty("f1", "CS", "machine learning, data mining"),
                faculty("f2", "CS", "deep learning"),
                faculty("f3", "CS", null),
                faculty("f4", "CS", "")
        );

        TopicsReport report = extractor.extract(records, 10);

        assertEquals(6, report.totalKeywords());
        assertEquals(5, report.uniqueKeywords());
        assertEquals(2, report.coverage());
    }

    @Test
    void stopWordsAndShortTokens_areNotTopics() {
        TopicsReport report = extractor.extract(
                List.of(faculty("f1", "Bio", "research using the gene and cell analysis")), 10);

        assertEquals(List.of("gene", "cell"), keywords(report));
        assertEquals(7, report.totalKeywords());
    }

    @Test
    void numTopics_limitsTheResult() {
        TopicsReport report = extractor.extract(
                List.of(faculty("f1", "CS", "graphs graphs logic logic logic proofs")), 2);

        assertEquals(List.of("logic", "graphs"), keywords(report));
        assertEquals(3, report.topics().get(0).frequency());
        assertEquals(1, report.topics().get(1).topicId());
    }

    @Test
    void association_usesSubstringMatching() {
        List<FacultyRecord> records = List.of(
                faculty("f1", "CS", "data science"),
                faculty("f2", "CS", "Databases and warehousing")
        );

        TopicRecord data = extractor.extract(records, 10).topics().get(0);

        assertEquals("data", data.keyword());
        assertEquals(1, data.frequency());
        assertEquals(2, data.facultyCount());
    }

    @Test
    void associatedFaculty_isCappedButCountIsNot() {
        List<FacultyRecord> records = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            records.add(faculty("f" + i, "Math", "graphs"));
        }

        TopicRecord graphs = extractor.extract(records, 1).topics().get(0);

        assertEquals(12, graphs.frequency());
        assertEquals(12, graphs.facultyCount());
        assertEquals(TopicExtractor.MAX_ASSOCIATED_FACULTY, graphs.associatedFaculty().size());
        assertEquals("f9", graphs.associatedFaculty().get(9).facultyId());
    }

    @Test
    void emptyInput_orZeroTopics_isNotAnError() {
        TopicsReport empty = extractor.extract(List.of(), 10);
        assertTrue(empty.topics().isEmpty());
        assertEquals(0, empty.coverage());

        TopicsReport none = extractor.extract(List.of(faculty("f1", "CS", "graphs")), 0);
        assertTrue(none.topics().isEmpty());
        assertEquals(1, none.totalKeywords());
    }

    @Test
    void negativeTopicCount_throws() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(List.of(), -1));
    }

    @Test
    void tokenize_dropsPunctuationAndMixedTokens() {
        assertEquals(List.of("machine", "learning"),
                TopicExtractor.tokenize("AI; Machine-Learning (ML), nlp2text"));
        assertEquals(List.of("systems"), TopicExtractor.tokenize("Café systems!"));
    }

    @Test
    void isTopicCandidate() {
        assertTrue(TopicExtractor.isTopicCandidate("graphs"));
        assertFalse(TopicExtractor.isTopicCandidate("web"));
        assertFalse(TopicExtractor.isTopicCandidate("research"));
    }
}
