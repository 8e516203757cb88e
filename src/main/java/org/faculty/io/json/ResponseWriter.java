package org.faculty.io.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.faculty.cluster.ClusterAssignment;
import org.faculty.cluster.ClusterSummary;
import org.faculty.cluster.ClusteringReport;
import org.faculty.metrics.SimilarityResult;
import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;
import org.faculty.topics.AssociatedFaculty;
import org.faculty.topics.TopicRecord;
import org.faculty.topics.TopicsReport;

import java.util.List;

/**
 * Renders pipeline results as the JSON objects printed by the command line.
 * Field names follow the snake_case convention of the requests.
 */
public final class ResponseWriter {

    private final ObjectMapper mapper;

    public ResponseWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode success() {
        ObjectNode out = mapper.createObjectNode();
        out.put("success", true);
        return out;
    }

    public ObjectNode failure(String message) {
        ObjectNode out = mapper.createObjectNode();
        out.put("success", false);
        out.put("error", message == null ? "Unknown error" : message);
        return out;
    }

    public ArrayNode embeddings(List<Vector> vectors) {
        ArrayNode out = mapper.createArrayNode();
        for (Vector v : vectors) {
            ArrayNode row = out.addArray();
            for (double x : v.toArrayCopy()) {
                row.add(x);
            }
        }
        return out;
    }

    public ArrayNode similarFaculty(List<SimilarityResult> results) {
        ArrayNode out = mapper.createArrayNode();
        for (SimilarityResult r : results) {
            ObjectNode node = faculty(r.faculty());
            node.put("similarity", r.similarity());
            out.add(node);
        }
        return out;
    }

    public ObjectNode clustering(ClusteringReport report) {
        ObjectNode out = mapper.createObjectNode();
        ArrayNode clusters = out.putArray("clusters");
        for (ClusterSummary summary : report.clusters()) {
            ObjectNode c = clusters.addObject();
            c.put("cluster_id", summary.clusterId());
            c.put("size", summary.size());
            ArrayNode members = c.putArray("members");
            for (ClusterAssignment a : summary.members()) {
                ObjectNode m = faculty(a.faculty());
                m.put("cluster_id", a.clusterId());
                m.put("cluster_probability", a.probability());
                members.add(m);
            }
        }
        out.put("outliers", report.outliers());
        out.put("total_clusters", report.totalClusters());
        out.put("silhouette_score", report.silhouetteScore());
        out.put("algorithm_used", report.algorithm().label());
        return out;
    }

    public ObjectNode topics(TopicsReport report) {
        ObjectNode out = mapper.createObjectNode();
        ArrayNode topics = out.putArray("topics");
        for (TopicRecord t : report.topics()) {
            ObjectNode node = topics.addObject();
            node.put("topic_id", t.topicId());
            node.put("keyword", t.keyword());
            node.put("frequency", t.frequency());
            node.put("faculty_count", t.facultyCount());
            ArrayNode associated = node.putArray("associated_faculty");
            for (AssociatedFaculty f : t.associatedFaculty()) {
                associated.addObject()
                        .put(RequestReader.FACULTY_ID, f.facultyId())
                        .put(RequestReader.NAME, f.name())
                        .put(RequestReader.DEPARTMENT, f.department());
            }
        }
        out.put("total_keywords", report.totalKeywords());
        out.put("unique_keywords", report.uniqueKeywords());
        out.put("coverage", report.coverage());
        return out;
    }

    /**
     * The faculty object as it came in: known fields first, then the pass-through attributes.
     * A missing department is written as {@value FacultyRecord#UNKNOWN_DEPARTMENT}.
     */
    public ObjectNode faculty(FacultyRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(RequestReader.FACULTY_ID, record.id());
        node.put(RequestReader.NAME, record.name());
        node.put(RequestReader.DEPARTMENT, record.departmentOrUnknown());
        record.keywords().ifPresent(k -> node.put(RequestReader.KEYWORDS, k));
        record.attributes().forEach((key, value) -> node.set(key, mapper.valueToTree(value)));
        return node;
    }
}
