package org.faculty.app.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.faculty.app.api.FacultyAnalyticsUseCases;
import org.faculty.cluster.ClusteringReport;
import org.faculty.config.AnalyticsConfig;
import org.faculty.io.json.RequestReader;
import org.faculty.io.json.ResponseWriter;
import org.faculty.metrics.SimilarityResult;
import org.faculty.model.Vector;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The commands understood by the command line, one per invocation.
 * Each command turns a request into the success payload; failures are thrown.
 */
enum Command {

    TEST("test", false) {
        @Override
        ObjectNode execute(FacultyAnalyticsUseCases service, RequestReader request, ResponseWriter writer,
                           AnalyticsConfig config) {
            return writer.success().put("message", service.checkDependencies());
        }
    },

    GENERATE_EMBEDDINGS("generate_embeddings", true) {
        @Override
        ObjectNode execute(FacultyAnalyticsUseCases service, RequestReader request, ResponseWriter writer,
                           AnalyticsConfig config) {
            List<Vector> vectors = service.generateEmbeddings(request.texts("texts"));
            ObjectNode out = writer.success();
            out.set("embeddings", writer.embeddings(vectors));
            return out;
        }
    },

    FIND_SIMILAR("find_similar", true) {
        @Override
        ObjectNode execute(FacultyAnalyticsUseCases service, RequestReader request, ResponseWriter writer,
                           AnalyticsConfig config) {
            List<SimilarityResult> results = service.findSimilar(
                    request.vector("target_embedding"),
                    request.vectors("all_embeddings"),
                    request.facultyData("faculty_data"),
                    request.optionalInt("top_k", config.defaultTopK()),
                    request.optionalDouble("threshold", config.defaultThreshold())
            );
            ObjectNode out = writer.success();
            out.set("similar_faculty", writer.similarFaculty(results));
            return out;
        }
    },

    CLUSTER_FACULTY("cluster_faculty", true) {
        @Override
        ObjectNode execute(FacultyAnalyticsUseCases service, RequestReader request, ResponseWriter writer,
                           AnalyticsConfig config) {
            ClusteringReport report = service.clusterFaculty(
                    request.vectors("embeddings"),
                    request.facultyData("faculty_data"),
                    request.optionalInt("min_cluster_size", config.defaultMinClusterSize())
            );
            ObjectNode out = writer.success();
            out.set("clustering", writer.clustering(report));
            return out;
        }
    },

    ANALYZE_TOPICS("analyze_topics", true) {
        @Override
        ObjectNode execute(FacultyAnalyticsUseCases service, RequestReader request, ResponseWriter writer,
                           AnalyticsConfig config) {
            ObjectNode out = writer.success();
            out.set("topics", writer.topics(service.analyzeTopics(
                    request.facultyData("faculty_data"),
                    request.optionalInt("num_topics", config.defaultNumTopics())
            )));
            return out;
        }
    };

    private final String commandName;
    private final boolean readsInput;

    Command(String commandName, boolean readsInput) {
        this.commandName = commandName;
        this.readsInput = readsInput;
    }

    abstract ObjectNode execute(FacultyAnalyticsUseCases service, RequestReader request, ResponseWriter writer,
                                AnalyticsConfig config);

    String commandName() {
        return commandName;
    }

    /** Whether the command expects a JSON request on standard input. */
    boolean readsInput() {
        return readsInput;
    }

    static Optional<Command> byName(String name) {
        return Arrays.stream(values()).filter(c -> c.commandName.equals(name)).findFirst();
    }
}
