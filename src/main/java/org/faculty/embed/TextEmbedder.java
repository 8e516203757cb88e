package org.faculty.embed;

import org.faculty.model.Vector;

import java.util.List;

/**
 * Turns texts into fixed-dimension embedding vectors.
 * <p>
 * Lifecycle: {@link #embed(List)} any number of times, then {@link #close()}.
 * {@link #initialize()} is the dependency check and is optional before embedding.
 */
public interface TextEmbedder extends AutoCloseable {

    /**
     * Loads the model once to check that it is available.
     *
     * @throws org.faculty.exception.ModelInitializationException if the model is unavailable
     */
    void initialize();

    /**
     * @return one vector per text, in input order, all of the same dimension
     * @throws org.faculty.exception.EmbeddingGenerationException if the model fails
     */
    List<Vector> embed(List<String> texts);

    String modelName();

    @Override
    void close();
}
