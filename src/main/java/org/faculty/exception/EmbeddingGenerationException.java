package org.faculty.exception;

/** The embedder started but failed to produce vectors. */
public class EmbeddingGenerationException extends AnalyticsException {

    public EmbeddingGenerationException(String message) {
        super(AnalyticsErrorCode.EMBEDDING_GENERATION, message);
    }

    public EmbeddingGenerationException(String message, Throwable cause) {
        super(AnalyticsErrorCode.EMBEDDING_GENERATION, message, cause);
    }
}
