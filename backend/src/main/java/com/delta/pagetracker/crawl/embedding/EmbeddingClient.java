package com.delta.pagetracker.crawl.embedding;

/**
 * Produces a retrieval vector for a document version. An empty array means no vector was produced.
 */
public interface EmbeddingClient {

    float[] embed(String text);

    default boolean isEnabled() {
        return true;
    }
}
