package com.delta.pagetracker.crawl.embedding;

public class DisabledEmbeddingClient implements EmbeddingClient {

    @Override
    public float[] embed(String text) {
        return new float[0];
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
