package com.github.salilvnair.supportrouter.llm;

public interface EmbeddingClient {
    float[] embed(String text);
}
