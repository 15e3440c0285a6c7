package com.github.salilvnair.supportrouter.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.engine.exception.RemoteModelException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.model.TurnRecord;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Chat-completions and embeddings over HTTP with a bearer API key. Registered only when
 * {@code supportrouter.remote-model.api-key} is set.
 */
public class HttpRemoteModelClient implements RemoteModelClient, EmbeddingClient {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SupportRouterProperties.RemoteModel config;

    public HttpRemoteModelClient(ObjectMapper objectMapper, SupportRouterProperties properties) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper, properties);
    }

    HttpRemoteModelClient(HttpClient httpClient, ObjectMapper objectMapper, SupportRouterProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getRemoteModel();
    }

    @Override
    public String generate(String prompt, String grounding, List<TurnRecord> history) {
        ObjectNode payload = objectMapper.createObjectNode()
                .put("model", config.getChatModel())
                .put("temperature", config.getTemperature());
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", prompt);
        if (grounding != null && !grounding.isBlank()) {
            messages.addObject().put("role", "system").put("content", grounding);
        }
        for (TurnRecord turn : history) {
            messages.addObject().put("role", turn.isUser() ? "user" : "assistant").put("content", turn.text());
        }

        JsonNode root = post("/chat/completions", payload);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_INVALID_RESPONSE,
                    "Chat completion response has no message content");
        }
        return content.asText().trim();
    }

    @Override
    public float[] embed(String text) {
        ObjectNode payload = objectMapper.createObjectNode()
                .put("model", config.getEmbeddingModel())
                .put("input", text);
        JsonNode vectorNode = post("/embeddings", payload).path("data").path(0).path("embedding");
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_INVALID_RESPONSE,
                    "Embedding response has no vector");
        }
        float[] vector = new float[vectorNode.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) vectorNode.get(i).asDouble();
        }
        return vector;
    }

    private JsonNode post(String path, ObjectNode payload) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.getBaseUrl() + path))
                .timeout(config.getTimeout())
                .header("Authorization", "Bearer " + config.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 429) {
                throw new RemoteModelException(
                        SupportRouterErrorCode.REMOTE_MODEL_RATE_LIMITED,
                        "Remote model rate limited the request");
            }
            if (response.statusCode() >= 300) {
                throw new RemoteModelException(
                        SupportRouterErrorCode.REMOTE_MODEL_CALL_FAILED,
                        "Remote model returned HTTP " + response.statusCode());
            }
            return objectMapper.readTree(response.body());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_CALL_FAILED,
                    "Interrupted while calling remote model", e);
        }
        catch (IOException e) {
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_CALL_FAILED,
                    "Remote model transport error: " + e.getMessage(), e);
        }
    }
}
