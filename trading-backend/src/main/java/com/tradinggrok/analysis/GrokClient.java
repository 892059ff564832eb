package com.tradinggrok.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradinggrok.config.Config;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Client for the xAI chat completions API.
 */
public class GrokClient {
    private static final Logger logger = LoggerFactory.getLogger(GrokClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final double TEMPERATURE = 0.3;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String apiKey;
    private final String model;

    public GrokClient(Config config) {
        this(config.grokUrl(), config.grokApiKey(), config.grokModel());
    }

    public GrokClient(String url, String apiKey, String model) {
        this.url = url;
        this.apiKey = apiKey;
        this.model = model;
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        logger.info("🤖 Grok client initialized - Model: {}", model);
    }

    /**
     * Send one system and one user message.
     *
     * @return the content of the first choice
     * @throws IOException on transport failure, a non-2xx status or a response without content
     */
    public String complete(String systemPrompt, String userPrompt) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        var messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        payload.put("model", model)
            .put("stream", false)
            .put("temperature", TEMPERATURE);

        RequestBody body = RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        Request request = new Request.Builder()
            .url(url)
            .addHeader("Authorization", "Bearer " + apiKey)
            .addHeader("Content-Type", "application/json")
            .post(body)
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Grok API error: " + response.code() + " - " + text);
            }

            JsonNode content = objectMapper.readTree(text).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new IOException("Grok response has no message content");
            }
            logger.debug("Grok answered with {} characters", content.asText().length());
            return content.asText();
        }
    }
}
