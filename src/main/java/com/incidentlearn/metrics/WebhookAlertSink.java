package com.incidentlearn.metrics;

import java.io.IOException;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class WebhookAlertSink implements AlertSink {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String bearerToken;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public WebhookAlertSink(OkHttpClient httpClient, String endpoint, String bearerToken) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("webhook endpoint is required");
        }
        this.endpoint = endpoint;
        this.bearerToken = bearerToken;
    }

    @Override
    public void deliver(AlertEvent event) throws IOException {
        String payload = mapper.writeValueAsString(event);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (bearerToken != null && !bearerToken.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + bearerToken);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Alert webhook returned HTTP " + response.code() + " for rule " + event.ruleName());
            }
        }
    }
}
