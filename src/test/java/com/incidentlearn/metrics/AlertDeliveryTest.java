package com.incidentlearn.metrics;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertDeliveryTest {

    @Test
    void shouldPostAlertJsonWithBearerToken() throws IOException {
        RecordingInterceptor interceptor = new RecordingInterceptor(200);
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(interceptor).build();
        WebhookAlertSink sink = new WebhookAlertSink(client, "http://alerts.invalid/hooks/learning", "s3cret");

        sink.deliver(event());

        assertEquals(1, interceptor.requests.size());
        Request request = interceptor.requests.get(0);
        assertEquals("POST", request.method());
        assertEquals("Bearer s3cret", request.header("Authorization"));
        String body = interceptor.bodies.get(0);
        assertTrue(body.contains("\"ruleName\":\"cycle-failures\""), body);
        assertTrue(body.contains("\"severity\":\"HIGH\""), body);
    }

    @Test
    void shouldSurfaceNonSuccessResponses() {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(new RecordingInterceptor(503)).build();
        WebhookAlertSink sink = new WebhookAlertSink(client, "http://alerts.invalid/hooks/learning", null);

        IOException error = assertThrows(IOException.class, () -> sink.deliver(event()));
        assertTrue(error.getMessage().contains("503"));
    }

    @Test
    void shouldRequireEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> new WebhookAlertSink(new OkHttpClient(), " ", null));
    }

    @Test
    void shouldLogWithoutFailing() {
        new LoggingAlertSink().deliver(event());
    }

    private static AlertEvent event() {
        return new AlertEvent("cycle-failures", MetricNames.CYCLES_FAILED, AlertSeverity.HIGH, 3.0, 0.0, AlertComparator.GREATER_THAN,
                "SUM of cycles failed is 3", Map.of("family", "network"), Instant.parse("2026-01-01T00:00:00Z"));
    }

    private static final class RecordingInterceptor implements Interceptor {
        private final int status;
        private final List<Request> requests = new ArrayList<>();
        private final List<String> bodies = new ArrayList<>();

        private RecordingInterceptor(int status) {
            this.status = status;
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            requests.add(request);
            Buffer buffer = new Buffer();
            if (request.body() != null) {
                request.body().writeTo(buffer);
            }
            bodies.add(buffer.readUtf8());
            return new Response.Builder()
                    .request(request)
                    .protocol(Protocol.HTTP_1_1)
                    .code(status)
                    .message(status == 200 ? "OK" : "Unavailable")
                    .body(ResponseBody.create("{}", MediaType.get("application/json")))
                    .build();
        }
    }
}
