package me.golemcore.autotest.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * This interceptor never performs network I/O. Tests enqueue responses (or
 * failures), and every request is captured for assertions. Responses may carry
 * headers, which MCP tests use for {@code Mcp-Session-Id}.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String EVENT_STREAM_CONTENT_TYPE = "text/event-stream";

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueJson(int code, String body) {
        enqueueJson(code, body, Map.of());
    }

    public void enqueueJson(int code, String body, Map<String, String> headers) {
        enqueue(code, body, JSON_CONTENT_TYPE, headers);
    }

    /**
     * Enqueues a {@code text/event-stream} body with one {@code data:} event per
     * message.
     */
    public void enqueueEventStream(int code, Map<String, String> headers, String... messages) {
        StringBuilder stream = new StringBuilder();
        for (String message : messages) {
            stream.append("event: message\n").append("data: ").append(message).append("\n\n");
        }
        enqueue(code, stream.toString(), EVENT_STREAM_CONTENT_TYPE, headers);
    }

    public void enqueueText(int code, String body, String contentType) {
        enqueue(code, body, contentType, Map.of());
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(PlannedResult.failure(failure));
    }

    public CapturedRequest takeRequest() {
        return capturedRequests.poll();
    }

    public List<CapturedRequest> allRequests() {
        return new ArrayList<>(capturedRequests);
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String requestBody = readRequestBody(request);
        capturedRequests.add(new CapturedRequest(request, requestBody));
        requestCount.incrementAndGet();

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        MediaType mediaType = plannedResult.contentType() != null
                ? MediaType.parse(plannedResult.contentType())
                : null;
        ResponseBody responseBody = ResponseBody.create(plannedResult.body(), mediaType);

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .headers(Headers.of(plannedResult.headers()))
                .body(responseBody)
                .build();
    }

    private void enqueue(int code, String body, String contentType, Map<String, String> headers) {
        byte[] bytes = body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0];
        plannedResults.add(new PlannedResult(code, bytes, contentType, headers, null));
    }

    private String readRequestBody(Request request) throws IOException {
        RequestBody requestBody = request.body();
        if (requestBody == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        requestBody.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record PlannedResult(int code, byte[] body, String contentType, Map<String, String> headers,
            IOException failure) {
        static PlannedResult failure(IOException failure) {
            return new PlannedResult(0, new byte[0], null, Map.of(), failure);
        }
    }

    public static final class CapturedRequest {
        private final Request request;
        private final String body;

        private CapturedRequest(Request request, String body) {
            this.request = request;
            this.body = body;
        }

        public String method() {
            return request.method();
        }

        public String target() {
            return request.url().encodedPath();
        }

        public String header(String name) {
            return request.header(name);
        }

        public String body() {
            return body;
        }
    }
}
