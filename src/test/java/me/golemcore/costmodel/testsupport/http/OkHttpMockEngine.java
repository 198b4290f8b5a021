package me.golemcore.costmodel.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * This interceptor never performs network I/O. Responses are either enqueued
 * in order, or routed by a fragment of the {@code query} parameter so that
 * concurrent query batches get deterministic answers. Every request is
 * captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final Map<String, PlannedResult> routedResults = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<CapturedRequest> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public static OkHttpClient clientWith(OkHttpMockEngine engine) {
        return new OkHttpClient.Builder().addInterceptor(engine).build();
    }

    public void enqueueJson(int code, String body) {
        plannedResults.add(PlannedResult.response(code, body, DEFAULT_CONTENT_TYPE));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(PlannedResult.failure(failure));
    }

    /**
     * Answer every request whose {@code query} parameter contains the fragment.
     */
    public void routeJson(String queryFragment, int code, String body) {
        routedResults.put(queryFragment, PlannedResult.response(code, body, DEFAULT_CONTENT_TYPE));
    }

    public void routeFailure(String queryFragment, IOException failure) {
        routedResults.put(queryFragment, PlannedResult.failure(failure));
    }

    public CapturedRequest takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(new CapturedRequest(request));
        requestCount.incrementAndGet();

        PlannedResult plannedResult = route(request.url().queryParameter("query"));
        if (plannedResult == null) {
            plannedResult = plannedResults.poll();
        }
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        ResponseBody responseBody = ResponseBody.create(plannedResult.body(),
                MediaType.parse(plannedResult.contentType()));

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .headers(Headers.of())
                .body(responseBody)
                .build();
    }

    private PlannedResult route(String query) {
        if (query == null) {
            return null;
        }
        for (Map.Entry<String, PlannedResult> entry : routedResults.entrySet()) {
            if (query.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private record PlannedResult(int code, byte[] body, String contentType, IOException failure) {
        static PlannedResult response(int code, String body, String contentType) {
            byte[] bytes = body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0];
            return new PlannedResult(code, bytes, contentType, null);
        }

        static PlannedResult failure(IOException failure) {
            return new PlannedResult(0, new byte[0], null, failure);
        }
    }

    public static final class CapturedRequest {
        private final Request request;

        private CapturedRequest(Request request) {
            this.request = request;
        }

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String queryParameter(String name) {
            return request.url().queryParameter(name);
        }

        public Headers headers() {
            return request.headers();
        }
    }
}
