package me.remotepilot.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * Never performs network I/O. Tests enqueue responses or failures in the order
 * requests will be made, and every request is captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final String JSON = "application/json";

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        plannedResults.add(PlannedResult.response(code, body != null ? body : "", JSON));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(PlannedResult.failure(failure));
    }

    /**
     * Fail the next call the way OkHttp reports an elapsed call timeout.
     */
    public void enqueueTimeout() {
        enqueueFailure(new InterruptedIOException("timeout"));
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
        capturedRequests.add(new CapturedRequest(request, readRequestBody(request)));
        requestCount.incrementAndGet();

        PlannedResult planned = plannedResults.poll();
        if (planned == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (planned.failure() != null) {
            throw planned.failure();
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(planned.code())
                .message("mock")
                .body(ResponseBody.create(planned.body(), MediaType.parse(planned.contentType())))
                .build();
    }

    private static String readRequestBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record PlannedResult(int code, String body, String contentType, IOException failure) {
        static PlannedResult response(int code, String body, String contentType) {
            return new PlannedResult(code, body, contentType, null);
        }

        static PlannedResult failure(IOException failure) {
            return new PlannedResult(0, "", JSON, failure);
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

        public String path() {
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
