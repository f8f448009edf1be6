package me.remotepilot.adapter.outbound.agent;

import me.remotepilot.domain.model.ToolDefinition;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.infrastructure.config.AutoConfiguration;
import me.remotepilot.infrastructure.config.PilotProperties;
import me.remotepilot.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionAgentClientTest {

    private OkHttpMockEngine httpEngine;
    private PilotProperties properties;
    private ExecutionAgentClient client;
    private AtomicInteger ioTasks;

    @BeforeEach
    void setUp() {
        ioTasks = new AtomicInteger();
        Executor ioExecutor = command -> {
            ioTasks.incrementAndGet();
            command.run();
        };
        httpEngine = new OkHttpMockEngine();
        properties = new PilotProperties();
        properties.getAgent().setUrl("http://agent.test:3847/");
        properties.getAgent().setAuthToken("bridge-token");
        client = new ExecutionAgentClient(properties,
                new OkHttpClient.Builder().addInterceptor(httpEngine).build(),
                AutoConfiguration.objectMapper(), ioExecutor);
    }

    @Test
    void shouldFetchToolCatalogWithBearerToken() {
        httpEngine.enqueueJson(200, """
                {"tools":[{"name":"battery_status","description":"Battery level","inputSchema":{"type":"object"}},
                          {"name":"music_play","description":"Play music","extra":true}]}
                """);

        List<ToolDefinition> tools = client.listTools().join();

        assertEquals(2, tools.size());
        assertEquals("battery_status", tools.get(0).getName());
        assertEquals("object", tools.get(0).getInputSchema().get("type"));
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/tools", request.path());
        assertEquals("Bearer bridge-token", request.header("Authorization"));
    }

    @Test
    void shouldReturnEmptyCatalogOnHttpError() {
        httpEngine.enqueueJson(503, "{}");

        assertTrue(client.listTools().join().isEmpty());
    }

    @Test
    void shouldReturnEmptyCatalogWhenUnreachable() {
        httpEngine.enqueueFailure(new ConnectException("Connection refused"));

        assertTrue(client.listTools().join().isEmpty());
    }

    @Test
    void shouldPostToolCall() {
        httpEngine.enqueueJson(200, "{\"success\":true,\"result\":\"85% charging\"}");

        ToolResult result = client.invoke("battery_status", Map.of("verbose", true)).join();

        assertTrue(result.isSuccess());
        assertEquals("85% charging", result.getResult());
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/execute", request.path());
        assertEquals("{\"tool\":\"battery_status\",\"args\":{\"verbose\":true}}", request.body());
    }

    @Test
    void shouldSendEmptyArgsWhenNull() {
        httpEngine.enqueueJson(200, "{\"success\":true,\"result\":\"ok\"}");

        client.invoke("lock_screen", null).join();

        assertEquals("{\"tool\":\"lock_screen\",\"args\":{}}", httpEngine.takeRequest().body());
    }

    @Test
    void shouldPassThroughAgentReportedFailure() {
        httpEngine.enqueueJson(400, "{\"success\":false,\"error\":\"Unknown tool: foo\"}");

        ToolResult result = client.invoke("foo", Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Unknown tool: foo", result.getError());
    }

    @Test
    void shouldParseImageAttachment() {
        httpEngine.enqueueJson(200,
                "{\"success\":true,\"result\":\"Captured\",\"image\":{\"data\":\"iVBORw0\",\"mimeType\":\"image/png\"}}");

        ToolResult result = client.invoke("screenshot", Map.of()).join();

        assertEquals("image/png", result.getImage().getMimeType());
        assertEquals("iVBORw0", result.getImage().getData());
    }

    @Test
    void shouldReportTimeout() {
        httpEngine.enqueueTimeout();

        ToolResult result = client.invoke("battery_status", Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Timeout", result.getError());
    }

    @Test
    void shouldReportUnreachableAgent() {
        httpEngine.enqueueFailure(new ConnectException("Connection refused"));

        ToolResult result = client.invoke("battery_status", Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Bridge unreachable", result.getError());
        assertEquals(1, httpEngine.getRequestCount());
    }

    @Test
    void shouldOmitAuthorizationWithoutToken() {
        properties.getAgent().setAuthToken("");
        httpEngine.enqueueJson(200, "{}");

        assertTrue(client.health().join());
        assertNull(httpEngine.takeRequest().header("Authorization"));
    }

    @Test
    void shouldReportHealthFromStatusCode() {
        httpEngine.enqueueJson(500, "{}");
        httpEngine.enqueueFailure(new ConnectException("Connection refused"));

        assertFalse(client.health().join());
        assertFalse(client.health().join());
    }

    @Test
    void shouldReturnEmptyCatalogForNullBody() {
        httpEngine.enqueueJson(200, "null");

        assertTrue(client.listTools().join().isEmpty());
    }

    @Test
    void shouldReturnEmptyCatalogWhenToolsMissing() {
        httpEngine.enqueueJson(200, "{\"status\":\"ok\"}");

        assertTrue(client.listTools().join().isEmpty());
    }

    @Test
    void shouldReportUnreachableForNullResult() {
        httpEngine.enqueueJson(200, "null");

        ToolResult result = client.invoke("battery_status", Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Bridge unreachable", result.getError());
    }

    @Test
    void shouldDegradeGracefullyWithMalformedAgentUrl() {
        properties.getAgent().setUrl("not a url");

        assertTrue(client.listTools().join().isEmpty());
        assertEquals("Bridge unreachable", client.invoke("battery_status", Map.of()).join().getError());
        assertFalse(client.health().join());
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldRunEveryCallOnSuppliedExecutor() {
        httpEngine.enqueueJson(200, "{\"tools\":[]}");
        httpEngine.enqueueJson(200, "{\"success\":true,\"result\":\"ok\"}");
        httpEngine.enqueueJson(200, "{}");

        client.listTools().join();
        client.invoke("battery_status", Map.of()).join();
        client.health().join();

        assertEquals(3, ioTasks.get());
    }
}
