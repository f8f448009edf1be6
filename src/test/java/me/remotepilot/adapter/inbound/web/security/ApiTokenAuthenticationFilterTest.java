package me.remotepilot.adapter.inbound.web.security;

import me.remotepilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.web.server.WebFilterChain;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiTokenAuthenticationFilterTest {

    private ApiTokenAuthenticationFilter filter;
    private AtomicReference<Authentication> captured;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        PilotProperties properties = new PilotProperties();
        properties.getSecurity().setApiSecret("s3cret");
        filter = new ApiTokenAuthenticationFilter(new ApiTokenAuthenticator(properties));
        captured = new AtomicReference<>();
        chain = exchange -> ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .doOnNext(captured::set)
                .then();
    }

    @Test
    void shouldAuthenticateValidBearerToken() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer s3cret"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertEquals(ApiTokenAuthenticationFilter.PRINCIPAL, captured.get().getPrincipal());
        assertTrue(captured.get().isAuthenticated());
    }

    @Test
    void shouldPassThroughWithoutAuthenticationForWrongToken() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer nope"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertNull(captured.get());
    }

    @Test
    void shouldIgnoreNonBearerScheme() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Basic czNjcmV0"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertNull(captured.get());
    }
}
