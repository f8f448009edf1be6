package me.remotepilot.adapter.inbound.web;

import me.remotepilot.domain.model.RealtimeEvent;
import me.remotepilot.domain.model.RealtimeEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RealtimeFanOutTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private RealtimeFanOut fanOut;

    @BeforeEach
    void setUp() {
        fanOut = new RealtimeFanOut();
    }

    @Test
    void shouldBroadcastToEveryConnectionOfSession() {
        Flux<RealtimeEvent> first = fanOut.register("main", "c1");
        Flux<RealtimeEvent> second = fanOut.register("main", "c2");
        Flux<RealtimeEvent> other = fanOut.register("phone", "c3");
        RealtimeEvent event = RealtimeEvent.of(RealtimeEventType.SCHEDULED_RESULT, Map.of("result", "85%"), NOW);

        fanOut.broadcast("main", event);
        fanOut.deregister("main", "c1");
        fanOut.deregister("main", "c2");
        fanOut.deregister("phone", "c3");

        StepVerifier.create(first).expectNext(event).verifyComplete();
        StepVerifier.create(second).expectNext(event).verifyComplete();
        StepVerifier.create(other).verifyComplete();
    }

    @Test
    void shouldSendToSingleConnection() {
        Flux<RealtimeEvent> target = fanOut.register("main", "c1");
        Flux<RealtimeEvent> bystander = fanOut.register("main", "c2");
        RealtimeEvent event = RealtimeEvent.notification("Connected", "Real-time updates enabled", NOW);

        fanOut.send("main", "c1", event);
        fanOut.deregister("main", "c1");
        fanOut.deregister("main", "c2");

        StepVerifier.create(target).expectNext(event).verifyComplete();
        StepVerifier.create(bystander).verifyComplete();
    }

    @Test
    void shouldCountListenersPerSession() {
        fanOut.register("main", "c1");
        fanOut.register("main", "c2");

        assertEquals(2, fanOut.listenerCount("main"));
        assertEquals(0, fanOut.listenerCount("phone"));

        fanOut.deregister("main", "c1");
        assertEquals(1, fanOut.listenerCount("main"));
    }

    @Test
    void shouldDropConnectionWhoseSubscriberCancelled() {
        Disposable subscription = fanOut.register("main", "c1").subscribe();
        subscription.dispose();

        fanOut.broadcast("main", RealtimeEvent.of(RealtimeEventType.PING, Map.of("pong", true), NOW));

        assertEquals(0, fanOut.listenerCount("main"));
    }

    @Test
    void shouldIgnoreBroadcastWithoutListeners() {
        fanOut.broadcast("nobody", RealtimeEvent.notification("t", "m", NOW));

        assertEquals(0, fanOut.listenerCount("nobody"));
    }
}
