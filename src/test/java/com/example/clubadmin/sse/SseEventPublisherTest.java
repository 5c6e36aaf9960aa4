package com.example.clubadmin.sse;

import com.example.clubadmin.config.ClubProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SseEventPublisherTest {

    private final SseEventPublisher publisher = new SseEventPublisher(new ClubProperties());

    @Test
    void sendWithoutListenersReachesNobody() {
        assertThat(publisher.send("exporter:1", "progress", 10)).isZero();
    }

    @Test
    void everyListenerOnTheChannelIsCounted() {
        publisher.register("post:5");
        publisher.register("post:5");
        publisher.register("post:6");

        assertThat(publisher.listenerCount("post:5")).isEqualTo(2);
        assertThat(publisher.send("post:5", "saved", 5L)).isEqualTo(2);
        assertThat(publisher.send("post:6", "saved", 6L)).isEqualTo(1);
    }

    @Test
    void completedListenersAreDropped() {
        SseEmitter gone = publisher.register("exporter:2");
        publisher.register("exporter:2");
        gone.complete();

        assertThat(publisher.send("exporter:2", "progress", 50)).isEqualTo(1);
        assertThat(publisher.listenerCount("exporter:2")).isEqualTo(1);
    }

    @Test
    void streamsTimeOutAfterTheConfiguredPeriod() {
        assertThat(publisher.register("post:7").getTimeout()).isEqualTo(Duration.ofMinutes(30).toMillis());

        ClubProperties shortLived = new ClubProperties();
        shortLived.setSseTimeout(Duration.ofSeconds(45));
        assertThat(new SseEventPublisher(shortLived).register("post:7").getTimeout()).isEqualTo(45_000L);
    }
}
