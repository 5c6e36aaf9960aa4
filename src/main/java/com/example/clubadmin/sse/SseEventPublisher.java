package com.example.clubadmin.sse;

import com.example.clubadmin.config.ClubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * In-process fan-out of server-sent events keyed by channel
 * ({@code exporter:42}, {@code post:17}). Several browser tabs may listen on one channel.
 */
@Slf4j
@Component
public class SseEventPublisher {

    private final Map<String, Set<SseEmitter>> channels = new ConcurrentHashMap<>();
    private final Duration timeout;

    @Autowired
    public SseEventPublisher(ClubProperties properties) {
        this(properties.getSseTimeout());
    }

    SseEventPublisher(Duration timeout) {
        this.timeout = timeout;
    }

    /** Streams close after the configured timeout and are removed from the channel. */
    public SseEmitter register(String channel) {
        SseEmitter emitter = new SseEmitter(timeout.toMillis());
        Set<SseEmitter> listeners = channels.computeIfAbsent(channel, k -> new CopyOnWriteArraySet<>());
        listeners.add(emitter);
        emitter.onCompletion(() -> remove(channel, emitter));
        emitter.onTimeout(() -> {
            remove(channel, emitter);
            emitter.complete();
        });
        emitter.onError(ex -> remove(channel, emitter));
        return emitter;
    }

    /**
     * Sends to every listener on the channel. Listeners whose connection is gone are dropped.
     *
     * @return number of listeners the event reached
     */
    public int send(String channel, String event, Object data) {
        Set<SseEmitter> listeners = channels.get(channel);
        if (listeners == null || listeners.isEmpty()) {
            log.debug("No listeners on {} for {}", channel, event);
            return 0;
        }
        int delivered = 0;
        for (SseEmitter emitter : listeners) {
            try {
                emitter.send(SseEmitter.event().name(event).data(data));
                delivered++;
            } catch (IOException | IllegalStateException ex) {
                log.debug("Dropping listener on {}: {}", channel, ex.getMessage());
                remove(channel, emitter);
            }
        }
        return delivered;
    }

    public int listenerCount(String channel) {
        Set<SseEmitter> listeners = channels.get(channel);
        return listeners == null ? 0 : listeners.size();
    }

    private void remove(String channel, SseEmitter emitter) {
        channels.computeIfPresent(channel, (k, set) -> {
            set.remove(emitter);
            return set.isEmpty() ? null : set;
        });
    }
}
