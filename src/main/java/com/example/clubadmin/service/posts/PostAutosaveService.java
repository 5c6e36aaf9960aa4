package com.example.clubadmin.service.posts;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.sse.SseEventPublisher;
import com.example.clubadmin.util.KeyedDebouncer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Editor autosave: validates right away, saves after the debounce window and
 * then announces {@code saved} on the post's channel.
 */
@Slf4j
@Service
public class PostAutosaveService {

    public static final String EVENT_SAVED = "saved";

    private final PostService postService;
    private final SseEventPublisher events;
    private final KeyedDebouncer<Long> debouncer;
    private final Duration debounce;

    public PostAutosaveService(PostService postService,
                               SseEventPublisher events,
                               @Qualifier("autosaveScheduler") TaskScheduler scheduler,
                               ClubProperties properties) {
        this.postService = postService;
        this.events = events;
        this.debouncer = new KeyedDebouncer<>(scheduler);
        this.debounce = properties.getPosts().getAutosaveDebounce();
    }

    public static String channelFor(Long postId) {
        return "post:" + postId;
    }

    /**
     * @return the validation errors of the edit; the save is only scheduled when there are none
     */
    public Map<String, List<String>> submit(Long postId, PostEdit edit) {
        Map<String, List<String>> errors = postService.validate(postId, edit);
        if (errors.isEmpty()) {
            debouncer.delay(postId, () -> save(postId, edit), debounce);
        }
        return errors;
    }

    public boolean isSavePending(Long postId) {
        return debouncer.isPending(postId);
    }

    private void save(Long postId, PostEdit edit) {
        try {
            postService.applyEdit(postId, edit);
            events.send(channelFor(postId), EVENT_SAVED, postId);
        } catch (IllegalArgumentException ex) {
            // became invalid meanwhile (e.g. slug taken by another post)
            log.warn("Autosave of post {} skipped: {}", postId, ex.getMessage());
        }
    }
}
