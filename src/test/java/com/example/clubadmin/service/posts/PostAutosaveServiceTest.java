package com.example.clubadmin.service.posts;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.sse.SseEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PostAutosaveServiceTest {

    private ThreadPoolTaskScheduler scheduler;
    private PostService postService;
    private SseEventPublisher events;
    private PostAutosaveService autosave;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        postService = mock(PostService.class);
        events = mock(SseEventPublisher.class);
        ClubProperties properties = new ClubProperties();
        properties.getPosts().setAutosaveDebounce(Duration.ofMillis(100));
        autosave = new PostAutosaveService(postService, events, scheduler, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void burstOfEditsIsSavedOnceAndAnnounced() {
        when(postService.validate(eq(9L), any())).thenReturn(Map.of());
        PostEdit last = new PostEdit("Third", null, null, null, null);

        autosave.submit(9L, new PostEdit("First", null, null, null, null));
        autosave.submit(9L, new PostEdit("Second", null, null, null, null));
        autosave.submit(9L, last);
        assertThat(autosave.isSavePending(9L)).isTrue();

        verify(events, timeout(3000)).send("post:9", PostAutosaveService.EVENT_SAVED, 9L);
        verify(postService, times(1)).applyEdit(9L, last);
        verify(postService, never()).applyEdit(eq(9L), eq(new PostEdit("First", null, null, null, null)));
    }

    @Test
    void invalidEditIsNotScheduled() {
        when(postService.validate(eq(9L), any())).thenReturn(Map.of("title", List.of("can't be blank")));

        Map<String, List<String>> errors = autosave.submit(9L, new PostEdit("", null, null, null, null));

        assertThat(errors).containsKey("title");
        assertThat(autosave.isSavePending(9L)).isFalse();
        verify(postService, after(300).never()).applyEdit(any(), any());
    }
}
