package com.example.clubadmin.web;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.Image;
import com.example.clubadmin.repository.ImageRepository;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.media.MediaPage;
import com.example.clubadmin.service.media.MediaService;
import com.example.clubadmin.service.storage.ObjectStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.view.InternalResourceViewResolver;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdminMediaControllerTest {

    private ImageRepository images;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        images = mock(ImageRepository.class);
        MediaService media = new MediaService(images, mock(ObjectStorage.class), new ClubProperties(),
                mock(ApplicationEventPublisher.class));
        mvc = MockMvcBuilders.standaloneSetup(
                        new AdminMediaController(media, mock(ObjectStorage.class), mock(CurrentUserService.class)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setViewResolvers(new InternalResourceViewResolver("/WEB-INF/views/", ".html"))
                .build();
    }

    @Test
    void previousFromAnOverrunStartsAtPageOne() throws Exception {
        when(images.findAllByOrderByCreatedAtDescIdDesc(any(Pageable.class))).thenReturn(List.of(new Image()));
        when(images.count()).thenReturn(1L);

        MvcResult result = mvc.perform(get("/admin/media").param("page", "6").param("overran", "true"))
                .andExpect(status().isOk())
                .andExpect(view().name("admin/media/gallery"))
                .andReturn();

        MediaPage page = (MediaPage) result.getModelAndView().getModel().get("media");
        assertThat(page.page()).isEqualTo(1);
        assertThat(page.endOfTimeline()).isTrue();
        assertThat(page.totalCount()).isEqualTo(1L);
        verify(images).findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, 20));
    }

    @Test
    void requestedPageIsKeptWithoutOverrun() throws Exception {
        when(images.findAllByOrderByCreatedAtDescIdDesc(any(Pageable.class))).thenReturn(List.of());

        MvcResult result = mvc.perform(get("/admin/media").param("page", "3")).andReturn();

        assertThat(((MediaPage) result.getModelAndView().getModel().get("media")).page()).isEqualTo(3);
        verify(images).findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(2, 20));
    }
}
