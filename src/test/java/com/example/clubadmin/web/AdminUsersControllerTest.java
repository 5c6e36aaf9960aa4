package com.example.clubadmin.web;

import com.example.clubadmin.domain.User;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.accounts.UserAdminService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.view.InternalResourceViewResolver;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdminUsersControllerTest {

    private UserAdminService users;
    private User admin;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        users = mock(UserAdminService.class);
        CurrentUserService current = mock(CurrentUserService.class);
        admin = User.builder().id(1L).email("admin@example.org").build();
        when(current.currentUser()).thenReturn(admin);
        mvc = MockMvcBuilders.standaloneSetup(new AdminUsersController(users, current))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setViewResolvers(new InternalResourceViewResolver("/WEB-INF/views/", ".html"))
                .build();
    }

    @Test
    void approveFlashesSuccess() throws Exception {
        mvc.perform(post("/admin/users/5/approve"))
                .andExpect(redirectedUrl("/admin/users/5"))
                .andExpect(flash().attribute("successMessage", "User was approved and is now a member!"));
        verify(users).approve(5L, admin);
    }

    @Test
    void failedApprovalFlashesGenericError() throws Exception {
        when(users.approve(eq(5L), any())).thenThrow(new IllegalStateException("not pending"));

        mvc.perform(post("/admin/users/5/approve"))
                .andExpect(redirectedUrl("/admin/users/5"))
                .andExpect(flash().attribute("errorMessage", "Something went wrong"));
    }

    @Test
    void rejectFlashesSuccess() throws Exception {
        mvc.perform(post("/admin/users/6/reject"))
                .andExpect(redirectedUrl("/admin/users/6"))
                .andExpect(flash().attribute("successMessage", "User application was rejected!"));
        verify(users).reject(6L, admin);
    }
}
