package com.example.clubadmin.web;

import com.example.clubadmin.domain.Post;
import com.example.clubadmin.domain.PostState;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.posts.PostSearchCriteria;
import com.example.clubadmin.service.posts.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.Set;

@Slf4j
@Controller
@RequestMapping("/admin/posts")
@RequiredArgsConstructor
public class AdminPostsController {

    static final String CREATE_FAILED = "Something went wrong try again.";

    private final PostService postService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public String list(@RequestParam(name = "state", required = false) Set<PostState> states,
                       @RequestParam(required = false) Long author,
                       @RequestParam(defaultValue = "1") int page,
                       @RequestParam(defaultValue = "updatedAt") String sort,
                       @RequestParam(defaultValue = "desc") String dir,
                       Model model) {
        model.addAttribute("posts", postService.list(new PostSearchCriteria(states, author),
                page, PostService.DEFAULT_PAGE_SIZE, sort, dir));
        model.addAttribute("authors", postService.authors());
        model.addAttribute("allStates", PostState.values());
        model.addAttribute("selectedStates", states == null ? Set.of() : states);
        model.addAttribute("selectedAuthor", author);
        model.addAttribute("sort", sort);
        model.addAttribute("dir", dir);
        return "admin/posts/list";
    }

    @PostMapping
    public String create(@RequestParam(required = false) String title, RedirectAttributes redirectAttributes) {
        try {
            Post post = postService.create(title, currentUserService.currentUser());
            return "redirect:/admin/posts/" + post.getId();
        } catch (Exception e) {
            log.error("Creating post '{}' failed", title, e);
            redirectAttributes.addFlashAttribute("errorMessage", CREATE_FAILED);
            return "redirect:/admin/posts";
        }
    }

    @PostMapping("/untitled")
    public String createUntitled(RedirectAttributes redirectAttributes) {
        try {
            Post post = postService.createUntitled(currentUserService.currentUser());
            return "redirect:/admin/posts/" + post.getId();
        } catch (Exception e) {
            log.error("Creating untitled post failed", e);
            redirectAttributes.addFlashAttribute("errorMessage", CREATE_FAILED);
            return "redirect:/admin/posts";
        }
    }
}
