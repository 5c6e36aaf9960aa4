package com.example.clubadmin.web;

import com.example.clubadmin.domain.Post;
import com.example.clubadmin.service.posts.PostAutosaveService;
import com.example.clubadmin.service.posts.PostEdit;
import com.example.clubadmin.service.posts.PostService;
import com.example.clubadmin.sse.SseEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Post editor. Changes arrive through {@code autosave}; a {@code saved} event on the post's
 * SSE channel tells the page to reload the post.
 */
@Slf4j
@Controller
@RequestMapping("/admin/posts/{id}")
@RequiredArgsConstructor
public class AdminPostEditorController {

    static final Set<String> DEVICES = Set.of("phone", "tablet", "computer");

    private final PostService postService;
    private final PostAutosaveService autosaveService;
    private final SseEventPublisher events;

    @GetMapping
    public String editor(@PathVariable Long id, Model model) {
        model.addAttribute("post", postService.get(id));
        model.addAttribute("savePending", autosaveService.isSavePending(id));
        return "admin/posts/editor";
    }

    @PostMapping(path = "/autosave", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public Map<String, Object> autosave(@PathVariable Long id,
                                        @RequestParam(required = false) String title,
                                        @RequestParam(required = false) String urlName,
                                        @RequestParam(required = false) String previewText,
                                        @RequestParam(required = false) String body,
                                        @RequestParam(required = false) Boolean featuredPost) {
        postService.get(id);
        Map<String, List<String>> errors = autosaveService.submit(id,
                new PostEdit(title, urlName, previewText, body, featuredPost));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("errors", errors);
        response.put("saving", errors.isEmpty());
        return response;
    }

    /** Returns the current post, used by the editor after a {@code saved} event. */
    @GetMapping(path = "/json", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public Map<String, Object> current(@PathVariable Long id) {
        Post post = postService.get(id);
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", post.getId());
        json.put("title", post.getTitle());
        json.put("urlName", post.getUrlName());
        json.put("previewText", post.getPreviewText());
        json.put("body", post.getBody());
        json.put("featuredPost", post.isFeaturedPost());
        json.put("state", post.getState().name());
        json.put("updatedAt", post.getUpdatedAt() == null ? null : post.getUpdatedAt().toString());
        return json;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @ResponseBody
    public SseEmitter subscribe(@PathVariable Long id) {
        return events.register(PostAutosaveService.channelFor(id));
    }

    @PostMapping("/publish")
    public String publish(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        try {
            postService.publish(id);
            redirectAttributes.addFlashAttribute("successMessage", "The post was published!");
        } catch (IllegalStateException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return "redirect:/admin/posts/" + id;
    }

    @PostMapping("/restore")
    public String restore(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        postService.restore(id);
        redirectAttributes.addFlashAttribute("successMessage", "The post recovered.");
        return "redirect:/admin/posts/" + id;
    }

    @PostMapping("/delete")
    public String delete(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        postService.delete(id);
        redirectAttributes.addFlashAttribute("successMessage", "The post was deleted.");
        return "redirect:/admin/posts/" + id;
    }

    @GetMapping("/preview")
    public String preview(@PathVariable Long id,
                          @RequestParam(defaultValue = "computer") String device,
                          Model model) {
        model.addAttribute("post", postService.get(id));
        model.addAttribute("device", DEVICES.contains(device) ? device : "computer");
        return "admin/posts/preview";
    }
}
