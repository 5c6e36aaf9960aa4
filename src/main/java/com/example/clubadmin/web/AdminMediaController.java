package com.example.clubadmin.web;

import com.example.clubadmin.domain.Image;
import com.example.clubadmin.domain.ImageVersion;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.media.MediaService;
import com.example.clubadmin.service.media.UploadRejectedException;
import com.example.clubadmin.service.storage.ObjectStorage;
import com.example.clubadmin.web.form.ImageForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.io.IOException;
import java.util.List;

@Slf4j
@Controller
@RequestMapping("/admin/media")
@RequiredArgsConstructor
public class AdminMediaController {

    private final MediaService mediaService;
    private final ObjectStorage storage;
    private final CurrentUserService currentUserService;

    /**
     * @param overran set by the previous-page link of an empty page past the end
     */
    @GetMapping
    public String gallery(@RequestParam(defaultValue = "1") int page,
                          @RequestParam(defaultValue = "false") boolean overran,
                          Model model) {
        model.addAttribute("media", mediaService.page(page, overran));
        return "admin/media/gallery";
    }

    @PostMapping("/upload")
    public String upload(@RequestParam(name = "files", required = false) List<MultipartFile> files,
                         RedirectAttributes redirectAttributes) {
        try {
            List<Image> saved = mediaService.upload(files, currentUserService.currentUser());
            if (saved.isEmpty()) {
                redirectAttributes.addFlashAttribute("errorMessage", "Select at least one file");
            } else {
                redirectAttributes.addFlashAttribute("successMessage",
                        saved.size() == 1 ? "1 image uploaded" : saved.size() + " images uploaded");
            }
        } catch (UploadRejectedException e) {
            redirectAttributes.addFlashAttribute("errorMessage",
                    e.getFileName() == null ? e.getMessage() : e.getFileName() + ": " + e.getMessage());
        }
        return "redirect:/admin/media";
    }

    @GetMapping("/{id}")
    public String edit(@PathVariable Long id,
                       @RequestParam(defaultValue = "optimized") String version,
                       Model model) {
        Image image = mediaService.get(id);
        if (!model.containsAttribute("imageForm")) {
            model.addAttribute("imageForm", ImageForm.from(image));
        }
        populate(model, image, version);
        return "admin/media/edit";
    }

    @PostMapping("/{id}")
    public String update(@PathVariable Long id,
                         @Valid @ModelAttribute("imageForm") ImageForm form,
                         BindingResult binding,
                         Model model,
                         RedirectAttributes redirectAttributes) {
        if (binding.hasErrors()) {
            populate(model, mediaService.get(id), "optimized");
            return "admin/media/edit";
        }
        mediaService.update(id, form.getTitle(), form.getAltText(), form.getDescription());
        redirectAttributes.addFlashAttribute("successMessage", "Image updated");
        return "redirect:/admin/media/" + id;
    }

    @PostMapping("/{id}/delete")
    public String delete(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        mediaService.delete(id);
        redirectAttributes.addFlashAttribute("successMessage", "Image deleted");
        return "redirect:/admin/media";
    }

    /** Streams a stored rendition. */
    @GetMapping("/{id}/file")
    public ResponseEntity<Resource> file(@PathVariable Long id,
                                         @RequestParam(defaultValue = "optimized") String version) throws IOException {
        Image image = mediaService.get(id);
        String key = image.pathFor(ImageVersion.parse(version));
        if (key == null) {
            return ResponseEntity.notFound().build();
        }
        MediaType type = MediaTypeFactory.getMediaType(key).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return storage.open(key)
                .<ResponseEntity<Resource>>map(in -> ResponseEntity.ok().contentType(type).body(new InputStreamResource(in)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static void populate(Model model, Image image, String version) {
        ImageVersion selected = ImageVersion.parse(version);
        model.addAttribute("image", image);
        model.addAttribute("version", selected);
        model.addAttribute("versions", ImageVersion.values());
        model.addAttribute("versionPath", image.pathFor(selected));
    }
}
