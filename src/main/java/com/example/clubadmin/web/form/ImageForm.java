package com.example.clubadmin.web.form;

import com.example.clubadmin.domain.Image;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ImageForm {

    @Size(max = 255, message = "should be at most 255 character(s)")
    private String title;

    @Size(max = 255, message = "should be at most 255 character(s)")
    private String altText;

    @Size(max = 1000, message = "should be at most 1000 character(s)")
    private String description;

    public static ImageForm from(Image image) {
        ImageForm form = new ImageForm();
        form.setTitle(image.getTitle());
        form.setAltText(image.getAltText());
        form.setDescription(image.getDescription());
        return form;
    }
}
