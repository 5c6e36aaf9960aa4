package com.example.clubadmin.web.form;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreditForm {

    @NotNull(message = "can't be blank")
    private Long userId;

    @NotBlank(message = "can't be blank")
    private String amount;

    @NotBlank(message = "can't be blank")
    @Size(min = 1, max = 1000, message = "should be at most 1000 character(s)")
    private String reason;

    @NotBlank(message = "can't be blank")
    private String entityType = "administration";

    @Size(max = 255)
    private String entityId;
}
