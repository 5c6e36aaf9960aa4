package com.example.clubadmin.web.form;

import com.example.clubadmin.domain.Address;
import com.example.clubadmin.domain.BoardPosition;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.domain.UserRole;
import com.example.clubadmin.domain.UserState;
import com.example.clubadmin.service.accounts.UserUpdate;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Admin edit form for a member, including the billing address.
 */
@Getter
@Setter
@NoArgsConstructor
public class UserForm {

    @NotBlank(message = "can't be blank")
    @Size(min = 1, max = 150, message = "should be at most 150 character(s)")
    private String firstName;

    @NotBlank(message = "can't be blank")
    @Size(min = 1, max = 150, message = "should be at most 150 character(s)")
    private String lastName;

    @NotBlank(message = "can't be blank")
    @Email(message = "must have the @ sign and no spaces")
    @Size(max = 160, message = "should be at most 160 character(s)")
    private String email;

    @Size(max = 25, message = "should be at most 25 character(s)")
    private String phoneNumber;

    @NotNull(message = "can't be blank")
    private UserRole role;

    @NotNull(message = "can't be blank")
    private UserState state;

    private BoardPosition boardPosition;

    @Size(max = 255) private String addressLine1;
    @Size(max = 255) private String addressLine2;
    @Size(max = 100) private String city;
    @Size(max = 100) private String region;
    @Size(max = 20) private String postalCode;
    @Size(max = 2) private String country;

    public static UserForm from(User user) {
        UserForm form = new UserForm();
        form.setFirstName(user.getFirstName());
        form.setLastName(user.getLastName());
        form.setEmail(user.getEmail());
        form.setPhoneNumber(user.getPhoneNumber());
        form.setRole(user.getRole());
        form.setState(user.getState());
        form.setBoardPosition(user.getBoardPosition());
        Address a = user.getBillingAddress();
        if (a != null) {
            form.setAddressLine1(a.getLine1());
            form.setAddressLine2(a.getLine2());
            form.setCity(a.getCity());
            form.setRegion(a.getRegion());
            form.setPostalCode(a.getPostalCode());
            form.setCountry(a.getCountry());
        }
        return form;
    }

    public UserUpdate toUpdate() {
        Address address = null;
        if (addressLine1 != null && !addressLine1.isBlank()) {
            address = new Address();
            address.setLine1(addressLine1.trim());
            address.setLine2(addressLine2);
            address.setCity(city);
            address.setRegion(region);
            address.setPostalCode(postalCode);
            address.setCountry(country);
        }
        return UserUpdate.builder()
                .firstName(firstName.trim())
                .lastName(lastName.trim())
                .email(email.trim())
                .phoneNumber(phoneNumber)
                .role(role)
                .state(state)
                .boardPosition(boardPosition)
                .billingAddress(address)
                .build();
    }
}
