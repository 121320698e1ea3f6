package com.millennicare.identity.dto;

import com.millennicare.identity.Validators.StrongPassword;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignUpRequest {

    @NotBlank(message = "Email cannot be empty")
    @Email(message = "Email is not valid")
    @Size(max = 320)
    private String email;

    @ToString.Exclude
    @NotBlank(message = "Password cannot be empty")
    @StrongPassword
    private String password;

    @NotBlank(message = "Name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 100)
    private String firstName;

    @Size(max = 100)
    private String lastName;

    @NotEmpty(message = "At least one role is required")
    private Set<@NotBlank String> roles;
}
